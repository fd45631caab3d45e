package com.studytrack.badges.badge;

import com.studytrack.badges.exception.UnknownRequirementKindException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 徽章规则类型。目录中 requirement_type 的文本通过 {@link #fromCode(String)} 解析，
 * 旧数据中的别名（session_count / sessions_count）同样被接受。
 */
public enum RequirementType {
    TOTAL_SESSIONS("total_sessions", "session_count", "sessions_count"),
    TOTAL_MINUTES("total_minutes"),
    STREAK_DAYS("streak_days"),
    EFFICIENCY_THRESHOLD("efficiency_threshold"),
    DAILY_MINUTES("daily_minutes");

    private static final Map<String, RequirementType> BY_CODE = new HashMap<>();

    static {
        for (RequirementType type : values()) {
            for (String code : type.codes) {
                BY_CODE.put(code, type);
            }
        }
    }

    private final String[] codes;

    RequirementType(String... codes) {
        this.codes = codes;
    }

    /**
     * 规范的规则编码（写入目录时应使用此值）
     */
    public String getCode() {
        return codes[0];
    }

    public static RequirementType fromCode(String code) {
        RequirementType type = code == null ? null : BY_CODE.get(code.trim().toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new UnknownRequirementKindException(code);
        }
        return type;
    }
}
