package com.studytrack.badges.exception;

/**
 * 目录数据引用了不支持的规则类型。属于数据完整性缺陷，不是用户错误。
 */
public class UnknownRequirementKindException extends BadgeEngineException {

    private final String requirementType;

    public UnknownRequirementKindException(String requirementType) {
        super(ErrorType.UNKNOWN_REQUIREMENT_KIND, "Unknown requirement type: " + requirementType);
        this.requirementType = requirementType;
    }

    public String getRequirementType() {
        return requirementType;
    }
}
