package com.studytrack.badges.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 对应数据库表 badges（徽章目录，对引擎只读）
 */
@Entity
@Table(name = "badges")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Badge {

    /**
     * 徽章的唯一 KEY，如 first_session (id VARCHAR(50) Primary Key)
     */
    @Id
    @Column(name = "id", length = 50)
    private String id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Lob
    @Column(name = "description")
    private String description;

    /**
     * 图标（emoji 或图片地址）
     */
    @Column(name = "icon_url", length = 500)
    private String icon;

    /**
     * 分组标签，如 streak / session / milestone
     */
    @Column(name = "category", nullable = false, length = 50)
    private String category;

    /**
     * 规则类型的原始文本，由 RequirementType.fromCode 解析；
     * 保持字符串是为了让目录中的脏数据在评估时暴露出来，而不是在加载时被丢弃。
     */
    @Column(name = "requirement_type", nullable = false, length = 100)
    private String requirementType;

    @Column(name = "requirement_value", nullable = false, precision = 10, scale = 2)
    private BigDecimal requirementValue;

    /**
     * 目录的自然顺序（同一轮评估中颁发顺序以此为准）
     */
    @Column(name = "display_order", nullable = false)
    private Integer displayOrder;
}
