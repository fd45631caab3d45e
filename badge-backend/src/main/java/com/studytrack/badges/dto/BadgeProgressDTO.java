package com.studytrack.badges.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class BadgeProgressDTO {
    private BigDecimal current;
    private BigDecimal target;
    private BigDecimal percentage;   // 0-100，保留一位小数
    private Boolean complete;
}
