package com.promptroute.api.dto;

import lombok.Data;

/**
 * 预算告警 DTO。
 */
@Data
public class BudgetAlertDTO {

    private String level;
    private String message;
    private String suggestion;
    private Boolean actionRequired;
}
