package com.promptroute.domain.budget.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 预算告警。level 取值 info / warning / critical。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BudgetAlert {

    private String level;
    private String message;
    private String suggestion;
    private boolean actionRequired;
}
