package com.promptroute.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户效率：未降级且高价值的决策占有结果决策的比例。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserEfficiency {

    private String user;
    private long decisionsWithOutcome;
    private long highValueNonDowngraded;
    private double efficiencyScore;
}
