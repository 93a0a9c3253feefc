package com.promptroute.infrastructure.dao.po;

import com.promptroute.types.enums.BudgetStateEnum;
import com.promptroute.types.enums.DirectiveTypeEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 路由决策 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteDecisionPO {

    private Long id;
    private Long eventId;
    private String organization;
    private String userKey;
    private String contentHash;
    private RouteChannelEnum chosenChannel;
    private String ruleScores;
    private String weights;
    private String finalScores;
    private Double confidence;
    private String rationale;
    private DirectiveTypeEnum directive;
    private BudgetStateEnum budgetState;
    private String requestedModel;
    private String servedModel;
    private RouteChannelEnum servedChannel;
    private Boolean downgraded;
    private Boolean blocked;
    private Boolean degraded;
    private Boolean alert;
    private LocalDateTime createdAt;
}
