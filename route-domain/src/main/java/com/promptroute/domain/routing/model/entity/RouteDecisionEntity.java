package com.promptroute.domain.routing.model.entity;

import com.promptroute.domain.budget.model.valobj.BudgetDirective;
import com.promptroute.domain.budget.model.valobj.EnforcementResult;
import com.promptroute.domain.routing.model.valobj.RouteDecisionResult;
import com.promptroute.types.enums.BudgetStateEnum;
import com.promptroute.types.enums.DirectiveTypeEnum;
import com.promptroute.types.enums.RationaleTagEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 路由决策领域实体。写入一次，之后只被分析与权重学习读取。
 */
@Data
public class RouteDecisionEntity {

    private Long id;
    private Long eventId;
    private String organization;
    private String user;
    private String contentHash;
    private RouteChannelEnum chosenChannel;
    private Map<RouteChannelEnum, Double> ruleScores = new EnumMap<>(RouteChannelEnum.class);
    private Map<RouteChannelEnum, Double> weights = new EnumMap<>(RouteChannelEnum.class);
    private Map<RouteChannelEnum, Double> finalScores = new EnumMap<>(RouteChannelEnum.class);
    private Double confidence;
    private List<RationaleTagEnum> rationale = new ArrayList<>();
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

    public void validate() {
        if (eventId == null) {
            throw new IllegalStateException("Event id cannot be null");
        }
        if (chosenChannel == null) {
            throw new IllegalStateException("Chosen channel cannot be null");
        }
        if (directive == null) {
            throw new IllegalStateException("Directive cannot be null");
        }
    }

    public static RouteDecisionEntity of(PromptEventEntity event, RouteDecisionResult result) {
        RouteDecisionEntity entity = new RouteDecisionEntity();
        entity.setEventId(event.getId());
        entity.setOrganization(event.getOrganization());
        entity.setUser(event.getUser());
        entity.setContentHash(event.getContentHash());
        entity.setChosenChannel(result.getChosenChannel());
        entity.setRuleScores(new EnumMap<>(result.getRuleScores()));
        entity.setWeights(new EnumMap<>(result.getWeights()));
        entity.setFinalScores(new EnumMap<>(result.getFinalScores()));
        entity.setConfidence(result.getConfidence());
        entity.setRationale(new ArrayList<>(result.getRationale()));
        return entity;
    }

    public void bindEnforcement(String requestedModel, BudgetDirective directive, EnforcementResult enforcement) {
        this.requestedModel = requestedModel;
        this.directive = directive.getType();
        this.budgetState = directive.getState();
        this.alert = directive.isAlert();
        this.degraded = directive.isDegraded();
        this.blocked = enforcement.isBlocked();
        this.downgraded = enforcement.isWasDowngraded();
        this.servedModel = enforcement.getModel();
        this.servedChannel = enforcement.getChannel();
    }

    public boolean isDowngradedDecision() {
        return Boolean.TRUE.equals(downgraded);
    }

    public boolean isBlockedDecision() {
        return Boolean.TRUE.equals(blocked);
    }

    public boolean hasRationale(RationaleTagEnum tag) {
        return rationale != null && rationale.contains(tag);
    }

    public boolean belongsTo(String organization, String user) {
        if (this.organization == null || !this.organization.equals(organization)) {
            return false;
        }
        String left = this.user == null ? "" : this.user;
        String right = user == null ? "" : user;
        return left.equals(right);
    }
}
