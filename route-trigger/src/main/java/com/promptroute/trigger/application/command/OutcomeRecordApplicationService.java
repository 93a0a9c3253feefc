package com.promptroute.trigger.application.command;

import com.promptroute.api.dto.RecordOutcomeRequestDTO;
import com.promptroute.api.dto.RecordOutcomeResponseDTO;
import com.promptroute.domain.budget.model.entity.LedgerEntryEntity;
import com.promptroute.domain.routing.adapter.repository.IInteractionOutcomeRepository;
import com.promptroute.domain.routing.adapter.repository.IRouteDecisionRepository;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.types.enums.OutcomeRatingEnum;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 交互结果上报用例。
 * <p>
 * 顺序：写入结果记录认领决策 → 账本累加 → 权重反馈。
 * 结果记录或账本写入失败都返回可重试错误，账本失败时撤销认领；
 * 权重反馈写入失败时只告警并计数，不回滚已提交的花费。
 * </p>
 */
@Slf4j
@Service
public class OutcomeRecordApplicationService {

    private final IRouteDecisionRepository routeDecisionRepository;
    private final IInteractionOutcomeRepository interactionOutcomeRepository;
    private final BudgetLedgerApplicationService budgetLedgerApplicationService;
    private final ChannelWeightStoreService channelWeightStoreService;
    private final Clock clock;
    private final Counter feedbackDroppedCounter;
    private final Counter outcomeRecordedCounter;

    public OutcomeRecordApplicationService(IRouteDecisionRepository routeDecisionRepository,
                                           IInteractionOutcomeRepository interactionOutcomeRepository,
                                           BudgetLedgerApplicationService budgetLedgerApplicationService,
                                           ChannelWeightStoreService channelWeightStoreService,
                                           Clock clock) {
        this.routeDecisionRepository = routeDecisionRepository;
        this.interactionOutcomeRepository = interactionOutcomeRepository;
        this.budgetLedgerApplicationService = budgetLedgerApplicationService;
        this.channelWeightStoreService = channelWeightStoreService;
        this.clock = clock;
        this.feedbackDroppedCounter = Counter.builder("route.feedback.dropped.total").register(Metrics.globalRegistry);
        this.outcomeRecordedCounter = Counter.builder("route.outcome.recorded.total").register(Metrics.globalRegistry);
    }

    public RecordOutcomeResponseDTO recordOutcome(RecordOutcomeRequestDTO request) {
        if (request == null || request.getDecisionId() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "decisionId 不能为空");
        }
        if (StringUtils.isBlank(request.getOrganization())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "organization 不能为空");
        }
        String organization = request.getOrganization().trim();
        String user = StringUtils.trimToNull(request.getUser());
        double utility = resolveUtility(request);
        BigDecimal actualCost = request.getActualCost() == null ? BigDecimal.ZERO : request.getActualCost();
        if (actualCost.signum() < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "actualCost 不能为负数");
        }

        RouteDecisionEntity decision = routeDecisionRepository.findById(request.getDecisionId());
        if (decision == null || !decision.belongsTo(organization, user)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "决策不存在: " + request.getDecisionId());
        }
        if (decision.isBlockedDecision()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "决策已被预算拒绝，没有可上报的结果");
        }
        RouteChannelEnum channel = resolveChannel(request, decision);

        InteractionOutcomeEntity outcome = new InteractionOutcomeEntity();
        outcome.setDecisionId(decision.getId());
        outcome.setOrganization(organization);
        outcome.setUser(user);
        outcome.setChannel(channel);
        outcome.setModel(StringUtils.defaultIfBlank(request.getModel(), decision.getServedModel()));
        outcome.setObservedUtility(utility);
        outcome.setActualCost(actualCost);
        outcome.setTokensIn(request.getTokensIn());
        outcome.setTokensOut(request.getTokensOut());
        outcome.setLatencyMs(request.getLatencyMs());
        outcome.setCreatedAt(LocalDateTime.now(clock));
        InteractionOutcomeEntity saved = claim(outcome);

        LedgerEntryEntity entry;
        try {
            entry = budgetLedgerApplicationService.commit(organization, actualCost);
        } catch (RuntimeException ex) {
            releaseClaim(decision.getId(), organization);
            throw ex;
        }
        outcomeRecordedCounter.increment();

        RecordOutcomeResponseDTO response = new RecordOutcomeResponseDTO();
        response.setDecisionId(decision.getId());
        response.setOutcomeId(saved.getId());
        response.setCumulativeSpend(entry.normalizedSpend());
        response.setBudgetState(budgetLedgerApplicationService.evaluateState(organization, entry).name());
        response.setWeightUpdated(false);

        try {
            ChannelWeightStoreService.FeedbackResult feedback =
                    channelWeightStoreService.applyFeedback(organization, user, channel, utility);
            response.setWeightUpdated(true);
            response.setUserWeight(feedback.userWeight());
            response.setOrgWeight(feedback.orgWeight());
        } catch (RuntimeException ex) {
            feedbackDroppedCounter.increment();
            log.warn("WEIGHT_FEEDBACK_DROPPED decisionId={}, organization={}, user={}, channel={}, reason={}",
                    decision.getId(), organization, StringUtils.defaultString(user, "-"), channel.getCode(), ex.getMessage());
        }
        log.info("OUTCOME_RECORDED decisionId={}, organization={}, channel={}, utility={}, actualCost={}, weightUpdated={}",
                decision.getId(), organization, channel.getCode(), utility, actualCost.toPlainString(),
                response.getWeightUpdated());
        return response;
    }

    /**
     * 写入结果记录即认领决策，decision_id 唯一约束保证并发上报只有一个能继续计费。
     */
    private InteractionOutcomeEntity claim(InteractionOutcomeEntity outcome) {
        InteractionOutcomeEntity saved;
        try {
            saved = interactionOutcomeRepository.saveIfAbsent(outcome);
        } catch (RuntimeException ex) {
            log.error("OUTCOME_PERSIST_FAILED decisionId={}, organization={}, reason={}",
                    outcome.getDecisionId(), outcome.getOrganization(), ex.getMessage(), ex);
            throw new AppException(ResponseCode.PERSISTENCE_UNAVAILABLE, "结果记录写入失败，请重试", ex);
        }
        if (saved == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "该决策的结果已上报: " + outcome.getDecisionId());
        }
        return saved;
    }

    private void releaseClaim(Long decisionId, String organization) {
        try {
            interactionOutcomeRepository.deleteByDecisionId(decisionId);
        } catch (RuntimeException ex) {
            // 认领残留时重试会被判为重复上报，需人工清理
            log.error("OUTCOME_CLAIM_RELEASE_FAILED decisionId={}, organization={}, reason={}",
                    decisionId, organization, ex.getMessage(), ex);
        }
    }

    private double resolveUtility(RecordOutcomeRequestDTO request) {
        Double observed = request.getObservedUtility();
        if (observed != null) {
            if (observed.isNaN() || observed.isInfinite()) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "observedUtility 必须是有限数值");
            }
            return observed;
        }
        OutcomeRatingEnum rating;
        try {
            rating = OutcomeRatingEnum.fromText(request.getOutcome());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage(), ex);
        }
        if (rating == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "observedUtility 与 outcome 不能同时为空");
        }
        return rating.getUtility();
    }

    private RouteChannelEnum resolveChannel(RecordOutcomeRequestDTO request, RouteDecisionEntity decision) {
        if (StringUtils.isNotBlank(request.getChannel())) {
            try {
                return RouteChannelEnum.fromText(request.getChannel());
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage(), ex);
            }
        }
        return decision.getServedChannel() != null ? decision.getServedChannel() : decision.getChosenChannel();
    }
}
