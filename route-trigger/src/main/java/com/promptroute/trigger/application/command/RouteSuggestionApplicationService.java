package com.promptroute.trigger.application.command;

import com.promptroute.api.dto.PromptFeaturesDTO;
import com.promptroute.api.dto.SuggestRouteRequestDTO;
import com.promptroute.api.dto.SuggestRouteResponseDTO;
import com.promptroute.domain.budget.model.valobj.BudgetDirective;
import com.promptroute.domain.budget.model.valobj.EnforcementResult;
import com.promptroute.domain.budget.service.EnforcementResolverDomainService;
import com.promptroute.domain.routing.adapter.repository.IPromptEventRepository;
import com.promptroute.domain.routing.adapter.repository.IRouteDecisionRepository;
import com.promptroute.domain.routing.model.entity.PromptEventEntity;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import com.promptroute.domain.routing.model.valobj.RouteDecisionResult;
import com.promptroute.domain.routing.service.PromptFeatureDomainService;
import com.promptroute.domain.routing.service.RoutingDecisionDomainService;
import com.promptroute.domain.routing.service.RuleScoringDomainService;
import com.promptroute.types.enums.LengthBucketEnum;
import com.promptroute.types.enums.RationaleTagEnum;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.exception.AppException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 路由建议写用例。
 * <p>
 * 流程：特征提取 → 规则打分 → 权重读取 → 决策 → 预算检查 → 执行解析 → 记录事件与决策。
 * 权重读取与预算检查在公共线程池上执行并受超时约束：
 * 权重读取失败直接拒绝本次请求（可重试），预算检查失败按只观察放行并标记 degraded。
 * </p>
 */
@Slf4j
@Service
public class RouteSuggestionApplicationService {

    private static final String METRIC_SUGGEST_TOTAL = "route.suggest.total";
    private static final String METRIC_SUGGEST_DEGRADED_TOTAL = "route.suggest.degraded.total";
    private static final String METRIC_SUGGEST_REJECTED_TOTAL = "route.suggest.rejected.total";
    private static final String REASON_LEDGER_UNAVAILABLE = "LEDGER_UNAVAILABLE";

    private final PromptFeatureDomainService promptFeatureDomainService;
    private final RuleScoringDomainService ruleScoringDomainService;
    private final RoutingDecisionDomainService routingDecisionDomainService;
    private final EnforcementResolverDomainService enforcementResolverDomainService;
    private final ChannelWeightStoreService channelWeightStoreService;
    private final BudgetLedgerApplicationService budgetLedgerApplicationService;
    private final IPromptEventRepository promptEventRepository;
    private final IRouteDecisionRepository routeDecisionRepository;
    private final Executor commonThreadPoolExecutor;
    private final Clock clock;
    private final long persistenceTimeoutMs;
    private final MeterRegistry meterRegistry;

    public RouteSuggestionApplicationService(PromptFeatureDomainService promptFeatureDomainService,
                                             RuleScoringDomainService ruleScoringDomainService,
                                             RoutingDecisionDomainService routingDecisionDomainService,
                                             EnforcementResolverDomainService enforcementResolverDomainService,
                                             ChannelWeightStoreService channelWeightStoreService,
                                             BudgetLedgerApplicationService budgetLedgerApplicationService,
                                             IPromptEventRepository promptEventRepository,
                                             IRouteDecisionRepository routeDecisionRepository,
                                             @Qualifier("commonThreadPoolExecutor") Executor commonThreadPoolExecutor,
                                             Clock clock,
                                             @Value("${route.persistence.timeout-ms:800}") long persistenceTimeoutMs) {
        this.promptFeatureDomainService = promptFeatureDomainService;
        this.ruleScoringDomainService = ruleScoringDomainService;
        this.routingDecisionDomainService = routingDecisionDomainService;
        this.enforcementResolverDomainService = enforcementResolverDomainService;
        this.channelWeightStoreService = channelWeightStoreService;
        this.budgetLedgerApplicationService = budgetLedgerApplicationService;
        this.promptEventRepository = promptEventRepository;
        this.routeDecisionRepository = routeDecisionRepository;
        this.commonThreadPoolExecutor = commonThreadPoolExecutor;
        this.clock = clock;
        this.persistenceTimeoutMs = Math.max(persistenceTimeoutMs, 1L);
        this.meterRegistry = Metrics.globalRegistry;
    }

    public SuggestRouteResponseDTO suggestRoute(SuggestRouteRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getOrganization())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "organization 不能为空");
        }
        String organization = request.getOrganization().trim();
        String user = StringUtils.trimToNull(request.getUser());
        String requestedModel = StringUtils.trimToNull(request.getRequestedModel());

        PromptFeatures features = resolveFeatures(request);
        Map<RouteChannelEnum, Double> ruleScores = ruleScoringDomainService.score(features);
        Map<RouteChannelEnum, Double> weights = loadWeights(organization, user);
        RouteDecisionResult result = routingDecisionDomainService.decide(features, ruleScores, weights);

        BudgetDirective directive = checkBudget(organization, requestedModel, result.getChosenChannel(), request);
        EnforcementResult enforcement = enforcementResolverDomainService.resolve(
                directive, result.getChosenChannel(), requestedModel);

        RouteDecisionEntity decision = persist(organization, user, features, result, requestedModel, directive, enforcement);
        recordMetrics(decision);
        log.info("ROUTE_DECIDED decisionId={}, organization={}, user={}, chosenChannel={}, servedChannel={}, directive={}, budgetState={}, confidence={}, degraded={}",
                decision.getId(),
                organization,
                StringUtils.defaultString(user, "-"),
                result.getChosenChannel().getCode(),
                enforcement.getChannel() == null ? "-" : enforcement.getChannel().getCode(),
                directive.getType(),
                directive.getState(),
                String.format("%.3f", result.getConfidence()),
                directive.isDegraded());
        return toDTO(decision, result, directive, enforcement);
    }

    private PromptFeatures resolveFeatures(SuggestRouteRequestDTO request) {
        boolean hasCodeSelection = Boolean.TRUE.equals(request.getHasCodeSelection());
        boolean recentSession = Boolean.TRUE.equals(request.getRecentSession());
        if (StringUtils.isNotBlank(request.getPrompt())) {
            return promptFeatureDomainService.extract(request.getPrompt(), hasCodeSelection, recentSession);
        }
        if (request.getFeatures() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "prompt 与 features 不能同时为空");
        }
        return promptFeatureDomainService.validate(toFeatures(request.getFeatures(), hasCodeSelection, recentSession));
    }

    private PromptFeatures toFeatures(PromptFeaturesDTO dto, boolean hasCodeSelection, boolean recentSession) {
        LengthBucketEnum lengthBucket;
        try {
            lengthBucket = LengthBucketEnum.fromText(dto.getLengthBucket());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.INVALID_FEATURE_INPUT, ex.getMessage(), ex);
        }
        if (dto.getQuestionAmbiguityScore() == null) {
            throw new AppException(ResponseCode.INVALID_FEATURE_INPUT, "questionAmbiguityScore 不能为空", null);
        }
        return PromptFeatures.builder()
                .mentionsFreshness(Boolean.TRUE.equals(dto.getMentionsFreshness()))
                .mentionsComparison(Boolean.TRUE.equals(dto.getMentionsComparison()))
                .mentionsImplementationVerb(Boolean.TRUE.equals(dto.getMentionsImplementationVerb()))
                .multiStepStructure(Boolean.TRUE.equals(dto.getMultiStepStructure()))
                .singleQuestion(Boolean.TRUE.equals(dto.getSingleQuestion()))
                .hasCodeSelection(hasCodeSelection || Boolean.TRUE.equals(dto.getHasCodeSelection()))
                .recentSession(recentSession || Boolean.TRUE.equals(dto.getRecentSession()))
                .questionAmbiguityScore(dto.getQuestionAmbiguityScore())
                .lengthBucket(lengthBucket)
                .contentHash(StringUtils.trimToNull(dto.getContentHash()))
                .build();
    }

    private Map<RouteChannelEnum, Double> loadWeights(String organization, String user) {
        try {
            return callWithTimeout(() -> channelWeightStoreService.getWeights(organization, user));
        } catch (Exception ex) {
            meterRegistry.counter(METRIC_SUGGEST_REJECTED_TOTAL, "reason", "weight_store").increment();
            log.warn("WEIGHT_READ_FAILED organization={}, user={}, timeoutMs={}, errorType={}, reason={}",
                    organization, StringUtils.defaultString(user, "-"), persistenceTimeoutMs,
                    ex.getClass().getSimpleName(), ex.getMessage());
            throw new AppException(ResponseCode.PERSISTENCE_UNAVAILABLE, "权重存储暂不可用，请重试", ex);
        }
    }

    private BudgetDirective checkBudget(String organization,
                                        String requestedModel,
                                        RouteChannelEnum chosenChannel,
                                        SuggestRouteRequestDTO request) {
        try {
            return callWithTimeout(() -> budgetLedgerApplicationService.checkAndReserve(
                    organization, requestedModel, chosenChannel, request.getEstimatedCost()));
        } catch (Exception ex) {
            meterRegistry.counter(METRIC_SUGGEST_DEGRADED_TOTAL, "reason", "ledger").increment();
            log.warn("LEDGER_CHECK_DEGRADED organization={}, timeoutMs={}, errorType={}, reason={}",
                    organization, persistenceTimeoutMs, ex.getClass().getSimpleName(), ex.getMessage());
            return BudgetDirective.degradedAllow(REASON_LEDGER_UNAVAILABLE);
        }
    }

    private RouteDecisionEntity persist(String organization,
                                        String user,
                                        PromptFeatures features,
                                        RouteDecisionResult result,
                                        String requestedModel,
                                        BudgetDirective directive,
                                        EnforcementResult enforcement) {
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            PromptEventEntity event = new PromptEventEntity();
            event.setOrganization(organization);
            event.setUser(user);
            event.setFeatures(features);
            event.setContentHash(features.getContentHash());
            event.setCreatedAt(now);
            PromptEventEntity savedEvent = promptEventRepository.save(event);

            RouteDecisionEntity decision = RouteDecisionEntity.of(savedEvent, result);
            decision.bindEnforcement(requestedModel, directive, enforcement);
            decision.setCreatedAt(now);
            return routeDecisionRepository.save(decision);
        } catch (RuntimeException ex) {
            log.error("ROUTE_DECISION_PERSIST_FAILED organization={}, chosenChannel={}, reason={}",
                    organization, result.getChosenChannel().getCode(), ex.getMessage(), ex);
            throw new AppException(ResponseCode.PERSISTENCE_UNAVAILABLE, "决策记录写入失败，请重试", ex);
        }
    }

    private <T> T callWithTimeout(Supplier<T> supplier) throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(supplier, commonThreadPoolExecutor);
        try {
            return future.get(persistenceTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ex;
        }
    }

    private void recordMetrics(RouteDecisionEntity decision) {
        meterRegistry.counter(METRIC_SUGGEST_TOTAL,
                "channel", decision.getChosenChannel().getCode(),
                "directive", decision.getDirective().getCode()).increment();
    }

    private SuggestRouteResponseDTO toDTO(RouteDecisionEntity decision,
                                          RouteDecisionResult result,
                                          BudgetDirective directive,
                                          EnforcementResult enforcement) {
        SuggestRouteResponseDTO dto = new SuggestRouteResponseDTO();
        dto.setDecisionId(decision.getId());
        dto.setChannel(enforcement.getChannel() == null ? null : enforcement.getChannel().getCode());
        dto.setChosenChannel(result.getChosenChannel().getCode());
        dto.setModel(enforcement.getModel());
        dto.setRequestedModel(decision.getRequestedModel());
        dto.setConfidence(result.getConfidence());
        dto.setRationale(result.getRationale().stream().map(RationaleTagEnum::name).collect(Collectors.toList()));
        dto.setExplanations(result.explanations());
        dto.setRuleScores(byCode(result.getRuleScores()));
        dto.setWeights(byCode(result.getWeights()));
        dto.setFinalScores(byCode(result.getFinalScores()));
        dto.setDirective(directive.getType().getCode());
        dto.setBudgetState(directive.getState() == null ? null : directive.getState().name());
        dto.setDowngraded(enforcement.isWasDowngraded());
        dto.setRefused(enforcement.isBlocked());
        dto.setDegraded(directive.isDegraded());
        dto.setAlert(directive.isAlert());
        dto.setReason(directive.getReason());
        dto.setSuggestions(enforcement.isBlocked() ? Map.of() : routingDecisionDomainService.suggestionPack());
        return dto;
    }

    private Map<String, Double> byCode(Map<RouteChannelEnum, Double> scores) {
        Map<String, Double> byCode = new LinkedHashMap<>();
        List<RouteChannelEnum> ordered = RouteChannelEnum.inTieBreakOrder();
        for (RouteChannelEnum channel : ordered) {
            if (scores.containsKey(channel)) {
                byCode.put(channel.getCode(), scores.get(channel));
            }
        }
        return byCode;
    }
}
