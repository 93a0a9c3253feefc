package com.promptroute.trigger.application.query;

import com.promptroute.api.dto.BudgetAlertDTO;
import com.promptroute.api.dto.BudgetStatusDTO;
import com.promptroute.api.dto.EstimateCostRequestDTO;
import com.promptroute.api.dto.EstimateCostResponseDTO;
import com.promptroute.api.dto.ModelCostEstimateDTO;
import com.promptroute.api.dto.OptimizeReportDTO;
import com.promptroute.api.dto.UsageSummaryDTO;
import com.promptroute.api.dto.UsageSummaryItemDTO;
import com.promptroute.api.dto.UserEfficiencyDTO;
import com.promptroute.api.dto.WeeklyRecommendationDTO;
import com.promptroute.domain.analytics.model.valobj.UsageSummary;
import com.promptroute.domain.analytics.model.valobj.UsageSummaryItem;
import com.promptroute.domain.analytics.model.valobj.UserEfficiency;
import com.promptroute.domain.analytics.model.valobj.WeeklyRecommendation;
import com.promptroute.domain.analytics.service.AnalyticsAggregatorDomainService;
import com.promptroute.domain.budget.adapter.gateway.IModelCostCatalogProvider;
import com.promptroute.domain.budget.model.valobj.BudgetAlert;
import com.promptroute.domain.budget.model.valobj.BudgetStatus;
import com.promptroute.domain.budget.model.valobj.ModelCostCatalog;
import com.promptroute.domain.budget.service.BudgetLedgerDomainService;
import com.promptroute.domain.learning.adapter.repository.IChannelWeightRepository;
import com.promptroute.domain.routing.adapter.repository.IInteractionOutcomeRepository;
import com.promptroute.domain.routing.adapter.repository.IRouteDecisionRepository;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.trigger.application.command.BudgetLedgerApplicationService;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.enums.UsageGroupByEnum;
import com.promptroute.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 用量分析读用例：预算状态、用量汇总、周建议、ROI 报告与成本预估。
 */
@Service
public class UsageAnalyticsQueryService {

    private static final int RECOMMENDATION_WINDOW_DAYS = 7;

    private final IRouteDecisionRepository routeDecisionRepository;
    private final IInteractionOutcomeRepository interactionOutcomeRepository;
    private final IChannelWeightRepository channelWeightRepository;
    private final IModelCostCatalogProvider modelCostCatalogProvider;
    private final AnalyticsAggregatorDomainService analyticsAggregatorDomainService;
    private final BudgetLedgerDomainService budgetLedgerDomainService;
    private final BudgetLedgerApplicationService budgetLedgerApplicationService;
    private final Clock clock;

    public UsageAnalyticsQueryService(IRouteDecisionRepository routeDecisionRepository,
                                      IInteractionOutcomeRepository interactionOutcomeRepository,
                                      IChannelWeightRepository channelWeightRepository,
                                      IModelCostCatalogProvider modelCostCatalogProvider,
                                      AnalyticsAggregatorDomainService analyticsAggregatorDomainService,
                                      BudgetLedgerDomainService budgetLedgerDomainService,
                                      BudgetLedgerApplicationService budgetLedgerApplicationService,
                                      Clock clock) {
        this.routeDecisionRepository = routeDecisionRepository;
        this.interactionOutcomeRepository = interactionOutcomeRepository;
        this.channelWeightRepository = channelWeightRepository;
        this.modelCostCatalogProvider = modelCostCatalogProvider;
        this.analyticsAggregatorDomainService = analyticsAggregatorDomainService;
        this.budgetLedgerDomainService = budgetLedgerDomainService;
        this.budgetLedgerApplicationService = budgetLedgerApplicationService;
        this.clock = clock;
    }

    public BudgetStatusDTO getBudgetStatus(String organization) {
        return toDTO(budgetLedgerApplicationService.getBudgetStatus(requireOrganization(organization)));
    }

    /**
     * 汇总组织在指定周期内的用量，period 为空时取当前周期。
     */
    public UsageSummaryDTO getUsageSummary(String organization, String period, String groupBy) {
        String org = requireOrganization(organization);
        String normalizedPeriod = normalizePeriod(period);
        UsageGroupByEnum group;
        try {
            group = UsageGroupByEnum.fromText(groupBy);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage(), ex);
        }
        LocalDateTime from = budgetLedgerDomainService.periodStart(normalizedPeriod);
        LocalDateTime to = budgetLedgerDomainService.periodEnd(normalizedPeriod);
        List<RouteDecisionEntity> decisions = routeDecisionRepository.findByOrganizationBetween(org, from, to);
        List<InteractionOutcomeEntity> outcomes = interactionOutcomeRepository.findByOrganizationBetween(org, from, to);

        UsageSummary summary = new UsageSummary();
        summary.setOrganization(org);
        summary.setPeriod(normalizedPeriod);
        summary.setGroupBy(group);
        summary.setItems(analyticsAggregatorDomainService.summarize(outcomes, group));
        summary.setTotalDecisions(decisions.size());
        summary.setTotalOutcomes(outcomes.size());
        summary.setTotalCost(totalCost(outcomes));
        summary.setChannelDistribution(analyticsAggregatorDomainService.channelDistribution(decisions));
        summary.setDowngradedCount(decisions.stream().filter(RouteDecisionEntity::isDowngradedDecision).count());
        summary.setBlockedCount(decisions.stream().filter(RouteDecisionEntity::isBlockedDecision).count());
        summary.setDegradedCount(decisions.stream().filter(d -> Boolean.TRUE.equals(d.getDegraded())).count());
        summary.setDedupRate(analyticsAggregatorDomainService.dedupRate(decisions));
        summary.setEstimatedSavings(analyticsAggregatorDomainService.estimateSavings(
                decisions, outcomes, modelCostCatalogProvider.catalog()));
        summary.setUserEfficiency(analyticsAggregatorDomainService.userEfficiency(decisions, outcomes));
        return toDTO(summary);
    }

    /**
     * 基于最近 7 天的决策与当前组织级权重给出建议。
     */
    public List<WeeklyRecommendationDTO> weeklyRecommendations(String organization) {
        String org = requireOrganization(organization);
        return loadWeeklyRecommendations(org).stream()
                .map(this::toDTO)
                .collect(Collectors.toList());
    }

    public OptimizeReportDTO optimizeReport(String organization) {
        String org = requireOrganization(organization);
        String period = budgetLedgerApplicationService.currentPeriod();
        LocalDateTime from = budgetLedgerDomainService.periodStart(period);
        LocalDateTime to = budgetLedgerDomainService.periodEnd(period);
        List<RouteDecisionEntity> decisions = routeDecisionRepository.findByOrganizationBetween(org, from, to);
        List<InteractionOutcomeEntity> outcomes = interactionOutcomeRepository.findByOrganizationBetween(org, from, to);
        BigDecimal totalCost = totalCost(outcomes);
        BigDecimal realized = analyticsAggregatorDomainService.estimateSavings(
                decisions, outcomes, modelCostCatalogProvider.catalog());

        OptimizeReportDTO dto = new OptimizeReportDTO();
        dto.setOrganization(org);
        dto.setPeriod(period);
        dto.setTotalCost(totalCost);
        dto.setRealizedSavings(realized);
        dto.setMarkdown(analyticsAggregatorDomainService.optimizeReportMarkdown(
                realized, totalCost, loadWeeklyRecommendations(org)));
        return dto;
    }

    /**
     * 按价格目录估算各模型花费，结果按花费升序。
     */
    public EstimateCostResponseDTO estimateCost(EstimateCostRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "请求不能为空");
        }
        int tokensIn = request.getTokensIn() == null ? 0 : request.getTokensIn();
        int tokensOut = request.getTokensOut() == null ? 0 : request.getTokensOut();
        if (tokensIn < 0 || tokensOut < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "token 数不能为负数");
        }
        ModelCostCatalog catalog = modelCostCatalogProvider.catalog();
        List<String> models = request.getModels() == null || request.getModels().isEmpty()
                ? new ArrayList<>(catalog.getPrices().keySet())
                : request.getModels();
        List<ModelCostEstimateDTO> estimates = new ArrayList<>(models.size());
        for (String model : models) {
            if (StringUtils.isBlank(model)) {
                continue;
            }
            ModelCostEstimateDTO estimate = new ModelCostEstimateDTO();
            estimate.setModel(model.trim());
            estimate.setCostUsd(catalog.estimate(tokensIn, tokensOut, model.trim()));
            estimate.setKnown(catalog.contains(model.trim()));
            estimates.add(estimate);
        }
        estimates.sort(Comparator.comparing(ModelCostEstimateDTO::getCostUsd)
                .thenComparing(ModelCostEstimateDTO::getModel));

        EstimateCostResponseDTO response = new EstimateCostResponseDTO();
        response.setTokensIn(tokensIn);
        response.setTokensOut(tokensOut);
        response.setEstimates(estimates);
        return response;
    }

    private List<WeeklyRecommendation> loadWeeklyRecommendations(String organization) {
        LocalDateTime to = LocalDateTime.now(clock);
        LocalDateTime from = to.minusDays(RECOMMENDATION_WINDOW_DAYS);
        return analyticsAggregatorDomainService.weeklyRecommendations(
                channelWeightRepository.findByOrganization(organization),
                routeDecisionRepository.findByOrganizationBetween(organization, from, to),
                interactionOutcomeRepository.findByOrganizationBetween(organization, from, to));
    }

    private String requireOrganization(String organization) {
        if (StringUtils.isBlank(organization)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "organization 不能为空");
        }
        return organization.trim();
    }

    private String normalizePeriod(String period) {
        if (StringUtils.isBlank(period)) {
            return budgetLedgerApplicationService.currentPeriod();
        }
        try {
            budgetLedgerDomainService.parsePeriod(period.trim());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getMessage(), ex);
        }
        return period.trim();
    }

    private BigDecimal totalCost(List<InteractionOutcomeEntity> outcomes) {
        BigDecimal total = BigDecimal.ZERO;
        for (InteractionOutcomeEntity outcome : outcomes) {
            if (outcome.getActualCost() != null) {
                total = total.add(outcome.getActualCost());
            }
        }
        return total.setScale(6, RoundingMode.HALF_UP);
    }

    private BudgetStatusDTO toDTO(BudgetStatus status) {
        BudgetStatusDTO dto = new BudgetStatusDTO();
        dto.setOrganization(status.getOrganization());
        dto.setPeriod(status.getPeriod());
        dto.setState(status.getState() == null ? null : status.getState().name());
        dto.setMode(status.getMode() == null ? null : status.getMode().getCode());
        dto.setCumulativeSpend(status.getCumulativeSpend());
        dto.setMonthlyLimit(status.getMonthlyLimit());
        dto.setAlertThreshold(status.getAlertThreshold());
        dto.setPercentageUsed(status.getPercentageUsed());
        dto.setProjectedSpend(status.getProjectedSpend());
        dto.setDaysRemaining(status.getDaysRemaining());
        dto.setPolicyFound(status.isPolicyFound());
        List<BudgetAlertDTO> alerts = new ArrayList<>();
        for (BudgetAlert alert : status.getAlerts()) {
            BudgetAlertDTO alertDTO = new BudgetAlertDTO();
            alertDTO.setLevel(alert.getLevel());
            alertDTO.setMessage(alert.getMessage());
            alertDTO.setSuggestion(alert.getSuggestion());
            alertDTO.setActionRequired(alert.isActionRequired());
            alerts.add(alertDTO);
        }
        dto.setAlerts(alerts);
        return dto;
    }

    private UsageSummaryDTO toDTO(UsageSummary summary) {
        UsageSummaryDTO dto = new UsageSummaryDTO();
        dto.setOrganization(summary.getOrganization());
        dto.setPeriod(summary.getPeriod());
        dto.setGroupBy(summary.getGroupBy().name().toLowerCase(Locale.ROOT));
        List<UsageSummaryItemDTO> items = new ArrayList<>();
        for (UsageSummaryItem item : summary.getItems()) {
            UsageSummaryItemDTO itemDTO = new UsageSummaryItemDTO();
            itemDTO.setKey(item.getKey());
            itemDTO.setRequests(item.getRequests());
            itemDTO.setTokensIn(item.getTokensIn());
            itemDTO.setTokensOut(item.getTokensOut());
            itemDTO.setCostUsd(item.getCostUsd());
            itemDTO.setLatencyMsP95(item.getLatencyMsP95());
            items.add(itemDTO);
        }
        dto.setItems(items);
        dto.setTotalDecisions(summary.getTotalDecisions());
        dto.setTotalOutcomes(summary.getTotalOutcomes());
        dto.setTotalCost(summary.getTotalCost());
        dto.setChannelDistribution(summary.getChannelDistribution());
        dto.setDowngradedCount(summary.getDowngradedCount());
        dto.setBlockedCount(summary.getBlockedCount());
        dto.setDegradedCount(summary.getDegradedCount());
        dto.setDedupRate(summary.getDedupRate());
        dto.setEstimatedSavings(summary.getEstimatedSavings());
        List<UserEfficiencyDTO> efficiency = new ArrayList<>();
        for (UserEfficiency row : summary.getUserEfficiency()) {
            UserEfficiencyDTO rowDTO = new UserEfficiencyDTO();
            rowDTO.setUser(row.getUser());
            rowDTO.setDecisionsWithOutcome(row.getDecisionsWithOutcome());
            rowDTO.setHighValueNonDowngraded(row.getHighValueNonDowngraded());
            rowDTO.setEfficiencyScore(row.getEfficiencyScore());
            efficiency.add(rowDTO);
        }
        dto.setUserEfficiency(efficiency);
        return dto;
    }

    private WeeklyRecommendationDTO toDTO(WeeklyRecommendation recommendation) {
        WeeklyRecommendationDTO dto = new WeeklyRecommendationDTO();
        dto.setType(recommendation.getType());
        dto.setRule(recommendation.getRule());
        dto.setChannel(recommendation.getChannel());
        dto.setCurrentWeight(recommendation.getCurrentWeight());
        dto.setSuggestedWeight(recommendation.getSuggestedWeight());
        dto.setAction(recommendation.getAction());
        dto.setReason(recommendation.getReason());
        return dto;
    }
}
