package com.promptroute.trigger.http;

import com.promptroute.api.dto.BudgetStatusDTO;
import com.promptroute.api.dto.EstimateCostRequestDTO;
import com.promptroute.api.dto.EstimateCostResponseDTO;
import com.promptroute.api.dto.OptimizeReportDTO;
import com.promptroute.api.dto.RecordOutcomeRequestDTO;
import com.promptroute.api.dto.RecordOutcomeResponseDTO;
import com.promptroute.api.dto.SuggestRouteRequestDTO;
import com.promptroute.api.dto.SuggestRouteResponseDTO;
import com.promptroute.api.dto.UsageSummaryDTO;
import com.promptroute.api.dto.WeeklyRecommendationDTO;
import com.promptroute.api.response.Response;
import com.promptroute.trigger.application.command.OutcomeRecordApplicationService;
import com.promptroute.trigger.application.command.RouteSuggestionApplicationService;
import com.promptroute.trigger.application.query.UsageAnalyticsQueryService;
import com.promptroute.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 路由工具 API：路由建议、结果上报、预算与用量查询。
 */
@RestController
@RequestMapping("/api/v1/route")
public class RouteToolController {

    private final RouteSuggestionApplicationService routeSuggestionApplicationService;
    private final OutcomeRecordApplicationService outcomeRecordApplicationService;
    private final UsageAnalyticsQueryService usageAnalyticsQueryService;

    public RouteToolController(RouteSuggestionApplicationService routeSuggestionApplicationService,
                               OutcomeRecordApplicationService outcomeRecordApplicationService,
                               UsageAnalyticsQueryService usageAnalyticsQueryService) {
        this.routeSuggestionApplicationService = routeSuggestionApplicationService;
        this.outcomeRecordApplicationService = outcomeRecordApplicationService;
        this.usageAnalyticsQueryService = usageAnalyticsQueryService;
    }

    @PostMapping("/suggest")
    public Response<SuggestRouteResponseDTO> suggestRoute(@RequestBody SuggestRouteRequestDTO request) {
        return success(routeSuggestionApplicationService.suggestRoute(request));
    }

    @PostMapping("/outcomes")
    public Response<RecordOutcomeResponseDTO> recordOutcome(@RequestBody RecordOutcomeRequestDTO request) {
        return success(outcomeRecordApplicationService.recordOutcome(request));
    }

    @GetMapping("/budget/{org}")
    public Response<BudgetStatusDTO> getBudgetStatus(@PathVariable("org") String organization) {
        return success(usageAnalyticsQueryService.getBudgetStatus(organization));
    }

    @GetMapping("/usage/{org}")
    public Response<UsageSummaryDTO> getUsageSummary(@PathVariable("org") String organization,
                                                     @RequestParam(value = "period", required = false) String period,
                                                     @RequestParam(value = "groupBy", required = false) String groupBy) {
        return success(usageAnalyticsQueryService.getUsageSummary(organization, period, groupBy));
    }

    @GetMapping("/recommendations/{org}")
    public Response<List<WeeklyRecommendationDTO>> weeklyRecommendations(@PathVariable("org") String organization) {
        return success(usageAnalyticsQueryService.weeklyRecommendations(organization));
    }

    @GetMapping("/reports/{org}/optimize")
    public Response<OptimizeReportDTO> optimizeReport(@PathVariable("org") String organization) {
        return success(usageAnalyticsQueryService.optimizeReport(organization));
    }

    @PostMapping("/estimate")
    public Response<EstimateCostResponseDTO> estimateCost(@RequestBody EstimateCostRequestDTO request) {
        return success(usageAnalyticsQueryService.estimateCost(request));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
