package com.promptroute.trigger.application.command;

import com.google.common.cache.Cache;
import com.promptroute.domain.budget.adapter.gateway.IBudgetPolicyProvider;
import com.promptroute.domain.budget.adapter.repository.ILedgerEntryRepository;
import com.promptroute.domain.budget.model.entity.LedgerEntryEntity;
import com.promptroute.domain.budget.model.valobj.BudgetDirective;
import com.promptroute.domain.budget.model.valobj.BudgetPolicy;
import com.promptroute.domain.budget.model.valobj.BudgetStatus;
import com.promptroute.domain.budget.service.BudgetLedgerDomainService;
import com.promptroute.types.common.Constants;
import com.promptroute.types.enums.BudgetStateEnum;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 预算账本用例。
 * <p>
 * 检查路径只读最近一次已知的账本状态（短时缓存，允许有界的陈旧），
 * commit 是唯一的写入口，写入后驱逐缓存。计费周期取自注入的 UTC 时钟。
 * </p>
 */
@Slf4j
@Service
public class BudgetLedgerApplicationService {

    private final ILedgerEntryRepository ledgerEntryRepository;
    private final IBudgetPolicyProvider budgetPolicyProvider;
    private final BudgetLedgerDomainService budgetLedgerDomainService;
    private final Cache<String, LedgerEntryEntity> ledgerStateCache;
    private final Clock clock;

    public BudgetLedgerApplicationService(ILedgerEntryRepository ledgerEntryRepository,
                                          IBudgetPolicyProvider budgetPolicyProvider,
                                          BudgetLedgerDomainService budgetLedgerDomainService,
                                          @Qualifier("ledgerStateCache") Cache<String, LedgerEntryEntity> ledgerStateCache,
                                          Clock clock) {
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.budgetPolicyProvider = budgetPolicyProvider;
        this.budgetLedgerDomainService = budgetLedgerDomainService;
        this.ledgerStateCache = ledgerStateCache;
        this.clock = clock;
    }

    /**
     * 依据当前策略快照与已知花费给出指令，不修改账本。
     */
    public BudgetDirective checkAndReserve(String organization,
                                           String requestedModel,
                                           RouteChannelEnum requestedChannel,
                                           BigDecimal estimatedCost) {
        BudgetPolicy policy = budgetPolicyProvider.snapshot().find(organization);
        if (policy == null) {
            log.warn("POLICY_NOT_FOUND organization={}, fallbackMode=observe", organization);
        }
        LedgerEntryEntity entry = lastKnown(organization, currentPeriod());
        return budgetLedgerDomainService.evaluateDirective(organization, policy, entry,
                requestedModel, requestedChannel, estimatedCost);
    }

    /**
     * 累加实际花费。持久化失败抛出可重试异常。
     */
    public LedgerEntryEntity commit(String organization, BigDecimal actualCost) {
        if (StringUtils.isBlank(organization)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "organization 不能为空");
        }
        if (actualCost == null || actualCost.signum() < 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "actualCost 不能为负数");
        }
        String period = currentPeriod();
        try {
            LedgerEntryEntity entry = ledgerEntryRepository.addSpend(organization, period, actualCost, LocalDateTime.now(clock));
            log.info("LEDGER_COMMITTED organization={}, period={}, amount={}, cumulativeSpend={}",
                    organization, period, actualCost.toPlainString(), entry.normalizedSpend().toPlainString());
            return entry;
        } catch (RuntimeException ex) {
            log.error("LEDGER_COMMIT_FAILED organization={}, period={}, amount={}, reason={}",
                    organization, period, actualCost.toPlainString(), ex.getMessage(), ex);
            throw new AppException(ResponseCode.PERSISTENCE_UNAVAILABLE, "账本写入失败，请重试", ex);
        } finally {
            ledgerStateCache.invalidate(cacheKey(organization, period));
        }
    }

    /**
     * 预算状态查询直接读库，不经过缓存。
     */
    public BudgetStatus getBudgetStatus(String organization) {
        if (StringUtils.isBlank(organization)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "organization 不能为空");
        }
        LocalDate today = LocalDate.now(clock);
        String period = budgetLedgerDomainService.periodOf(today);
        BudgetPolicy policy = budgetPolicyProvider.snapshot().find(organization);
        LedgerEntryEntity entry = ledgerEntryRepository.find(organization, period);
        return budgetLedgerDomainService.buildStatus(organization, policy, entry, today);
    }

    /**
     * 按当前策略快照计算条目所处的预算状态，未配置策略时按只观察计算。
     */
    public BudgetStateEnum evaluateState(String organization, LedgerEntryEntity entry) {
        BudgetPolicy policy = budgetPolicyProvider.snapshot().find(organization);
        return budgetLedgerDomainService.evaluateState(
                policy == null ? BudgetPolicy.observeOnly(organization) : policy, entry);
    }

    public String currentPeriod() {
        return budgetLedgerDomainService.periodOf(LocalDate.now(clock));
    }

    private LedgerEntryEntity lastKnown(String organization, String period) {
        String key = cacheKey(organization, period);
        LedgerEntryEntity cached = ledgerStateCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        LedgerEntryEntity loaded = ledgerEntryRepository.find(organization, period);
        if (loaded == null) {
            loaded = LedgerEntryEntity.empty(organization, period);
        }
        ledgerStateCache.put(key, loaded);
        return loaded;
    }

    private String cacheKey(String organization, String period) {
        return organization + Constants.SPLIT + period;
    }
}
