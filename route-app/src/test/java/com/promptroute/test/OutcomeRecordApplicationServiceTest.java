package com.promptroute.test;

import com.google.common.cache.CacheBuilder;
import com.promptroute.api.dto.RecordOutcomeRequestDTO;
import com.promptroute.api.dto.RecordOutcomeResponseDTO;
import com.promptroute.domain.budget.adapter.repository.ILedgerEntryRepository;
import com.promptroute.domain.budget.service.BudgetLedgerDomainService;
import com.promptroute.domain.learning.adapter.repository.IChannelWeightRepository;
import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;
import com.promptroute.domain.learning.service.ChannelWeightDomainService;
import com.promptroute.domain.routing.adapter.repository.IInteractionOutcomeRepository;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.test.support.InMemoryChannelWeightRepository;
import com.promptroute.test.support.InMemoryInteractionOutcomeRepository;
import com.promptroute.test.support.InMemoryLedgerEntryRepository;
import com.promptroute.test.support.InMemoryRouteDecisionRepository;
import com.promptroute.test.support.MutableClock;
import com.promptroute.trigger.application.command.BudgetLedgerApplicationService;
import com.promptroute.trigger.application.command.ChannelWeightStoreService;
import com.promptroute.trigger.application.command.OutcomeRecordApplicationService;
import com.promptroute.types.enums.BudgetModeEnum;
import com.promptroute.types.enums.DirectiveTypeEnum;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.promptroute.test.support.BudgetPolicies.policy;
import static com.promptroute.test.support.BudgetPolicies.provider;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class OutcomeRecordApplicationServiceTest {

    private final MutableClock clock = MutableClock.at("2026-10-15T08:00:00Z");
    private final InMemoryRouteDecisionRepository decisionRepository = new InMemoryRouteDecisionRepository();
    private final InMemoryInteractionOutcomeRepository outcomeRepository = new InMemoryInteractionOutcomeRepository();
    private final InMemoryChannelWeightRepository weightRepository = new InMemoryChannelWeightRepository(clock);
    private final InMemoryLedgerEntryRepository ledgerRepository = new InMemoryLedgerEntryRepository();

    @Test
    public void shouldCommitSpendSaveOutcomeAndApplyFeedback() {
        OutcomeRecordApplicationService service = service(weightRepository, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        RecordOutcomeResponseDTO response = service.recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "0.40"));

        Assertions.assertNotNull(response.getOutcomeId());
        Assertions.assertEquals(0, new BigDecimal("0.40").compareTo(response.getCumulativeSpend()));
        Assertions.assertEquals("UNDER_THRESHOLD", response.getBudgetState());
        Assertions.assertTrue(response.getWeightUpdated());
        Assertions.assertEquals(1.1D, response.getUserWeight(), 1e-12);
        Assertions.assertEquals(1.1D, response.getOrgWeight(), 1e-12);
        Assertions.assertEquals(RouteChannelEnum.WEB, outcomeRepository.findByDecisionId(decision.getId()).getChannel());
    }

    @Test
    public void shouldReflectEmaUpdateInWeightStoreAfterRecordOutcome() {
        ChannelWeightStoreService weights = new ChannelWeightStoreService(weightRepository, new ChannelWeightDomainService(), 0.2D);
        weightRepository.put(new ChannelWeightKey("acme", "alice", RouteChannelEnum.AGENT), 1.3D);
        OutcomeRecordApplicationService service = service(weights, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.AGENT, false);

        service.recordOutcome(request(decision.getId(), "acme", "alice", 0.5D, "0"));

        Assertions.assertEquals(1.3D + 0.2D * (0.5D - 1.3D), weights.getWeight("acme", "alice", RouteChannelEnum.AGENT), 1e-12);
    }

    @Test
    public void shouldMapCategoricalOutcomeToUtility() {
        OutcomeRecordApplicationService service = service(weightRepository, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", null, RouteChannelEnum.DIRECT, false);
        RecordOutcomeRequestDTO request = request(decision.getId(), "acme", null, null, "0.01");
        request.setOutcome("bad");

        RecordOutcomeResponseDTO response = service.recordOutcome(request);

        Assertions.assertNull(response.getUserWeight());
        Assertions.assertEquals(0.9D, response.getOrgWeight(), 1e-12);
        Assertions.assertEquals(0.5D, outcomeRepository.findByDecisionId(decision.getId()).getObservedUtility());
    }

    @Test
    public void shouldUseServedChannelWhenRequestOmitsIt() {
        OutcomeRecordApplicationService service = service(weightRepository, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.AGENT, false);
        decision.setServedChannel(RouteChannelEnum.ASK);

        service.recordOutcome(request(decision.getId(), "acme", "alice", 1.0D, "0"));

        Assertions.assertEquals(RouteChannelEnum.ASK, outcomeRepository.findByDecisionId(decision.getId()).getChannel());
    }

    @Test
    public void shouldRejectUnknownOrForeignDecisionWithoutTouchingLedger() {
        OutcomeRecordApplicationService service = service(weightRepository, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        AppException unknown = Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(999L, "acme", "alice", 1.0D, "1")));
        AppException foreign = Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(decision.getId(), "globex", "alice", 1.0D, "1")));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), unknown.getCode());
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), foreign.getCode());
        Assertions.assertNull(ledgerRepository.find("acme", "2026-10"));
        Assertions.assertNull(ledgerRepository.find("globex", "2026-10"));
    }

    @Test
    public void shouldRejectBlockedDecisionAndDuplicateOutcome() {
        OutcomeRecordApplicationService service = service(weightRepository, ledgerRepository);
        RouteDecisionEntity blocked = decision("acme", "alice", RouteChannelEnum.WEB, true);
        RouteDecisionEntity served = decision("acme", "alice", RouteChannelEnum.WEB, false);
        service.recordOutcome(request(served.getId(), "acme", "alice", 1.0D, "1"));

        Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(blocked.getId(), "acme", "alice", 1.0D, "1")));
        Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(served.getId(), "acme", "alice", 1.0D, "1")));
        Assertions.assertEquals(0, BigDecimal.ONE.compareTo(ledgerRepository.find("acme", "2026-10").getCumulativeSpend()));
    }

    @Test
    public void shouldRejectInvalidInput() {
        OutcomeRecordApplicationService service = service(weightRepository, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(decision.getId(), "acme", "alice", 1.0D, "-0.01")));
        Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(decision.getId(), "acme", "alice", null, "0")));
        Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(decision.getId(), "acme", "alice", Double.NaN, "0")));
        Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(null, "acme", "alice", 1.0D, "0")));
    }

    @Test
    public void shouldDropFeedbackWithWarningWhenWeightStoreFails() {
        IChannelWeightRepository brokenWeights = mock(IChannelWeightRepository.class);
        when(brokenWeights.updateAtomically(any(ChannelWeightKey.class), anyDouble(), any()))
                .thenThrow(new RuntimeException("deadlock detected"));
        OutcomeRecordApplicationService service = service(brokenWeights, ledgerRepository);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        RecordOutcomeResponseDTO response = service.recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "2"));

        Assertions.assertFalse(response.getWeightUpdated());
        Assertions.assertNotNull(response.getOutcomeId());
        Assertions.assertEquals(0, new BigDecimal("2").compareTo(response.getCumulativeSpend()));
    }

    @Test
    public void shouldFailRetryablyWhenLedgerUnavailable() {
        ILedgerEntryRepository brokenLedger = mock(ILedgerEntryRepository.class);
        when(brokenLedger.addSpend(anyString(), anyString(), any(BigDecimal.class), any(LocalDateTime.class)))
                .thenThrow(new RuntimeException("connection refused"));
        OutcomeRecordApplicationService service = service(weightRepository, brokenLedger);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "2")));

        Assertions.assertEquals(ResponseCode.PERSISTENCE_UNAVAILABLE.getCode(), ex.getCode());
        Assertions.assertTrue(ex.isRetryable());
        Assertions.assertNull(outcomeRepository.findByDecisionId(decision.getId()));
        Assertions.assertNull(weightRepository.find(ChannelWeightKey.orgLevel("acme", RouteChannelEnum.WEB)));
    }

    @Test
    public void shouldChargeOnceWhenSameDecisionReportedConcurrently() throws Exception {
        CyclicBarrier claimBarrier = new CyclicBarrier(2);
        InMemoryInteractionOutcomeRepository racingOutcomes = new InMemoryInteractionOutcomeRepository() {
            @Override
            public InteractionOutcomeEntity saveIfAbsent(InteractionOutcomeEntity entity) {
                try {
                    claimBarrier.await(5, TimeUnit.SECONDS);
                } catch (Exception ex) {
                    throw new IllegalStateException(ex);
                }
                return super.saveIfAbsent(entity);
            }
        };
        OutcomeRecordApplicationService service = new OutcomeRecordApplicationService(
                decisionRepository, racingOutcomes, ledgerService(ledgerRepository, null),
                new ChannelWeightStoreService(weightRepository, new ChannelWeightDomainService(), 0.2D), clock);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<String> results;
        try {
            Callable<String> report = () -> {
                start.await(5, TimeUnit.SECONDS);
                try {
                    service.recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "0.40"));
                    return ResponseCode.SUCCESS.getCode();
                } catch (AppException ex) {
                    return ex.getCode();
                }
            };
            Future<String> first = pool.submit(report);
            Future<String> second = pool.submit(report);
            start.countDown();
            results = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        Assertions.assertEquals(1, Collections.frequency(results, ResponseCode.SUCCESS.getCode()));
        Assertions.assertEquals(1, Collections.frequency(results, ResponseCode.ILLEGAL_PARAMETER.getCode()));
        Assertions.assertEquals(1, racingOutcomes.all().size());
        Assertions.assertEquals(0, new BigDecimal("0.40").compareTo(
                ledgerRepository.find("acme", "2026-10").getCumulativeSpend()));
    }

    @Test
    public void shouldFailRetryablyWithoutChargingWhenOutcomeStoreUnavailable() {
        IInteractionOutcomeRepository brokenOutcomes = mock(IInteractionOutcomeRepository.class);
        when(brokenOutcomes.saveIfAbsent(any(InteractionOutcomeEntity.class)))
                .thenThrow(new RuntimeException("connection refused"));
        OutcomeRecordApplicationService service = new OutcomeRecordApplicationService(
                decisionRepository, brokenOutcomes, ledgerService(ledgerRepository, null),
                new ChannelWeightStoreService(weightRepository, new ChannelWeightDomainService(), 0.2D), clock);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "2")));

        Assertions.assertEquals(ResponseCode.PERSISTENCE_UNAVAILABLE.getCode(), ex.getCode());
        Assertions.assertTrue(ex.isRetryable());
        Assertions.assertNull(ledgerRepository.find("acme", "2026-10"));
        Assertions.assertNull(weightRepository.find(ChannelWeightKey.orgLevel("acme", RouteChannelEnum.WEB)));
        verify(brokenOutcomes, never()).deleteByDecisionId(any());
    }

    @Test
    public void shouldAcceptRetryAfterLedgerFailureReleasedClaim() {
        ILedgerEntryRepository brokenLedger = mock(ILedgerEntryRepository.class);
        when(brokenLedger.addSpend(anyString(), anyString(), any(BigDecimal.class), any(LocalDateTime.class)))
                .thenThrow(new RuntimeException("connection refused"));
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);
        Assertions.assertThrows(AppException.class, () -> service(weightRepository, brokenLedger)
                .recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "2")));

        RecordOutcomeResponseDTO retried = service(weightRepository, ledgerRepository)
                .recordOutcome(request(decision.getId(), "acme", "alice", 1.5D, "2"));

        Assertions.assertNotNull(retried.getOutcomeId());
        Assertions.assertEquals(0, new BigDecimal("2").compareTo(retried.getCumulativeSpend()));
        Assertions.assertEquals(1, outcomeRepository.all().size());
    }

    @Test
    public void shouldReportOverLimitStateAfterCommit() {
        OutcomeRecordApplicationService service = new OutcomeRecordApplicationService(
                decisionRepository, outcomeRepository,
                ledgerService(ledgerRepository, BudgetModeEnum.HARD),
                new ChannelWeightStoreService(weightRepository, new ChannelWeightDomainService(), 0.2D),
                clock);
        RouteDecisionEntity decision = decision("acme", "alice", RouteChannelEnum.WEB, false);

        RecordOutcomeResponseDTO response = service.recordOutcome(request(decision.getId(), "acme", "alice", 1.0D, "100"));

        Assertions.assertEquals("OVER_LIMIT", response.getBudgetState());
    }

    private OutcomeRecordApplicationService service(IChannelWeightRepository weights, ILedgerEntryRepository ledger) {
        return service(new ChannelWeightStoreService(weights, new ChannelWeightDomainService(), 0.2D), ledger);
    }

    private OutcomeRecordApplicationService service(ChannelWeightStoreService weights, ILedgerEntryRepository ledger) {
        return new OutcomeRecordApplicationService(decisionRepository, outcomeRepository,
                ledgerService(ledger, null), weights, clock);
    }

    private BudgetLedgerApplicationService ledgerService(ILedgerEntryRepository ledger, BudgetModeEnum mode) {
        return new BudgetLedgerApplicationService(ledger,
                mode == null ? provider() : provider(policy("acme", mode, "100", null)),
                new BudgetLedgerDomainService(), CacheBuilder.newBuilder().build(), clock);
    }

    private RouteDecisionEntity decision(String organization, String user, RouteChannelEnum channel, boolean blocked) {
        RouteDecisionEntity decision = new RouteDecisionEntity();
        decision.setEventId(1L);
        decision.setOrganization(organization);
        decision.setUser(user);
        decision.setChosenChannel(channel);
        decision.setServedChannel(blocked ? null : channel);
        decision.setDirective(blocked ? DirectiveTypeEnum.BLOCK : DirectiveTypeEnum.ALLOW);
        decision.setBlocked(blocked);
        decision.setDowngraded(false);
        decision.setCreatedAt(LocalDateTime.now(clock));
        return decisionRepository.save(decision);
    }

    private RecordOutcomeRequestDTO request(Long decisionId, String organization, String user, Double utility, String cost) {
        RecordOutcomeRequestDTO request = new RecordOutcomeRequestDTO();
        request.setDecisionId(decisionId);
        request.setOrganization(organization);
        request.setUser(user);
        request.setObservedUtility(utility);
        request.setActualCost(new BigDecimal(cost));
        request.setTokensIn(100);
        request.setTokensOut(50);
        request.setLatencyMs(120);
        return request;
    }
}
