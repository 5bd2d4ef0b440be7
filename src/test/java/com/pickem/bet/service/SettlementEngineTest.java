package com.pickem.bet.service;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.exception.UnknownEventException;
import com.pickem.bet.logservice.WagerFlowLogger;
import com.pickem.bet.model.EventOutcome;
import com.pickem.bet.model.SettledWager;
import com.pickem.bet.model.SettlementReport;
import com.pickem.bet.repository.WagerRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SettlementEngineTest {

    private static final Long EVENT_ID = 7L;
    private static final String HOME = "Kansas City Chiefs";
    private static final String AWAY = "Baltimore Ravens";

    @Mock
    private EventStore eventStore;

    @Mock
    private WagerRepository wagerRepository;

    @Mock
    private WagerSettler wagerSettler;

    private ExecutorService executor;
    private SettlementMetricsService metrics;
    private SettlementEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        metrics = new SettlementMetricsService();
        engine = new SettlementEngine(eventStore, wagerRepository, wagerSettler, executor,
                new BettingConfig(), new WagerFlowLogger(), metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SportEvent event(EventStatus status, Integer home, Integer away, String winner) {
        return SportEvent.builder()
                .id(EVENT_ID)
                .feedEventId("401671789")
                .homeTeam(HOME)
                .awayTeam(AWAY)
                .scheduledStart(Instant.parse("2024-09-06T00:20:00Z"))
                .status(status)
                .homeScore(home)
                .awayScore(away)
                .winner(winner)
                .build();
    }

    private static Optional<SettledWager> settled(String id, WagerStatus status, String credited) {
        return Optional.of(new SettledWager(id, "user-" + id, status, new BigDecimal(credited)));
    }

    @Test
    @DisplayName("in-progress event with scores is not settled")
    void nonTerminalEvent_isDeferred() {
        when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.IN_PROGRESS, 24, 24, null));

        SettlementReport report = engine.settleEvent(EVENT_ID);

        assertThat(report.settledCount()).isZero();
        verifyNoInteractions(wagerRepository, wagerSettler);
    }

    @Test
    void finalEvent_gradesEveryPendingWager() {
        when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.FINAL, 27, 20, HOME));
        when(wagerRepository.findIdsByEventIdAndStatus(EVENT_ID, WagerStatus.PENDING)).thenReturn(List.of("a", "b", "c"));
        EventOutcome outcome = new EventOutcome(27, 20, HOME);
        when(wagerSettler.grade("a", outcome)).thenReturn(settled("a", WagerStatus.WON, "80.00"));
        when(wagerSettler.grade("b", outcome)).thenReturn(settled("b", WagerStatus.LOST, "0"));
        when(wagerSettler.grade("c", outcome)).thenReturn(Optional.empty());

        SettlementReport report = engine.settleEvent(EVENT_ID);

        assertThat(report.getWon()).isEqualTo(1);
        assertThat(report.getLost()).isEqualTo(1);
        assertThat(report.getSkipped()).isEqualTo(1);
        assertThat(report.getTotalCredited()).isEqualByComparingTo("80.00");
        verify(wagerSettler, never()).refund(any());
        assertThat(metrics.getMetrics().get("eventsSettled")).isEqualTo(1);
    }

    @Test
    void cancelledEvent_refundsEveryPendingWager() {
        when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.CANCELLED, null, null, null));
        when(wagerRepository.findIdsByEventIdAndStatus(EVENT_ID, WagerStatus.PENDING)).thenReturn(List.of("a", "b"));
        when(wagerSettler.refund("a")).thenReturn(settled("a", WagerStatus.CANCELLED, "40.00"));
        when(wagerSettler.refund("b")).thenReturn(settled("b", WagerStatus.CANCELLED, "10.00"));

        SettlementReport report = engine.settleEvent(EVENT_ID);

        assertThat(report.getRefunded()).isEqualTo(2);
        assertThat(report.getTotalCredited()).isEqualByComparingTo("50.00");
        verify(wagerSettler, never()).grade(any(), any());
    }

    @Test
    void failingWager_isCounted_othersStillSettle() {
        when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.FINAL, 24, 24, null));
        when(wagerRepository.findIdsByEventIdAndStatus(EVENT_ID, WagerStatus.PENDING)).thenReturn(List.of("a", "b"));
        EventOutcome tie = new EventOutcome(24, 24, null);
        when(wagerSettler.grade("a", tie)).thenThrow(new CannotAcquireLockException("lock timeout"));
        when(wagerSettler.grade("b", tie)).thenReturn(settled("b", WagerStatus.PUSH, "40.00"));

        SettlementReport report = engine.settleEvent(EVENT_ID);

        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(report.getPush()).isEqualTo(1);
    }

    @Test
    @DisplayName("past the deadline: running wager is reported by its real outcome, queued wager is abandoned")
    void slowWager_isReportedByActualOutcome_queuedWagerStaysPending() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            BettingConfig config = new BettingConfig();
            config.setSettlementWagerTimeoutMs(50);
            SettlementEngine slowEngine = new SettlementEngine(eventStore, wagerRepository, wagerSettler, single,
                    config, new WagerFlowLogger(), metrics);

            when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.FINAL, 27, 20, HOME));
            when(wagerRepository.findIdsByEventIdAndStatus(EVENT_ID, WagerStatus.PENDING))
                    .thenReturn(List.of("slow", "queued"));
            EventOutcome outcome = new EventOutcome(27, 20, HOME);
            when(wagerSettler.grade("slow", outcome)).thenAnswer(invocation -> {
                Thread.sleep(300);
                return settled("slow", WagerStatus.WON, "80.00");
            });

            SettlementReport report = slowEngine.settleEvent(EVENT_ID);

            assertThat(report.getWon()).isEqualTo(1);
            assertThat(report.getTotalCredited()).isEqualByComparingTo("80.00");
            assertThat(report.getFailed()).isEqualTo(1);
            verify(wagerSettler, never()).grade("queued", outcome);
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void noPendingWagers_isEmptyReport() {
        when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.FINAL, 27, 20, HOME));
        when(wagerRepository.findIdsByEventIdAndStatus(EVENT_ID, WagerStatus.PENDING)).thenReturn(List.of());

        assertThat(engine.settleEvent(EVENT_ID).settledCount()).isZero();
        verifyNoInteractions(wagerSettler);
    }

    @Test
    void unknownEvent_propagates() {
        when(eventStore.getEvent(99L)).thenThrow(new UnknownEventException("Event not found: 99"));

        assertThatThrownBy(() -> engine.settleEvent(99L)).isInstanceOf(UnknownEventException.class);
    }

    @Test
    void settleOutstanding_continuesPastFailingEvent() {
        when(eventStore.findTerminalWithPendingWagers()).thenReturn(List.of(99L, EVENT_ID));
        when(eventStore.getEvent(99L)).thenThrow(new IllegalStateException("boom"));
        when(eventStore.getEvent(EVENT_ID)).thenReturn(event(EventStatus.CANCELLED, null, null, null));
        when(wagerRepository.findIdsByEventIdAndStatus(EVENT_ID, WagerStatus.PENDING)).thenReturn(List.of("a"));
        when(wagerSettler.refund("a")).thenReturn(settled("a", WagerStatus.CANCELLED, "40.00"));

        SettlementReport total = engine.settleOutstanding();

        assertThat(total.getRefunded()).isEqualTo(1);
    }
}
