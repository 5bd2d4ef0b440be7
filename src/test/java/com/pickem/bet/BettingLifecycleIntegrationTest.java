package com.pickem.bet;

import com.pickem.bet.entity.LedgerEntry;
import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.enums.LedgerReason;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.exception.BettingClosedException;
import com.pickem.bet.exception.InsufficientFundsException;
import com.pickem.bet.exception.NotCancellableException;
import com.pickem.bet.exception.UnknownUserException;
import com.pickem.bet.exception.UnknownWagerException;
import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.model.EventView;
import com.pickem.bet.model.FeedUpdateResult;
import com.pickem.bet.model.SettlementReport;
import com.pickem.bet.repository.LedgerEntryRepository;
import com.pickem.bet.repository.SportEventRepository;
import com.pickem.bet.repository.UserAccountRepository;
import com.pickem.bet.repository.WagerRepository;
import com.pickem.bet.service.BettingService;
import com.pickem.bet.service.EventStore;
import com.pickem.bet.service.FeedSynchronizer;
import com.pickem.bet.service.SettlementEngine;
import com.pickem.bet.support.MutableClock;
import com.pickem.bet.support.TestClockConfig;
import com.pickem.bet.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.pickem.bet.support.TestData.AWAY;
import static com.pickem.bet.support.TestData.HOME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end wager lifecycle on H2: feed creates the event, bettors place and cancel,
 * the feed finalizes and settlement pays out.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public class BettingLifecycleIntegrationTest {

    private static final String FEED_ID = "401671789";
    private static final String USER = "alice";

    @Autowired private BettingService bettingService;
    @Autowired private LedgerService ledgerService;
    @Autowired private EventStore eventStore;
    @Autowired private FeedSynchronizer feedSynchronizer;
    @Autowired private SettlementEngine settlementEngine;
    @Autowired private MutableClock clock;

    @Autowired private WagerRepository wagerRepository;
    @Autowired private LedgerEntryRepository ledgerEntryRepository;
    @Autowired private SportEventRepository sportEventRepository;
    @Autowired private UserAccountRepository userAccountRepository;

    private Instant kickoff;
    private Long eventId;

    @BeforeEach
    void setUp() {
        wagerRepository.deleteAllInBatch();
        ledgerEntryRepository.deleteAllInBatch();
        sportEventRepository.deleteAllInBatch();
        userAccountRepository.deleteAllInBatch();

        clock.set(TestClockConfig.START);
        kickoff = TestClockConfig.START.plus(Duration.ofDays(1));

        ledgerService.openAccount(USER, "Alice");
        eventId = eventStore.recordFeedUpdate(TestData.scheduled(FEED_ID, kickoff)).getEventId();
    }

    /* -------------------------- Helpers -------------------------- */

    private BigDecimal balance(String userId) {
        return ledgerService.getBalance(userId);
    }

    private Wager reload(Wager wager) {
        return wagerRepository.findById(wager.getId()).orElseThrow();
    }

    private void finishEvent(int home, int away) {
        clock.set(kickoff.plus(Duration.ofHours(4)));
        feedSynchronizer.ingest(TestData.inProgress(FEED_ID, kickoff, 0, 0));
        feedSynchronizer.ingest(TestData.finalScore(FEED_ID, kickoff, home, away));
    }

    /* ========================= TESTS ========================= */

    @Test
    void newAccount_startsWithConfiguredBalance_recordedInLedger() {
        assertThat(balance(USER)).isEqualByComparingTo("100.00");
        assertThat(ledgerService.reconcile(USER).isConsistent()).isTrue();
    }

    @Nested
    @DisplayName("settlement scenarios")
    class Scenarios {

        @Test
        @DisplayName("bet 40 on the winner: balance 60 while pending, 140 after the win")
        void winningWager() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));

            assertThat(balance(USER)).isEqualByComparingTo("60.00");
            assertThat(wager.getStatus()).isEqualTo(WagerStatus.PENDING);
            assertThat(wager.getPotentialPayout()).isEqualByComparingTo("80.00");

            finishEvent(27, 20);

            Wager settled = reload(wager);
            assertThat(settled.getStatus()).isEqualTo(WagerStatus.WON);
            assertThat(settled.getRealizedPayout()).isEqualByComparingTo("80.00");
            assertThat(settled.getSettledAt()).isNotNull();
            assertThat(balance(USER)).isEqualByComparingTo("140.00");
            assertThat(ledgerService.reconcile(USER).isConsistent()).isTrue();
        }

        @Test
        @DisplayName("bet 40 on the loser: balance stays 60")
        void losingWager() {
            Wager wager = bettingService.placeWager(USER, eventId, AWAY, new BigDecimal("40"));

            finishEvent(27, 20);

            Wager settled = reload(wager);
            assertThat(settled.getStatus()).isEqualTo(WagerStatus.LOST);
            assertThat(settled.getRealizedPayout()).isEqualByComparingTo("0");
            assertThat(balance(USER)).isEqualByComparingTo("60.00");
        }

        @Test
        @DisplayName("tie: push returns the stake")
        void tiedEvent_isPush() {
            Wager wager = bettingService.placeWager(USER, eventId, AWAY, new BigDecimal("40"));

            finishEvent(24, 24);

            Wager settled = reload(wager);
            assertThat(settled.getStatus()).isEqualTo(WagerStatus.PUSH);
            assertThat(settled.getRealizedPayout()).isEqualByComparingTo("40.00");
            assertThat(balance(USER)).isEqualByComparingTo("100.00");
        }

        @Test
        @DisplayName("bet 150 with balance 100: insufficient funds, nothing changes")
        void overdraft_isRejected() {
            assertThatThrownBy(() -> bettingService.placeWager(USER, eventId, HOME, new BigDecimal("150")))
                    .isInstanceOf(InsufficientFundsException.class);

            assertThat(balance(USER)).isEqualByComparingTo("100.00");
            assertThat(wagerRepository.count()).isZero();
            assertThat(ledgerEntryRepository.countByUserId(USER)).isEqualTo(1L);
        }

        @Test
        void unknownUser_leavesNoWagerBehind() {
            assertThatThrownBy(() -> bettingService.placeWager("nobody", eventId, HOME, BigDecimal.TEN))
                    .isInstanceOf(UnknownUserException.class);
            assertThat(wagerRepository.count()).isZero();
        }

        @Test
        void cancelledEvent_refundsPendingWagers() {
            Wager first = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("30"));
            Wager second = bettingService.placeWager(USER, eventId, AWAY, new BigDecimal("20"));
            assertThat(balance(USER)).isEqualByComparingTo("50.00");

            FeedUpdateResult result = feedSynchronizer.ingest(TestData.cancelled(FEED_ID, kickoff)).orElseThrow();

            assertThat(result.becameTerminal()).isTrue();
            assertThat(reload(first).getStatus()).isEqualTo(WagerStatus.CANCELLED);
            assertThat(reload(second).getStatus()).isEqualTo(WagerStatus.CANCELLED);
            assertThat(reload(first).getRealizedPayout()).isEqualByComparingTo("0");
            assertThat(balance(USER)).isEqualByComparingTo("100.00");
            assertThat(ledgerEntryRepository.findByReferenceAndReason(first.getId(), LedgerReason.EVENT_CANCELLED_REFUND))
                    .hasSize(1);
        }
    }

    @Nested
    @DisplayName("idempotence")
    class Idempotence {

        @Test
        void repeatedSettlement_neverPaysTwice() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));
            finishEvent(27, 20);

            SettlementReport again = settlementEngine.settleEvent(eventId);
            settlementEngine.settleEvent(eventId);
            // duplicate terminal delivery from the feed
            feedSynchronizer.ingest(TestData.finalScore(FEED_ID, kickoff, 27, 20));

            assertThat(again.settledCount()).isZero();
            assertThat(balance(USER)).isEqualByComparingTo("140.00");
            List<LedgerEntry> entries = ledgerEntryRepository.findByReferenceOrderByIdAsc(wager.getId());
            assertThat(entries).extracting(LedgerEntry::getReason)
                    .containsExactly(LedgerReason.WAGER_PLACED, LedgerReason.WAGER_WON);
        }

        @Test
        void conflictingFinal_isDiscarded_andDoesNotResettle() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));
            finishEvent(27, 20);

            assertThat(feedSynchronizer.ingest(TestData.finalScore(FEED_ID, kickoff, 20, 27))).isEmpty();

            assertThat(reload(wager).getStatus()).isEqualTo(WagerStatus.WON);
            assertThat(eventStore.getEvent(eventId).getWinner()).isEqualTo(HOME);
        }

        @Test
        void sweep_settlesTerminalEventsMissedEarlier() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));
            clock.set(kickoff.plus(Duration.ofHours(4)));
            // store directly: no settlement signal
            eventStore.recordFeedUpdate(TestData.finalScore(FEED_ID, kickoff, 27, 20));
            assertThat(reload(wager).getStatus()).isEqualTo(WagerStatus.PENDING);

            SettlementReport report = settlementEngine.settleOutstanding();

            assertThat(report.getWon()).isEqualTo(1);
            assertThat(reload(wager).getStatus()).isEqualTo(WagerStatus.WON);
            assertThat(settlementEngine.settleOutstanding().settledCount()).isZero();
        }

        @Test
        void inProgressTieScore_doesNotSettle() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));
            clock.set(kickoff.plus(Duration.ofHours(1)));
            feedSynchronizer.ingest(TestData.inProgress(FEED_ID, kickoff, 10, 10));

            assertThat(settlementEngine.settleEvent(eventId).settledCount()).isZero();
            assertThat(reload(wager).getStatus()).isEqualTo(WagerStatus.PENDING);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void cancelBeforeLock_refundsStake() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));

            Wager cancelled = bettingService.cancelWager(USER, wager.getId());

            assertThat(cancelled.getStatus()).isEqualTo(WagerStatus.CANCELLED);
            assertThat(cancelled.getSettledAt()).isEqualTo(TestClockConfig.START);
            assertThat(cancelled.getRealizedPayout()).isEqualByComparingTo("0");
            assertThat(balance(USER)).isEqualByComparingTo("100.00");
        }

        @Test
        void secondCancel_isNotCancellable_andDoesNotRefundTwice() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));
            bettingService.cancelWager(USER, wager.getId());

            assertThatThrownBy(() -> bettingService.cancelWager(USER, wager.getId()))
                    .isInstanceOf(NotCancellableException.class);
            assertThat(balance(USER)).isEqualByComparingTo("100.00");
        }

        @Test
        void otherUsersWager_isUnknown() {
            Wager wager = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("40"));
            ledgerService.openAccount("mallory", "Mallory");

            assertThatThrownBy(() -> bettingService.cancelWager("mallory", wager.getId()))
                    .isInstanceOf(UnknownWagerException.class);
            assertThat(reload(wager).getStatus()).isEqualTo(WagerStatus.PENDING);
        }

        @Test
        @DisplayName("lock boundary: 1ms before lock succeeds, at lock and after fails")
        void lockBoundary() {
            Instant lock = kickoff.minus(Duration.ofMinutes(5));
            Wager early = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("10"));
            Wager late = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("10"));

            clock.set(lock.minusMillis(1));
            assertThat(bettingService.cancelWager(USER, early.getId()).getStatus()).isEqualTo(WagerStatus.CANCELLED);

            clock.set(lock);
            assertThatThrownBy(() -> bettingService.cancelWager(USER, late.getId()))
                    .isInstanceOf(BettingClosedException.class);
            assertThatThrownBy(() -> bettingService.placeWager(USER, eventId, HOME, BigDecimal.TEN))
                    .isInstanceOf(BettingClosedException.class);

            clock.set(lock.plusMillis(1));
            assertThatThrownBy(() -> bettingService.cancelWager(USER, late.getId()))
                    .isInstanceOf(BettingClosedException.class);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void listBettable_hidesLockedAndStartedEvents() {
            Long other = eventStore.recordFeedUpdate(TestData.scheduled("401671790", kickoff.plus(Duration.ofHours(3))))
                    .getEventId();

            assertThat(bettingService.listBettable()).extracting(EventView::getId).containsExactly(eventId, other);

            clock.set(kickoff.minus(Duration.ofMinutes(5)));
            assertThat(bettingService.listBettable()).extracting(EventView::getId).containsExactly(other);

            EventView locked = bettingService.getEventView(eventId);
            assertThat(locked.getStatus()).isEqualTo(EventStatus.LOCKED);
            assertThat(locked.isBettable()).isFalse();
        }

        @Test
        void getUserWagers_filtersAndOrdersNewestFirst() {
            Wager first = bettingService.placeWager(USER, eventId, HOME, new BigDecimal("10"));
            clock.advance(Duration.ofMinutes(1));
            Wager second = bettingService.placeWager(USER, eventId, AWAY, new BigDecimal("10"));
            clock.advance(Duration.ofMinutes(1));
            bettingService.cancelWager(USER, first.getId());

            assertThat(bettingService.getUserWagers(USER, null, 0).getContent())
                    .extracting(Wager::getId).containsExactly(second.getId(), first.getId());
            assertThat(bettingService.getUserWagers(USER, WagerStatus.PENDING, 0).getContent())
                    .extracting(Wager::getId).containsExactly(second.getId());
            assertThat(bettingService.getUserWagers(USER, WagerStatus.CANCELLED, 0).getContent())
                    .extracting(Wager::getId).containsExactly(first.getId());
        }
    }
}
