package com.pickem.bet.service;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.LedgerReason;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.exception.UnknownWagerException;
import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.logservice.WagerFlowLogger;
import com.pickem.bet.model.EventOutcome;
import com.pickem.bet.model.SettledWager;
import com.pickem.bet.repository.WagerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class WagerSettlerTest {

    private static final String USER = "user-1";
    private static final String HOME = "Kansas City Chiefs";
    private static final String AWAY = "Baltimore Ravens";
    private static final Instant NOW = Instant.parse("2024-09-06T04:00:00Z");

    @Mock
    private WagerRepository wagerRepository;

    @Mock
    private LedgerService ledgerService;

    private WagerSettler settler;

    @BeforeEach
    void setUp() {
        BettingWindow window = new BettingWindow(new BettingConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
        settler = new WagerSettler(wagerRepository, ledgerService, window, new WagerFlowLogger());
    }

    private Wager wager(String pick, WagerStatus status) {
        return Wager.builder()
                .id("w-1")
                .userId(USER)
                .eventId(7L)
                .pick(pick)
                .stake(new BigDecimal("40.00"))
                .potentialPayout(new BigDecimal("80.00"))
                .status(status)
                .build();
    }

    @Test
    void winningPick_isWon_andCreditsPotentialPayout() {
        when(wagerRepository.findById("w-1")).thenReturn(Optional.of(wager(HOME, WagerStatus.PENDING)));
        when(wagerRepository.transitionFromPending("w-1", WagerStatus.WON, new BigDecimal("80.00"), NOW)).thenReturn(1);

        Optional<SettledWager> result = settler.grade("w-1", new EventOutcome(27, 20, HOME));

        assertThat(result).hasValueSatisfying(s -> {
            assertThat(s.status()).isEqualTo(WagerStatus.WON);
            assertThat(s.credited()).isEqualByComparingTo("80.00");
        });
        verify(ledgerService).credit(USER, new BigDecimal("80.00"), LedgerReason.WAGER_WON, "w-1");
    }

    @Test
    void losingPick_isLost_andCreditsNothing() {
        when(wagerRepository.findById("w-1")).thenReturn(Optional.of(wager(AWAY, WagerStatus.PENDING)));
        when(wagerRepository.transitionFromPending("w-1", WagerStatus.LOST, BigDecimal.ZERO, NOW)).thenReturn(1);

        Optional<SettledWager> result = settler.grade("w-1", new EventOutcome(27, 20, HOME));

        assertThat(result).hasValueSatisfying(s -> assertThat(s.status()).isEqualTo(WagerStatus.LOST));
        verifyNoInteractions(ledgerService);
    }

    @Test
    void tie_isPush_andReturnsStake() {
        when(wagerRepository.findById("w-1")).thenReturn(Optional.of(wager(AWAY, WagerStatus.PENDING)));
        when(wagerRepository.transitionFromPending("w-1", WagerStatus.PUSH, new BigDecimal("40.00"), NOW)).thenReturn(1);

        settler.grade("w-1", new EventOutcome(24, 24, null));

        verify(ledgerService).credit(USER, new BigDecimal("40.00"), LedgerReason.WAGER_PUSH, "w-1");
    }

    @Test
    void refund_cancelsWithZeroRealizedPayout_andReturnsStake() {
        when(wagerRepository.findById("w-1")).thenReturn(Optional.of(wager(HOME, WagerStatus.PENDING)));
        when(wagerRepository.transitionFromPending("w-1", WagerStatus.CANCELLED, BigDecimal.ZERO, NOW)).thenReturn(1);

        Optional<SettledWager> result = settler.refund("w-1");

        assertThat(result).hasValueSatisfying(s -> assertThat(s.status()).isEqualTo(WagerStatus.CANCELLED));
        verify(ledgerService).credit(USER, new BigDecimal("40.00"), LedgerReason.EVENT_CANCELLED_REFUND, "w-1");
    }

    @Test
    void alreadyTerminal_isSkippedWithoutCas() {
        when(wagerRepository.findById("w-1")).thenReturn(Optional.of(wager(HOME, WagerStatus.CANCELLED)));

        assertThat(settler.grade("w-1", new EventOutcome(27, 20, HOME))).isEmpty();
        assertThat(settler.refund("w-1")).isEmpty();

        verify(wagerRepository, never()).transitionFromPending(any(), any(), any(), any());
        verifyNoInteractions(ledgerService);
    }

    @Test
    void lostCompareAndSet_neverCredits() {
        when(wagerRepository.findById("w-1")).thenReturn(Optional.of(wager(HOME, WagerStatus.PENDING)));
        when(wagerRepository.transitionFromPending(any(), any(), any(), any())).thenReturn(0);

        assertThat(settler.grade("w-1", new EventOutcome(27, 20, HOME))).isEmpty();
        verifyNoInteractions(ledgerService);
    }

    @Test
    void missingWager_throws() {
        when(wagerRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> settler.refund("nope")).isInstanceOf(UnknownWagerException.class);
    }
}
