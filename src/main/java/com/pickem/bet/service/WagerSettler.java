package com.pickem.bet.service;

import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.LedgerReason;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.exception.UnknownWagerException;
import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.logservice.WagerFlowLogger;
import com.pickem.bet.model.EventOutcome;
import com.pickem.bet.model.SettledWager;
import com.pickem.bet.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Settles a single wager in its own transaction. The status compare-and-set runs first and
 * the ledger is credited only when this call performed the transition, so a wager is paid
 * at most once no matter how many settlers or cancels race on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WagerSettler {

    private final WagerRepository wagerRepository;
    private final LedgerService ledgerService;
    private final BettingWindow bettingWindow;
    private final WagerFlowLogger flowLogger;

    /**
     * Grade against a final outcome.
     *
     * @return the settlement, or empty if the wager was no longer PENDING
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<SettledWager> grade(String wagerId, EventOutcome outcome) {
        Wager wager = load(wagerId);
        if (wager.getStatus() != WagerStatus.PENDING) {
            flowLogger.logAlreadyTerminal(wagerId);
            return Optional.empty();
        }

        WagerStatus status = wager.grade(outcome);
        BigDecimal payout = wager.payoutFor(status);
        LedgerReason reason = status == WagerStatus.WON ? LedgerReason.WAGER_WON : LedgerReason.WAGER_PUSH;

        return transition(wager, status, payout, payout, reason);
    }

    /**
     * Refund the stake because the event was cancelled. Realized payout stays zero.
     *
     * @return the settlement, or empty if the wager was no longer PENDING
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<SettledWager> refund(String wagerId) {
        Wager wager = load(wagerId);
        if (wager.getStatus() != WagerStatus.PENDING) {
            flowLogger.logAlreadyTerminal(wagerId);
            return Optional.empty();
        }

        return transition(wager, WagerStatus.CANCELLED, BigDecimal.ZERO, wager.getStake(),
                LedgerReason.EVENT_CANCELLED_REFUND);
    }

    private Optional<SettledWager> transition(Wager wager, WagerStatus status, BigDecimal realizedPayout,
                                              BigDecimal credit, LedgerReason reason) {
        String wagerId = wager.getId();
        String userId = wager.getUserId();

        int changed = wagerRepository.transitionFromPending(wagerId, status, realizedPayout, bettingWindow.now());
        if (changed == 0) {
            flowLogger.logAlreadyTerminal(wagerId);
            return Optional.empty();
        }

        BigDecimal credited = BigDecimal.ZERO;
        if (credit != null && credit.signum() > 0) {
            ledgerService.credit(userId, credit, reason, wagerId);
            credited = credit;
        }

        flowLogger.logWagerSettled(wagerId, userId, status, credited);
        return Optional.of(new SettledWager(wagerId, userId, status, credited));
    }

    private Wager load(String wagerId) {
        return wagerRepository.findById(wagerId)
                .orElseThrow(() -> new UnknownWagerException("Wager not found: " + wagerId));
    }
}
