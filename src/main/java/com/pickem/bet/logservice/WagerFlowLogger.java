package com.pickem.bet.logservice;

import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.model.SettlementReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Centralized logger for the wager lifecycle: placement, cancellation and settlement.
 */
@Slf4j
@Component
public class WagerFlowLogger {

    private static final String EMOJI_BET = "💰";
    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_REFUND = "↩️";
    private static final String EMOJI_FLAG = "🏁";
    private static final String EMOJI_PARTY = "🎉";
    private static final String EMOJI_LOCK = "🔒";

    // ==========================================
    // PLACEMENT
    // ==========================================

    public void logWagerPlaced(Wager wager, SportEvent event, BigDecimal balanceAfter) {
        log.info("{} {} Wager placed | WagerId: {} | User: {} | Event: {} | Pick: {} | Stake: {} | Potential: {} | Balance: {}",
                EMOJI_SUCCESS, EMOJI_BET, wager.getId(), wager.getUserId(), event.describe(),
                wager.getPick(), wager.getStake(), wager.getPotentialPayout(), balanceAfter);
    }

    public void logWagerRejected(String userId, Long eventId, String reason) {
        log.warn("{} {} Wager rejected | User: {} | EventId: {} | Reason: {}",
                EMOJI_WARNING, EMOJI_BET, userId, eventId, reason);
    }

    public void logBettingClosed(Long eventId, Object lockTime, Object now) {
        log.warn("{} Betting closed | EventId: {} | LockTime: {} | Now: {}",
                EMOJI_LOCK, eventId, lockTime, now);
    }

    // ==========================================
    // CANCELLATION
    // ==========================================

    public void logWagerCancelled(Wager wager, BigDecimal balanceAfter) {
        log.info("{} Wager cancelled by user | WagerId: {} | User: {} | Refund: {} | Balance: {}",
                EMOJI_REFUND, wager.getId(), wager.getUserId(), wager.getStake(), balanceAfter);
    }

    public void logCancelLostRace(String wagerId, String userId) {
        log.warn("{} Cancel lost the race, wager already terminal | WagerId: {} | User: {}",
                EMOJI_WARNING, wagerId, userId);
    }

    // ==========================================
    // SETTLEMENT
    // ==========================================

    public void logSettlementStart(SportEvent event, int pendingCount) {
        log.info("{} Settling event | EventId: {} | {} | Status: {} | Score: {}-{} | Winner: {} | Pending: {}",
                EMOJI_FLAG, event.getId(), event.describe(), event.getStatus(),
                event.getHomeScore(), event.getAwayScore(),
                event.getWinner() == null ? "TIE/NONE" : event.getWinner(), pendingCount);
    }

    public void logWagerSettled(String wagerId, String userId, WagerStatus status, BigDecimal credited) {
        if (status == WagerStatus.WON) {
            log.info("{} Wager WON | WagerId: {} | User: {} | Credited: {}", EMOJI_PARTY, wagerId, userId, credited);
        } else {
            log.info("Wager settled | WagerId: {} | User: {} | Status: {} | Credited: {}",
                    wagerId, userId, status, credited);
        }
    }

    public void logAlreadyTerminal(String wagerId) {
        log.debug("Wager already terminal, nothing to do | WagerId: {}", wagerId);
    }

    public void logWagerSettlementFailed(String wagerId, Long eventId, Throwable e) {
        log.error("{} Wager settlement failed, left PENDING | WagerId: {} | EventId: {} | Error: {}",
                EMOJI_ERROR, wagerId, eventId, e.getMessage(), e);
    }

    public void logSettlementComplete(Long eventId, SettlementReport report) {
        log.info("{} {} Event settled | EventId: {} | Won: {} | Lost: {} | Push: {} | Refunded: {} | Skipped: {} | Failed: {} | Credited: {}",
                EMOJI_SUCCESS, EMOJI_FLAG, eventId, report.getWon(), report.getLost(), report.getPush(),
                report.getRefunded(), report.getSkipped(), report.getFailed(), report.getTotalCredited());
    }
}
