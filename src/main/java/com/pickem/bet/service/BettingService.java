package com.pickem.bet.service;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.LedgerReason;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.exception.BettingClosedException;
import com.pickem.bet.exception.InvalidSelectionException;
import com.pickem.bet.exception.InvalidStakeException;
import com.pickem.bet.exception.NotCancellableException;
import com.pickem.bet.exception.UnknownWagerException;
import com.pickem.bet.finance.LedgerService;
import com.pickem.bet.logservice.WagerFlowLogger;
import com.pickem.bet.model.EventView;
import com.pickem.bet.repository.UserAccountRepository;
import com.pickem.bet.repository.WagerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for bettors: placing and cancelling wagers, and the read side they need.
 * Each mutating call is a single transaction spanning the ledger and the wager row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BettingService {

    private final EventStore eventStore;
    private final BettingWindow bettingWindow;
    private final LedgerService ledgerService;
    private final WagerRepository wagerRepository;
    private final UserAccountRepository userAccountRepository;
    private final BettingConfig bettingConfig;
    private final WagerFlowLogger flowLogger;
    private final SettlementMetricsService metricsService;

    /**
     * Debit the stake and record a PENDING wager.
     *
     * @throws com.pickem.bet.exception.UnknownEventException      event does not exist
     * @throws BettingClosedException                              event not SCHEDULED or lock time reached
     * @throws InvalidStakeException                               stake missing, not positive, below minimum or over 2 decimals
     * @throws InvalidSelectionException                           pick is not one of the participants
     * @throws com.pickem.bet.exception.UnknownUserException       no account for the user
     * @throws com.pickem.bet.exception.InsufficientFundsException balance below stake
     */
    @Transactional
    public Wager placeWager(String userId, Long eventId, String pick, BigDecimal stake) {
        SportEvent event = eventStore.getEvent(eventId);

        Instant now = bettingWindow.now();
        if (!bettingWindow.isOpen(event, now)) {
            flowLogger.logBettingClosed(eventId, bettingWindow.lockTime(event), now);
            throw new BettingClosedException("Betting is closed for " + event.describe()
                    + " (status " + bettingWindow.effectiveStatus(event, now) + ")");
        }

        validateStake(userId, eventId, stake);

        if (!event.isParticipant(pick)) {
            flowLogger.logWagerRejected(userId, eventId, "invalid selection '" + pick + "'");
            throw new InvalidSelectionException("Pick must be one of " + event.participants() + ", got: " + pick);
        }

        String wagerId = UUID.randomUUID().toString();
        BigDecimal normalizedStake = stake.setScale(2);

        // debit first: fails with UnknownUser / InsufficientFunds before anything is written
        BigDecimal balanceAfter = ledgerService.debit(userId, normalizedStake, LedgerReason.WAGER_PLACED, wagerId);

        Wager wager = Wager.builder()
                .id(wagerId)
                .user(userAccountRepository.getReferenceById(userId))
                .userId(userId)
                .event(event)
                .eventId(event.getId())
                .pick(pick)
                .stake(normalizedStake)
                .potentialPayout(Wager.calculatePotentialPayout(normalizedStake, bettingConfig.getPayoutMultiplier()))
                .realizedPayout(BigDecimal.ZERO.setScale(2))
                .status(WagerStatus.PENDING)
                .placedAt(now)
                .build();

        Wager saved = wagerRepository.saveAndFlush(wager);
        flowLogger.logWagerPlaced(saved, event, balanceAfter);
        metricsService.recordWagerPlaced();
        return saved;
    }

    /**
     * Refund the stake of a PENDING wager while its event is still open.
     *
     * @throws UnknownWagerException  wager missing or owned by someone else
     * @throws NotCancellableException wager already terminal, including a lost race with settlement
     * @throws BettingClosedException  event lock time reached or event no longer SCHEDULED
     */
    @Transactional
    public Wager cancelWager(String userId, String wagerId) {
        Wager wager = wagerRepository.findByIdAndUserId(wagerId, userId)
                .orElseThrow(() -> new UnknownWagerException("Wager not found: " + wagerId));

        if (wager.getStatus() != WagerStatus.PENDING) {
            throw new NotCancellableException("Wager " + wagerId + " is already " + wager.getStatus());
        }

        SportEvent event = eventStore.getEvent(wager.getEventId());
        Instant now = bettingWindow.now();
        if (!bettingWindow.isOpen(event, now)) {
            flowLogger.logBettingClosed(event.getId(), bettingWindow.lockTime(event), now);
            throw new BettingClosedException("Cancellation closed for " + event.describe()
                    + " (status " + bettingWindow.effectiveStatus(event, now) + ")");
        }

        int changed = wagerRepository.transitionFromPending(wagerId, WagerStatus.CANCELLED, BigDecimal.ZERO, now);
        if (changed == 0) {
            flowLogger.logCancelLostRace(wagerId, userId);
            throw new NotCancellableException("Wager " + wagerId + " is no longer pending");
        }

        BigDecimal balanceAfter = ledgerService.credit(userId, wager.getStake(), LedgerReason.WAGER_CANCELLED, wagerId);

        Wager cancelled = wagerRepository.findById(wagerId)
                .orElseThrow(() -> new IllegalStateException("Wager vanished after cancel: " + wagerId));
        flowLogger.logWagerCancelled(cancelled, balanceAfter);
        metricsService.recordWagerCancelled();
        return cancelled;
    }

    /**
     * Wagers of a user, newest first.
     *
     * @param statusFilter null for every status
     */
    @Transactional(readOnly = true)
    public Page<Wager> getUserWagers(String userId, WagerStatus statusFilter, int page) {
        Pageable pageable = PageRequest.of(Math.max(page, 0), bettingConfig.getPageSize());
        if (statusFilter == null) {
            return wagerRepository.findByUserIdOrderByPlacedAtDesc(userId, pageable);
        }
        return wagerRepository.findByUserIdAndStatusOrderByPlacedAtDesc(userId, statusFilter, pageable);
    }

    @Transactional(readOnly = true)
    public Wager getWager(String userId, String wagerId) {
        return wagerRepository.findByIdAndUserId(wagerId, userId)
                .orElseThrow(() -> new UnknownWagerException("Wager not found: " + wagerId));
    }

    @Transactional(readOnly = true)
    public List<EventView> listBettable() {
        Instant now = bettingWindow.now();
        return eventStore.listBettable(now).stream()
                .map(event -> eventStore.view(event, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public EventView getEventView(Long eventId) {
        return eventStore.view(eventStore.getEvent(eventId), bettingWindow.now());
    }

    private void validateStake(String userId, Long eventId, BigDecimal stake) {
        String problem = null;
        if (stake == null) {
            problem = "Stake is required";
        } else if (stake.signum() <= 0) {
            problem = "Stake must be positive, got: " + stake;
        } else if (stake.stripTrailingZeros().scale() > 2) {
            problem = "Stake cannot have more than 2 decimals, got: " + stake;
        } else if (stake.compareTo(bettingConfig.getMinStake()) < 0) {
            problem = "Stake " + stake + " is below the minimum of " + bettingConfig.getMinStake();
        } else if (Wager.calculatePotentialPayout(stake, bettingConfig.getPayoutMultiplier())
                .compareTo(Wager.MAX_AMOUNT) > 0) {
            problem = "Stake " + stake + " is too large, payout would exceed " + Wager.MAX_AMOUNT;
        }

        if (problem != null) {
            flowLogger.logWagerRejected(userId, eventId, problem);
            throw new InvalidStakeException(problem);
        }
    }
}
