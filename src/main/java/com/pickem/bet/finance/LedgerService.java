package com.pickem.bet.finance;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.LedgerEntry;
import com.pickem.bet.entity.UserAccount;
import com.pickem.bet.enums.LedgerReason;
import com.pickem.bet.exception.InsufficientFundsException;
import com.pickem.bet.exception.UnknownUserException;
import com.pickem.bet.model.ReconciliationReport;
import com.pickem.bet.repository.LedgerEntryRepository;
import com.pickem.bet.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Owns every user balance. All balance changes go through {@link #applyDelta}, which
 * locks the account row, refuses to go negative and appends an audit entry in the
 * caller's transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerService {

    private final UserAccountRepository userAccountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final BettingConfig bettingConfig;
    private final Clock clock;
    private final PlatformTransactionManager transactionManager;

    /**
     * Create the account on first sight of a user, granting the starting balance.
     * Calling it again only refreshes the display name. Runs in its own transaction; when a
     * concurrent first call inserts the same user first, the existing account is returned.
     */
    public UserAccount openAccount(String userId, String displayName) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be blank");
        }

        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        try {
            return tx.execute(status -> openOrRefresh(userId, displayName));
        } catch (DataIntegrityViolationException e) {
            log.debug("Account for user={} created concurrently, re-reading", userId);
            return tx.execute(status -> openOrRefresh(userId, displayName));
        }
    }

    private UserAccount openOrRefresh(String userId, String displayName) {
        return userAccountRepository.findById(userId)
                .map(existing -> {
                    if (displayName != null && !displayName.equals(existing.getDisplayName())) {
                        existing.setDisplayName(displayName);
                        log.debug("Display name refreshed for user={}: {}", userId, displayName);
                    }
                    return existing;
                })
                .orElseGet(() -> createAccount(userId, displayName));
    }

    private UserAccount createAccount(String userId, String displayName) {
        Instant now = clock.instant();
        UserAccount account = UserAccount.builder()
                .userId(userId)
                .displayName(displayName)
                .balance(BigDecimal.ZERO.setScale(2))
                .createdAt(now)
                .lastUpdated(now)
                .build();
        userAccountRepository.saveAndFlush(account);

        BigDecimal grant = bettingConfig.getStartingBalance();
        if (grant != null && grant.signum() > 0) {
            applyDelta(userId, grant, LedgerReason.ACCOUNT_OPENED, null);
        }

        log.info("🆕 Account opened | User: {} | Name: {} | StartingBalance: {}", userId, displayName, grant);
        return userAccountRepository.findById(userId).orElseThrow();
    }

    /**
     * Atomically adjust a balance by a signed amount.
     *
     * @param userId    account owner
     * @param amount    positive = credit, negative = debit, never zero, at most 2 decimals
     * @param reason    audit tag
     * @param reference related wager id, may be null
     * @return the balance after the delta
     * @throws UnknownUserException       if no account exists
     * @throws InsufficientFundsException if the balance would become negative
     */
    @Transactional
    public BigDecimal applyDelta(String userId, BigDecimal amount, LedgerReason reason, String reference) {
        Objects.requireNonNull(reason, "reason is required");
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Delta amount must be non-zero");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Delta amount has more than 2 decimals: " + amount);
        }

        UserAccount account = userAccountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new UnknownUserException("No account for user: " + userId));

        BigDecimal oldBalance = account.getBalance();
        BigDecimal newBalance = oldBalance.add(amount).setScale(2);

        if (newBalance.signum() < 0) {
            log.warn("Insufficient balance for user={}: required={}, available={} | Reason: {}",
                    userId, amount.negate(), oldBalance, reason);
            throw new InsufficientFundsException(userId, oldBalance, amount.negate());
        }

        Instant now = clock.instant();
        account.setBalance(newBalance);
        account.setLastUpdated(now);
        userAccountRepository.save(account);

        ledgerEntryRepository.save(LedgerEntry.builder()
                .userId(userId)
                .amount(amount.setScale(2))
                .reason(reason)
                .reference(reference)
                .balanceAfter(newBalance)
                .createdAt(now)
                .build());

        log.info("Balance updated for user={}: {} -> {} (change: {}) | Reason: {} | Ref: {}",
                userId, oldBalance, newBalance, amount, reason, reference);

        return newBalance;
    }

    /**
     * Take a positive amount out of the balance.
     */
    @Transactional
    public BigDecimal debit(String userId, BigDecimal amount, LedgerReason reason, String reference) {
        requirePositive(amount);
        return applyDelta(userId, amount.negate(), reason, reference);
    }

    /**
     * Put a positive amount back into the balance.
     */
    @Transactional
    public BigDecimal credit(String userId, BigDecimal amount, LedgerReason reason, String reference) {
        requirePositive(amount);
        return applyDelta(userId, amount, reason, reference);
    }

    @Transactional(readOnly = true)
    public UserAccount getAccount(String userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new UnknownUserException("No account for user: " + userId));
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance(String userId) {
        return getAccount(userId).getBalance();
    }

    @Transactional(readOnly = true)
    public Page<LedgerEntry> history(String userId, int page) {
        getAccount(userId);
        return ledgerEntryRepository.findByUserIdOrderByIdDesc(userId,
                PageRequest.of(Math.max(page, 0), bettingConfig.getPageSize()));
    }

    /**
     * Compare the stored balance with the audit trail. Read-only: drift is reported, never corrected.
     */
    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(String userId) {
        UserAccount account = getAccount(userId);
        BigDecimal sum = ledgerEntryRepository.sumAmountsByUserId(userId);
        BigDecimal last = ledgerEntryRepository.findTopByUserIdOrderByIdDesc(userId)
                .map(LedgerEntry::getBalanceAfter)
                .orElse(null);

        return ReconciliationReport.builder()
                .userId(userId)
                .storedBalance(account.getBalance())
                .ledgerSum(sum == null ? BigDecimal.ZERO : sum)
                .lastBalanceAfter(last)
                .entryCount(ledgerEntryRepository.countByUserId(userId))
                .build();
    }

    /**
     * Reconcile every account and log drift.
     *
     * @return number of accounts whose balance disagrees with the ledger
     */
    public int reconcileAllAccounts() {
        log.info("Starting balance reconciliation from ledger...");
        List<String> userIds = userAccountRepository.findAllUserIds();
        int drifted = 0;

        for (String userId : userIds) {
            ReconciliationReport report = reconcile(userId);
            if (!report.isConsistent()) {
                drifted++;
                log.warn("⚠️ Balance drift detected for user {}: stored={}, ledgerSum={}, lastEntry={}",
                        userId, report.getStoredBalance(), report.getLedgerSum(), report.getLastBalanceAfter());
            }
        }

        log.info("Balance reconciliation complete: {} accounts checked, {} drifted", userIds.size(), drifted);
        return drifted;
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
