package com.pickem.bet.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationReport {
    private String userId;
    private BigDecimal storedBalance;
    /** sum of every ledger delta of the user */
    private BigDecimal ledgerSum;
    /** balanceAfter of the newest ledger entry, null when there is none */
    private BigDecimal lastBalanceAfter;
    private long entryCount;

    public boolean isConsistent() {
        boolean sumMatches = storedBalance.compareTo(ledgerSum) == 0;
        boolean lastMatches = lastBalanceAfter == null
                ? storedBalance.signum() == 0
                : storedBalance.compareTo(lastBalanceAfter) == 0;
        return sumMatches && lastMatches;
    }
}
