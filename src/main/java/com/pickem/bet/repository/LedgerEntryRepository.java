package com.pickem.bet.repository;

import com.pickem.bet.entity.LedgerEntry;
import com.pickem.bet.enums.LedgerReason;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    Page<LedgerEntry> findByUserIdOrderByIdDesc(String userId, Pageable pageable);

    Optional<LedgerEntry> findTopByUserIdOrderByIdDesc(String userId);

    List<LedgerEntry> findByReferenceOrderByIdAsc(String reference);

    List<LedgerEntry> findByReferenceAndReason(String reference, LedgerReason reason);

    long countByUserId(String userId);

    /**
     * Full scan of a user's deltas, used for reconciliation only.
     */
    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM LedgerEntry e WHERE e.userId = :userId")
    BigDecimal sumAmountsByUserId(@Param("userId") String userId);
}
