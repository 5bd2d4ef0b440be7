package com.pickem.bet.repository;

import com.pickem.bet.entity.Wager;
import com.pickem.bet.enums.WagerStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface WagerRepository extends JpaRepository<Wager, String> {

    Optional<Wager> findByIdAndUserId(String id, String userId);

    Page<Wager> findByUserIdOrderByPlacedAtDesc(String userId, Pageable pageable);

    Page<Wager> findByUserIdAndStatusOrderByPlacedAtDesc(String userId, WagerStatus status, Pageable pageable);

    @Query("SELECT w.id FROM Wager w WHERE w.eventId = :eventId AND w.status = :status ORDER BY w.placedAt")
    List<String> findIdsByEventIdAndStatus(@Param("eventId") Long eventId, @Param("status") WagerStatus status);

    /**
     * Guarded compare-and-set out of PENDING. Returns 1 when this call performed the
     * transition, 0 when the wager was already terminal (or does not exist).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Wager w
        SET w.status = :newStatus,
            w.realizedPayout = :realizedPayout,
            w.settledAt = :settledAt,
            w.version = w.version + 1
        WHERE w.id = :wagerId
          AND w.status = com.pickem.bet.enums.WagerStatus.PENDING
        """)
    int transitionFromPending(@Param("wagerId") String wagerId,
                              @Param("newStatus") WagerStatus newStatus,
                              @Param("realizedPayout") BigDecimal realizedPayout,
                              @Param("settledAt") Instant settledAt);
}
