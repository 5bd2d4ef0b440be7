package com.pickem.bet.repository;

import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.enums.WagerStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SportEventRepository extends JpaRepository<SportEvent, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM SportEvent e WHERE e.feedEventId = :feedEventId")
    Optional<SportEvent> findByFeedEventIdForUpdate(@Param("feedEventId") String feedEventId);

    /**
     * Events in {@code status} whose scheduled start lies strictly after {@code startAfter}.
     * Callers pass {@code asOf + cutoff} so that {@code asOf < lockTime} holds for every row.
     */
    @Query("""
        SELECT e FROM SportEvent e
        WHERE e.status = :status
          AND e.scheduledStart > :startAfter
        ORDER BY e.scheduledStart ASC, e.id ASC
        """)
    List<SportEvent> findByStatusStartingAfter(@Param("status") EventStatus status,
                                               @Param("startAfter") Instant startAfter);

    @Query("""
        SELECT e.id FROM SportEvent e
        WHERE e.status IN :statuses
          AND EXISTS (
              SELECT w.id FROM Wager w
              WHERE w.eventId = e.id
                AND w.status = :wagerStatus
          )
        ORDER BY e.id
        """)
    List<Long> findIdsWithWagersInStatus(@Param("statuses") Collection<EventStatus> statuses,
                                         @Param("wagerStatus") WagerStatus wagerStatus);
}
