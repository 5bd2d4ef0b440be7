package com.pickem.bet.entity;

import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.model.EventOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A bettable event as last reported by the game feed.
 * The stored status never contains the clock-driven lock, see
 * {@link com.pickem.bet.service.BettingWindow}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@Entity
@Table(
        name = "sport_event",
        indexes = {
                @Index(name = "idx_event_status_start", columnList = "status,scheduledStart"),
                @Index(name = "idx_event_season_week", columnList = "season,week")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_event_feed_id", columnNames = {"feedEventId"})
        }
)
public class SportEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Integer version;

    @Column(nullable = false, length = 32)
    private String feedEventId;

    @Column(nullable = false, length = 64)
    private String homeTeam;

    @Column(nullable = false, length = 64)
    private String awayTeam;

    @Column(nullable = false)
    private Instant scheduledStart;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    @Builder.Default
    private EventStatus status = EventStatus.SCHEDULED;

    private Integer season;
    private Integer week;

    // live while IN_PROGRESS, final once FINAL
    private Integer homeScore;
    private Integer awayScore;

    /** Name of the winning participant, null while undecided or on a tie. */
    @Column(length = 64)
    private String winner;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant updatedAt;

    /* -------------------- Business logic -------------------- */

    public List<String> participants() {
        return List.of(homeTeam, awayTeam);
    }

    public boolean isParticipant(String name) {
        return name != null && (name.equals(homeTeam) || name.equals(awayTeam));
    }

    /**
     * Graded outcome, present only once the event is FINAL.
     */
    public Optional<EventOutcome> getOutcome() {
        if (status != EventStatus.FINAL || homeScore == null || awayScore == null) {
            return Optional.empty();
        }
        return Optional.of(new EventOutcome(homeScore, awayScore, winner));
    }

    public String describe() {
        return awayTeam + " @ " + homeTeam;
    }
}
