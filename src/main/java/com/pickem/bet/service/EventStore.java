package com.pickem.bet.service;

import com.pickem.bet.config.BettingConfig;
import com.pickem.bet.entity.SportEvent;
import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.enums.WagerStatus;
import com.pickem.bet.exception.FeedDataInconsistentException;
import com.pickem.bet.exception.UnknownEventException;
import com.pickem.bet.model.EventView;
import com.pickem.bet.model.FeedUpdate;
import com.pickem.bet.model.FeedUpdateResult;
import com.pickem.bet.repository.SportEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Current known state of every bettable event. Only the feed writes here;
 * updates are idempotent and status only moves forward.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventStore {

    private final SportEventRepository sportEventRepository;
    private final BettingWindow bettingWindow;
    private final BettingConfig bettingConfig;

    private static final String EMOJI_NEW = "🆕";
    private static final String EMOJI_UPDATE = "🔄";
    private static final String EMOJI_FLAG = "🏁";
    private static final String EMOJI_WARNING = "⚠️";

    @Transactional(readOnly = true)
    public SportEvent getEvent(Long eventId) {
        if (eventId == null) {
            throw new UnknownEventException("Event id is required");
        }
        return sportEventRepository.findById(eventId)
                .orElseThrow(() -> new UnknownEventException("Event not found: " + eventId));
    }

    /**
     * Events that are SCHEDULED and whose lock time is still ahead of {@code asOf}.
     */
    @Transactional(readOnly = true)
    public List<SportEvent> listBettable(Instant asOf) {
        Objects.requireNonNull(asOf, "asOf is required");
        return sportEventRepository.findByStatusStartingAfter(EventStatus.SCHEDULED,
                asOf.plus(bettingConfig.getCutoff()));
    }

    /**
     * Terminal events that still hold PENDING wagers, i.e. settlement work left over
     * from a crash or a missed signal.
     */
    @Transactional(readOnly = true)
    public List<Long> findTerminalWithPendingWagers() {
        return sportEventRepository.findIdsWithWagersInStatus(
                EnumSet.of(EventStatus.FINAL, EventStatus.CANCELLED), WagerStatus.PENDING);
    }

    public EventView view(SportEvent event, Instant now) {
        return EventView.builder()
                .id(event.getId())
                .feedEventId(event.getFeedEventId())
                .homeTeam(event.getHomeTeam())
                .awayTeam(event.getAwayTeam())
                .scheduledStart(event.getScheduledStart())
                .lockTime(bettingWindow.lockTime(event))
                .status(bettingWindow.effectiveStatus(event, now))
                .bettable(bettingWindow.isOpen(event, now))
                .season(event.getSeason())
                .week(event.getWeek())
                .homeScore(event.getHomeScore())
                .awayScore(event.getAwayScore())
                .winner(event.getWinner())
                .build();
    }

    /**
     * Apply one feed snapshot. Unknown feed ids create the event.
     *
     * @return APPLIED when anything changed, NOOP for duplicates
     * @throws FeedDataInconsistentException when the update contradicts stored state;
     *                                       nothing is written in that case
     */
    @Transactional
    public FeedUpdateResult recordFeedUpdate(FeedUpdate update) {
        validateShape(update);

        return sportEventRepository.findByFeedEventIdForUpdate(update.getFeedEventId())
                .map(existing -> applyToExisting(existing, update))
                .orElseGet(() -> createFromFeed(update));
    }

    private FeedUpdateResult createFromFeed(FeedUpdate update) {
        if (update.getHomeTeam() == null || update.getAwayTeam() == null || update.getScheduledStart() == null) {
            throw new FeedDataInconsistentException(update.getFeedEventId(),
                    "New event is missing participants or scheduled start");
        }
        if (update.getHomeTeam().equals(update.getAwayTeam())) {
            throw new FeedDataInconsistentException(update.getFeedEventId(), "Both participants are the same");
        }

        Instant now = bettingWindow.now();
        SportEvent event = SportEvent.builder()
                .feedEventId(update.getFeedEventId())
                .homeTeam(update.getHomeTeam())
                .awayTeam(update.getAwayTeam())
                .scheduledStart(update.getScheduledStart())
                .status(update.getStatus())
                .season(update.getSeason())
                .week(update.getWeek())
                .createdAt(now)
                .updatedAt(now)
                .build();

        if (carriesScores(update.getStatus())) {
            event.setHomeScore(update.getHomeScore());
            event.setAwayScore(update.getAwayScore());
        }
        if (update.getStatus() == EventStatus.FINAL) {
            validateOutcome(event, update);
            event.setWinner(update.getWinner());
        }

        SportEvent saved = sportEventRepository.save(event);
        log.info("{} Event created from feed | FeedId: {} | {} | Start: {} | Status: {}",
                EMOJI_NEW, saved.getFeedEventId(), saved.describe(), saved.getScheduledStart(), saved.getStatus());

        return FeedUpdateResult.builder()
                .kind(FeedUpdateResult.Kind.APPLIED)
                .eventId(saved.getId())
                .feedEventId(saved.getFeedEventId())
                .previousStatus(null)
                .newStatus(saved.getStatus())
                .build();
    }

    private FeedUpdateResult applyToExisting(SportEvent event, FeedUpdate update) {
        EventStatus current = event.getStatus();
        EventStatus next = update.getStatus();

        if (!current.canMoveTo(next)) {
            throw new FeedDataInconsistentException(update.getFeedEventId(),
                    "Status cannot move from " + current + " to " + next);
        }
        if (!sameParticipants(event, update)) {
            throw new FeedDataInconsistentException(update.getFeedEventId(),
                    "Participants changed from " + event.describe() + " to "
                            + update.getAwayTeam() + " @ " + update.getHomeTeam());
        }
        if (next == EventStatus.FINAL) {
            validateOutcome(event, update);
        }

        if (current.isTerminal()) {
            // same terminal status again: a duplicate is fine, a different final result is not
            if (current == EventStatus.FINAL && !sameOutcome(event, update)) {
                throw new FeedDataInconsistentException(update.getFeedEventId(),
                        "Final outcome already recorded as " + event.getHomeScore() + "-" + event.getAwayScore()
                                + " winner=" + event.getWinner());
            }
            return noop(event);
        }

        boolean changed = false;

        if (next == EventStatus.SCHEDULED && update.getScheduledStart() != null
                && !update.getScheduledStart().equals(event.getScheduledStart())) {
            log.info("{} Event rescheduled | FeedId: {} | {} -> {}",
                    EMOJI_UPDATE, event.getFeedEventId(), event.getScheduledStart(), update.getScheduledStart());
            event.setScheduledStart(update.getScheduledStart());
            changed = true;
        }

        if (carriesScores(next)) {
            if (update.getHomeScore() != null && !update.getHomeScore().equals(event.getHomeScore())) {
                event.setHomeScore(update.getHomeScore());
                changed = true;
            }
            if (update.getAwayScore() != null && !update.getAwayScore().equals(event.getAwayScore())) {
                event.setAwayScore(update.getAwayScore());
                changed = true;
            }
        }

        if (next == EventStatus.FINAL) {
            event.setWinner(update.getWinner());
        }
        if (event.getSeason() == null && update.getSeason() != null) {
            event.setSeason(update.getSeason());
            changed = true;
        }
        if (event.getWeek() == null && update.getWeek() != null) {
            event.setWeek(update.getWeek());
            changed = true;
        }

        if (next != current) {
            event.setStatus(next);
            changed = true;
        }

        if (!changed) {
            return noop(event);
        }

        event.setUpdatedAt(bettingWindow.now());
        sportEventRepository.save(event);

        if (next != current) {
            log.info("{} Event status {} -> {} | FeedId: {} | {} | Score: {}-{} | Winner: {}",
                    next.isTerminal() ? EMOJI_FLAG : EMOJI_UPDATE,
                    current, next, event.getFeedEventId(), event.describe(),
                    event.getHomeScore(), event.getAwayScore(), event.getWinner());
        } else {
            log.debug("Event refreshed | FeedId: {} | Status: {} | Score: {}-{}",
                    event.getFeedEventId(), next, event.getHomeScore(), event.getAwayScore());
        }

        return FeedUpdateResult.builder()
                .kind(FeedUpdateResult.Kind.APPLIED)
                .eventId(event.getId())
                .feedEventId(event.getFeedEventId())
                .previousStatus(current)
                .newStatus(next)
                .build();
    }

    /* ============================ Validation ============================ */

    private void validateShape(FeedUpdate update) {
        if (update == null || update.getFeedEventId() == null || update.getFeedEventId().isBlank()) {
            throw new FeedDataInconsistentException(null, "Feed update without event id");
        }
        if (update.getStatus() == null) {
            throw new FeedDataInconsistentException(update.getFeedEventId(), "Feed update without status");
        }
    }

    /**
     * A final result needs both scores, and the declared winner must be a participant
     * whose score is strictly higher. Equal scores mean a tie with no winner.
     */
    private void validateOutcome(SportEvent event, FeedUpdate update) {
        String id = update.getFeedEventId();
        Integer home = update.getHomeScore();
        Integer away = update.getAwayScore();
        String winner = update.getWinner();

        if (home == null || away == null) {
            log.warn("{} Final update without scores | FeedId: {}", EMOJI_WARNING, id);
            throw new FeedDataInconsistentException(id, "Final update must carry both scores");
        }
        if (winner == null) {
            if (!home.equals(away)) {
                throw new FeedDataInconsistentException(id, "No winner declared for non-tied score " + home + "-" + away);
            }
            return;
        }
        if (!event.isParticipant(winner)) {
            throw new FeedDataInconsistentException(id, "Winner '" + winner + "' is not a participant of " + event.describe());
        }
        boolean homeWon = winner.equals(event.getHomeTeam());
        if (homeWon ? home <= away : away <= home) {
            throw new FeedDataInconsistentException(id, "Winner '" + winner + "' contradicts score " + home + "-" + away);
        }
    }

    private static boolean sameParticipants(SportEvent event, FeedUpdate update) {
        boolean homeOk = update.getHomeTeam() == null || update.getHomeTeam().equals(event.getHomeTeam());
        boolean awayOk = update.getAwayTeam() == null || update.getAwayTeam().equals(event.getAwayTeam());
        return homeOk && awayOk;
    }

    private static boolean sameOutcome(SportEvent event, FeedUpdate update) {
        if (event.getStatus() != EventStatus.FINAL) {
            return true;
        }
        return Objects.equals(event.getHomeScore(), update.getHomeScore())
                && Objects.equals(event.getAwayScore(), update.getAwayScore())
                && Objects.equals(event.getWinner(), update.getWinner());
    }

    private static boolean carriesScores(EventStatus status) {
        return status == EventStatus.IN_PROGRESS || status == EventStatus.FINAL;
    }

    private static FeedUpdateResult noop(SportEvent event) {
        return FeedUpdateResult.builder()
                .kind(FeedUpdateResult.Kind.NOOP)
                .eventId(event.getId())
                .feedEventId(event.getFeedEventId())
                .previousStatus(event.getStatus())
                .newStatus(event.getStatus())
                .build();
    }
}
