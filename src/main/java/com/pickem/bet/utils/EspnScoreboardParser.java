package com.pickem.bet.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pickem.bet.enums.EventStatus;
import com.pickem.bet.exception.FeedUnavailableException;
import com.pickem.bet.model.FeedUpdate;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an ESPN scoreboard payload into {@link FeedUpdate}s. Events that cannot be
 * understood are skipped with a warning so one bad entry never hides the rest.
 */
@Slf4j
@NoArgsConstructor
public class EspnScoreboardParser {

    // ESPN writes "2024-09-08T17:00Z" without seconds
    private static final DateTimeFormatter ESPN_DATE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm[:ss]")
            .appendOffset("+HH:MM", "Z")
            .toFormatter(Locale.ROOT);

    private static final Map<String, EventStatus> STATUS_NAMES = Map.ofEntries(
            Map.entry("STATUS_SCHEDULED", EventStatus.SCHEDULED),
            Map.entry("STATUS_POSTPONED", EventStatus.SCHEDULED),
            Map.entry("STATUS_DELAYED", EventStatus.SCHEDULED),
            Map.entry("STATUS_IN_PROGRESS", EventStatus.IN_PROGRESS),
            Map.entry("STATUS_HALFTIME", EventStatus.IN_PROGRESS),
            Map.entry("STATUS_END_PERIOD", EventStatus.IN_PROGRESS),
            Map.entry("STATUS_RAIN_DELAY", EventStatus.IN_PROGRESS),
            Map.entry("STATUS_FINAL", EventStatus.FINAL),
            Map.entry("STATUS_FINAL_OVERTIME", EventStatus.FINAL),
            Map.entry("STATUS_FINAL_OT", EventStatus.FINAL),
            Map.entry("STATUS_CANCELED", EventStatus.CANCELLED),
            Map.entry("STATUS_CANCELLED", EventStatus.CANCELLED),
            // older payloads carry display names
            Map.entry("Scheduled", EventStatus.SCHEDULED),
            Map.entry("Postponed", EventStatus.SCHEDULED),
            Map.entry("In Progress", EventStatus.IN_PROGRESS),
            Map.entry("Final", EventStatus.FINAL),
            Map.entry("Final/OT", EventStatus.FINAL),
            Map.entry("Cancelled", EventStatus.CANCELLED),
            Map.entry("Canceled", EventStatus.CANCELLED)
    );

    public static List<FeedUpdate> parseScoreboard(String json, ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        if (json == null || json.isBlank()) {
            throw new FeedUnavailableException("Empty scoreboard response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FeedUnavailableException("Scoreboard response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parseScoreboard(root);
    }

    public static List<FeedUpdate> parseScoreboard(JsonNode root) {
        JsonNode events = root.path("events");
        if (!events.isArray()) {
            throw new FeedUnavailableException("Scoreboard response has no 'events' array");
        }

        Integer defaultSeason = intOrNull(root.path("season").path("year"));
        Integer defaultWeek = intOrNull(root.path("week").path("number"));

        List<FeedUpdate> updates = new ArrayList<>(events.size());
        for (JsonNode event : events) {
            parseEvent(event, defaultSeason, defaultWeek).ifPresent(updates::add);
        }

        log.debug("Parsed {} of {} scoreboard events", updates.size(), events.size());
        return updates;
    }

    static Optional<FeedUpdate> parseEvent(JsonNode event, Integer defaultSeason, Integer defaultWeek) {
        String id = event.path("id").asText(null);
        if (id == null || id.isBlank()) {
            log.warn("⚠️ Skipping scoreboard event without id");
            return Optional.empty();
        }

        try {
            EventStatus status = mapStatus(event.path("status").path("type"));
            if (status == null) {
                log.warn("⚠️ Skipping event with unknown status | FeedId: {} | Status: {}",
                        id, event.path("status").path("type").path("name").asText());
                return Optional.empty();
            }

            Instant start = parseDate(event.path("date").asText(null));
            if (start == null) {
                log.warn("⚠️ Skipping event without start time | FeedId: {}", id);
                return Optional.empty();
            }

            JsonNode competitors = event.path("competitions").path(0).path("competitors");
            if (!competitors.isArray() || competitors.size() != 2) {
                log.warn("⚠️ Expected 2 competitors | FeedId: {} | Got: {}", id, competitors.size());
                return Optional.empty();
            }

            String homeTeam = null;
            String awayTeam = null;
            Integer homeScore = null;
            Integer awayScore = null;
            for (JsonNode competitor : competitors) {
                String name = competitor.path("team").path("displayName").asText(null);
                Integer score = parseScore(competitor.path("score"));
                if ("home".equals(competitor.path("homeAway").asText())) {
                    homeTeam = name;
                    homeScore = score;
                } else {
                    awayTeam = name;
                    awayScore = score;
                }
            }

            if (homeTeam == null || awayTeam == null) {
                log.warn("⚠️ Missing home or away team | FeedId: {}", id);
                return Optional.empty();
            }

            FeedUpdate.FeedUpdateBuilder builder = FeedUpdate.builder()
                    .feedEventId(id)
                    .homeTeam(homeTeam)
                    .awayTeam(awayTeam)
                    .scheduledStart(start)
                    .status(status)
                    .season(Optional.ofNullable(intOrNull(event.path("season").path("year")))
                            .orElse(defaultSeason != null ? defaultSeason : seasonOf(start)))
                    .week(Optional.ofNullable(intOrNull(event.path("week").path("number"))).orElse(defaultWeek));

            // pre-game payloads report "0" for both sides
            if (status == EventStatus.IN_PROGRESS || status == EventStatus.FINAL) {
                builder.homeScore(homeScore).awayScore(awayScore);
            }
            if (status == EventStatus.FINAL) {
                if (homeScore == null || awayScore == null) {
                    log.warn("⚠️ Final event without scores | FeedId: {}", id);
                    return Optional.empty();
                }
                builder.winner(homeScore > awayScore ? homeTeam : awayScore > homeScore ? awayTeam : null);
            }

            return Optional.of(builder.build());

        } catch (RuntimeException e) {
            log.warn("⚠️ Skipping malformed scoreboard event | FeedId: {} | Error: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    static EventStatus mapStatus(JsonNode statusType) {
        String name = statusType.path("name").asText("");
        EventStatus mapped = STATUS_NAMES.get(name);
        if (mapped != null) {
            return mapped;
        }
        // fall back to the coarse state ESPN always sends
        String state = statusType.path("state").asText("");
        return switch (state) {
            case "pre" -> EventStatus.SCHEDULED;
            case "in" -> EventStatus.IN_PROGRESS;
            case "post" -> statusType.path("completed").asBoolean(false) ? EventStatus.FINAL : null;
            default -> null;
        };
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, ESPN_DATE).toInstant();
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(value).toInstant();
        }
    }

    /**
     * NFL seasons start in September; January and February games belong to the previous year.
     */
    static int seasonOf(Instant start) {
        OffsetDateTime date = start.atOffset(ZoneOffset.UTC);
        return date.getMonthValue() >= 9 ? date.getYear() : date.getYear() - 1;
    }

    private static Integer parseScore(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        return Integer.parseInt(text);
    }

    private static Integer intOrNull(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
