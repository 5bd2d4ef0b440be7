package com.pickem.bet.tasks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pickem.bet.config.FeedConfig;
import com.pickem.bet.exception.FeedUnavailableException;
import com.pickem.bet.interfaces.GameFeed;
import com.pickem.bet.model.FeedUpdate;
import com.pickem.bet.utils.EspnScoreboardParser;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Pulls the NFL scoreboard from ESPN's public site API.
 */
@Slf4j
@Component
public class EspnScoreboardFeed implements GameFeed {

    private static final String NAME = "ESPN";
    private static final int REGULAR_SEASON = 2;
    private static final long MAX_RETRY_AFTER_MS = 60_000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final FeedConfig feedConfig;

    public EspnScoreboardFeed(@Qualifier("feedHttpClient") OkHttpClient httpClient,
                              ObjectMapper objectMapper,
                              FeedConfig feedConfig) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.feedConfig = feedConfig;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<FeedUpdate> fetchUpdates() {
        return EspnScoreboardParser.parseScoreboard(get(scoreboardUrl().build()), objectMapper);
    }

    @Override
    public List<FeedUpdate> fetchUpdates(int season, int week) {
        HttpUrl url = scoreboardUrl()
                .addQueryParameter("seasontype", String.valueOf(REGULAR_SEASON))
                .addQueryParameter("week", String.valueOf(week))
                .addQueryParameter("year", String.valueOf(season))
                .build();
        return EspnScoreboardParser.parseScoreboard(get(url), objectMapper);
    }

    private HttpUrl.Builder scoreboardUrl() {
        HttpUrl base = HttpUrl.parse(feedConfig.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid feed.base-url: " + feedConfig.getBaseUrl());
        }
        return base.newBuilder().addPathSegment("scoreboard");
    }

    /**
     * GET with bounded retries. 429 waits for Retry-After, other failures wait the configured delay.
     */
    private String get(HttpUrl url) {
        int maxAttempts = Math.max(1, feedConfig.getMaxRetryAttempts());
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Request request = new Request.Builder().url(url).get().build();
            long waitMs = feedConfig.getRetryDelayMs();

            try (Response response = httpClient.newCall(request).execute()) {
                int status = response.code();

                if (status == 429) {
                    waitMs = retryAfterMs(response.header("Retry-After"), waitMs);
                    lastError = "rate limited (429)";
                    log.warn("⏳ Feed rate limited | Attempt: {}/{} | Waiting: {}ms", attempt, maxAttempts, waitMs);
                } else if (!response.isSuccessful()) {
                    lastError = "HTTP " + status;
                    log.warn("⚠️ Feed returned HTTP {} | Attempt: {}/{} | Url: {}", status, attempt, maxAttempts, url);
                } else {
                    ResponseBody body = response.body();
                    if (body == null) {
                        throw new FeedUnavailableException("Feed returned an empty body");
                    }
                    return body.string();
                }
            } catch (IOException e) {
                lastError = e.getMessage();
                log.warn("⚠️ Feed request failed | Attempt: {}/{} | Error: {}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                pause(waitMs);
            }
        }

        log.error("❌ Feed unavailable after {} attempts | Url: {} | Last error: {}", maxAttempts, url, lastError);
        throw new FeedUnavailableException("Feed unavailable after " + maxAttempts + " attempts: " + lastError);
    }

    static long retryAfterMs(String header, long fallbackMs) {
        if (header == null || header.isBlank()) {
            return fallbackMs;
        }
        try {
            return Math.min(Long.parseLong(header.trim()) * 1000L, MAX_RETRY_AFTER_MS);
        } catch (NumberFormatException e) {
            return fallbackMs;
        }
    }

    private static void pause(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new FeedUnavailableException("Interrupted during feed retry backoff", ie);
        }
    }
}
