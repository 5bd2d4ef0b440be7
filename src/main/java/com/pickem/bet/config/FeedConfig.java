package com.pickem.bet.config;

import com.pickem.bet.interceptor.FeedHeadersInterceptor;
import com.pickem.bet.interceptor.FeedHttpLoggingInterceptor;
import lombok.Data;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Data
@Configuration
public class FeedConfig {

    @Value("${feed.enabled:true}")
    private boolean enabled = true;

    @Value("${feed.base-url:https://site.api.espn.com/apis/site/v2/sports/football/nfl}")
    private String baseUrl = "https://site.api.espn.com/apis/site/v2/sports/football/nfl";

    @Value("${feed.user-agent:Pickem-Betting/1.0}")
    private String userAgent = "Pickem-Betting/1.0";

    // ==================== PERFORMANCE TUNING ====================

    @Value("${feed.request.timeout.ms:10000}")
    private int requestTimeoutMs = 10_000;

    @Value("${feed.connection.pool.size:5}")
    private int connectionPoolSize = 5;

    // ==================== RETRY CONFIGURATION ====================

    @Value("${feed.retry.max-attempts:3}")
    private int maxRetryAttempts = 3;

    @Value("${feed.retry.delay.ms:5000}")
    private long retryDelayMs = 5_000;

    @Bean
    public OkHttpClient feedHttpClient() {
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(connectionPoolSize, 5, TimeUnit.MINUTES))
                .connectTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .retryOnConnectionFailure(true)
                .addInterceptor(new FeedHttpLoggingInterceptor())
                .addInterceptor(new FeedHeadersInterceptor(userAgent))
                .build();
    }
}
