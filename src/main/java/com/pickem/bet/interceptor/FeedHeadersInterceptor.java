package com.pickem.bet.interceptor;

import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * Adds the identifying headers the feed expects on every request.
 */
@RequiredArgsConstructor
public class FeedHeadersInterceptor implements Interceptor {

    private final String userAgent;

    @Override
    public Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();

        Request request = original.newBuilder()
                .header("User-Agent", userAgent != null ? userAgent : "Pickem-Betting/1.0")
                .header("Accept", "application/json")
                .build();

        return chain.proceed(request);
    }
}
