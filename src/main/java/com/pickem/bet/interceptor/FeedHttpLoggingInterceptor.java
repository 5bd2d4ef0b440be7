package com.pickem.bet.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs every game-feed call with status, timing and payload size.
 */
@Slf4j
public class FeedHttpLoggingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        log.debug("→ {} {}", request.method(), request.url());

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← FEED CALL FAILED after {}ms | Url: {} | Error: {}", tookMs, request.url(), e.getMessage());
            throw e;
        }

        long networkMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        ResponseBody body = response.body();
        long contentLength = body != null ? body.contentLength() : -1;

        log.info("← {} {} | Took: {}ms | Size: {} bytes",
                response.code(),
                request.url().encodedPath(),
                networkMs,
                contentLength);

        return response;
    }
}
