package com.trackly.backend.client;

import com.trackly.backend.model.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches a feed with bounded retries and exponential backoff (1 s, 2 s, 4 s
 * with the defaults). Never throws; every outcome is reported as a
 * {@link FetchResult}.
 */
@Component
@Slf4j
public class FeedFetcher {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final FeedApiClient feedApiClient;
    private final Sleeper sleeper;

    @Value("${feed.url}")
    private String feedUrl;

    @Value("${feed.max-attempts:3}")
    private int maxAttempts;

    @Value("${feed.backoff-base-ms:1000}")
    private long backoffBaseMs;

    @Value("${feed.backoff-max-ms:30000}")
    private long backoffMaxMs;

    public FeedFetcher(FeedApiClient feedApiClient, Sleeper sleeper) {
        this.feedApiClient = feedApiClient;
        this.sleeper = sleeper;
    }

    public FetchResult fetch() {
        return fetch(feedUrl);
    }

    public FetchResult fetch(String url) {
        RetryTemplate retryTemplate = retryTemplate();
        AtomicInteger attempts = new AtomicInteger();

        RetryCallback<FetchResult, RuntimeException> download = context -> {
            attempts.incrementAndGet();
            byte[] payload = feedApiClient.download(url);
            if (payload == null || payload.length == 0) {
                throw new EmptyPayloadException();
            }
            log.debug("Feed fetch attempt {} succeeded ({} bytes)", attempts.get(), payload.length);
            return FetchResult.success(payload, attempts.get());
        };

        try {
            return retryTemplate.execute(download, context -> {
                String error = describe(context.getLastThrowable());
                log.error("❌ Feed fetch gave up after {} attempts: {}", attempts.get(), error);
                return FetchResult.failed(error, attempts.get());
            });
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Feed fetch backoff interrupted after {} attempt(s)", attempts.get());
            return FetchResult.failed("interrupted during backoff", attempts.get());
        }
    }

    RetryTemplate retryTemplate() {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(backoffBaseMs);
        backOffPolicy.setMultiplier(BACKOFF_MULTIPLIER);
        backOffPolicy.setMaxInterval(Math.max(backoffBaseMs, backoffMaxMs));
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(Math.max(1, maxAttempts)));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                    Throwable throwable) {
                log.warn("⚠️ Feed fetch attempt {}/{} failed: {}", context.getRetryCount(), maxAttempts,
                        describe(throwable));
            }
        });
        return retryTemplate;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "no attempt made";
        }
        if (error instanceof WebClientResponseException) {
            return "HTTP " + ((WebClientResponseException) error).getStatusCode().value();
        }
        if (error instanceof EmptyPayloadException) {
            return error.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static final class EmptyPayloadException extends RuntimeException {
        EmptyPayloadException() {
            super("empty response body");
        }
    }
}
