package com.docsight.research.client;

import com.docsight.research.config.ResearchProperties;
import com.docsight.research.exception.FetchException;
import com.docsight.research.exception.TransientFetchException;
import com.docsight.research.model.FetchOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Single-URL GET with timeout and retry.
 *
 * Retry-After sent with a 429/503 is honored exactly; other transient failures back
 * off exponentially with jitter so domains that hit the same limit do not retry in
 * lockstep. Retry state is local to each call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchFetchClient {

    // 재시도 대상 HTTP 상태 코드
    private static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(
            408, // Request Timeout
            425, // Too Early
            429, // Too Many Requests
            500,
            502,
            503,
            504
    );

    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,9}");

    private final WebClient webClient;
    private final ResearchProperties properties;

    /**
     * Fetch with the configured retry budget.
     */
    public Mono<String> fetch(String url) {
        return fetch(url, properties.getFetch().toOptions());
    }

    /**
     * Fetches the body of {@code url}. Errors with {@link FetchException} once the
     * budget is spent or on a non-retryable response; never with anything else.
     */
    public Mono<String> fetch(String url, FetchOptions options) {
        return Mono.defer(() -> attemptRequest(url, 0, options));
    }

    /**
     * Blocking variant for callers that already run on a worker thread.
     *
     * @throws FetchException when the URL could not be fetched
     */
    public String fetchBlocking(String url, FetchOptions options) {
        return fetch(url, options).block();
    }

    private Mono<String> attemptRequest(String url, int attempt, FetchOptions options) {
        return Mono.defer(() -> executeRequest(url, attempt, options.timeout()))
                .onErrorResume(e -> {
                    if (e instanceof FetchException) {
                        return Mono.error(e);
                    }
                    if (e instanceof IllegalArgumentException) {
                        return Mono.error(new FetchException(url, "invalid URL", attempt + 1, false, e));
                    }
                    Throwable permanent = permanentCause(e);
                    if (permanent != null) {
                        log.warn("Permanent failure on {}: {}", url, permanent.toString());
                        return Mono.error(new FetchException(url, permanent.toString(), attempt + 1, false, e));
                    }

                    TransientFetchException failure = e instanceof TransientFetchException t
                            ? t
                            : TransientFetchException.io(e);
                    Duration retryAfter = failure.getRetryAfter();
                    if (retryAfter != null && retryAfter.compareTo(options.maxRetryAfter()) > 0) {
                        log.warn("Retry-After {}s on {} exceeds limit of {}s, giving up",
                                retryAfter.toSeconds(), url, options.maxRetryAfter().toSeconds());
                        return Mono.error(new FetchException(url,
                                failure.getMessage() + ", Retry-After " + retryAfter.toSeconds() + "s exceeds limit",
                                attempt + 1, failure.isRateLimited(), failure));
                    }
                    boolean lastAttempt = attempt + 1 >= options.maxRetries();
                    Duration delay = nextDelay(failure, attempt, lastAttempt, options.baseDelay());

                    if (lastAttempt) {
                        log.warn("Giving up on {} after {} attempt(s): {}", url, attempt + 1, failure.getMessage());
                        Mono<String> exhausted = Mono.error(FetchException.exhausted(url, attempt + 1, failure));
                        return delay.isZero() ? exhausted : Mono.delay(delay).then(exhausted);
                    }

                    log.warn("Transient failure on {} ({}), retrying in {}ms (attempt {}/{})",
                            url, failure.getMessage(), delay.toMillis(), attempt + 1, options.maxRetries());
                    return Mono.delay(delay)
                            .then(Mono.defer(() -> attemptRequest(url, attempt + 1, options)));
                });
    }

    private Mono<String> executeRequest(String url, int attempt, Duration timeout) {
        return webClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> handleResponse(url, attempt, response))
                .timeout(timeout);
    }

    private Mono<String> handleResponse(String url, int attempt, ClientResponse response) {
        int status = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class).defaultIfEmpty("");
        }
        if (TRANSIENT_STATUS_CODES.contains(status)) {
            Duration retryAfter = (status == 429 || status == 503)
                    ? parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER))
                    : null;
            return response.releaseBody()
                    .then(Mono.error(TransientFetchException.status(status, retryAfter)));
        }
        return response.releaseBody()
                .then(Mono.error(FetchException.permanent(url, status, attempt + 1)));
    }

    /**
     * Returns the first cause that no retry can fix (unknown host, TLS failure,
     * response over the buffer limit), or null.
     */
    static Throwable permanentCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof UnknownHostException
                    || current instanceof SSLException
                    || current instanceof DataBufferLimitException) {
                return current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    /**
     * Server-specified wait wins; otherwise exponential backoff, skipped after the
     * final attempt.
     */
    static Duration nextDelay(TransientFetchException failure, int attempt, boolean lastAttempt, Duration baseDelay) {
        if (failure.getRetryAfter() != null) {
            return failure.getRetryAfter();
        }
        return lastAttempt ? Duration.ZERO : backoffDelay(attempt, baseDelay);
    }

    /**
     * {@code 2^attempt * baseDelay + random[0, baseDelay]}.
     */
    static Duration backoffDelay(int attempt, Duration baseDelay) {
        long baseMs = baseDelay.toMillis();
        long exponential = (1L << Math.min(attempt, 30)) * baseMs;
        long jitter = baseMs > 0 ? ThreadLocalRandom.current().nextLong(baseMs + 1) : 0;
        return Duration.ofMillis(exponential + jitter);
    }

    /**
     * Parses a Retry-After value given as delta-seconds or an HTTP-date.
     * Returns null when absent or unparseable.
     */
    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            ZonedDateTime until = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration remaining = Duration.between(ZonedDateTime.now(until.getZone()), until);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Retry-After header: {}", value);
            return null;
        }
    }
}
