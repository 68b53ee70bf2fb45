package com.delta.adfeed.monitor.fetch;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.PageFetchResult;
import com.delta.adfeed.monitor.util.AdUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class HttpPageFetcher implements PageFetcher {
    static final String SOFT_BLOCK = "soft_block";
    static final String INVALID_URL = "invalid_url";
    static final String INTERRUPTED = "interrupted";
    static final String TIMEOUT = "timeout";
    static final String IO_ERROR = "io_error";
    static final String HTTP_STATUS = "http_status";

    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

    private final MonitorProperties.Fetch properties;
    private final HttpClient client;

    public HttpPageFetcher(
        MonitorProperties properties,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor
    ) {
        this.properties = properties.getFetch();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(fetchExecutor)
            .build();
    }

    @Override
    public String fetch(String url) throws PageFetchException {
        PageFetchResult result = fetchWithRetries(url);
        if (result.errorCode() != null) {
            throw new PageFetchException(result.errorCode(), describe(result));
        }
        if (AdUrlUtils.isSoftBlockUrl(result.finalUrlOrRequested())) {
            throw new PageFetchException(
                SOFT_BLOCK,
                "Redirected to " + result.finalUrlOrRequested() + " while loading " + url
            );
        }
        if (!result.isSuccessful()) {
            throw new PageFetchException(HTTP_STATUS, describe(result));
        }
        log.debug("Fetched {} ({} chars) in {} ms", url, result.body() == null ? 0 : result.body().length(),
            result.duration().toMillis());
        return result.body() == null ? "" : result.body();
    }

    PageFetchResult fetchWithRetries(String url) {
        int maxAttempts = 1 + properties.getMaxRetries();
        PageFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.info("Retrying {} after attempt {} failed ({})", url, attempt, describe(lastResult));
            if (!sleepBackoff(attempt)) {
                return errorResult(url, Instant.now(), INTERRUPTED, "Interrupted during retry backoff");
            }
        }
        return lastResult;
    }

    private PageFetchResult executeOnce(String url) {
        Instant startedAt = Instant.now();
        URI uri = url == null ? null : AdUrlUtils.safeUri(url.trim());
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, INVALID_URL, "URL missing host or malformed");
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", pickUserAgent())
            .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            return new PageFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, INTERRUPTED, e.getMessage());
        }
    }

    private boolean shouldRetry(PageFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null) {
            return !errorCode.equals(INVALID_URL) && !errorCode.equals(INTERRUPTED);
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        long delay = (long) baseDelayMs * (1L << Math.min(16, attempt - 1));
        int maxDelayMs = properties.getRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String pickUserAgent() {
        List<String> agents = properties.getUserAgents();
        return agents.get(ThreadLocalRandom.current().nextInt(agents.size()));
    }

    private static String describe(PageFetchResult result) {
        if (result.errorCode() != null) {
            return result.errorCode() + ": " + result.errorMessage();
        }
        return "HTTP " + result.statusCode() + " from " + result.finalUrlOrRequested();
    }

    private static PageFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new PageFetchResult(
            url,
            null,
            0,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
