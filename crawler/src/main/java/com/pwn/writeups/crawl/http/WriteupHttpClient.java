package com.pwn.writeups.crawl.http;

import com.pwn.writeups.config.CrawlerProperties;
import com.pwn.writeups.crawl.model.FetchOutcome;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-shot GET client. Retrying is left to callers; every non-200 answer and
 * every transport error comes back as a {@link FetchOutcome.TransientFailure}.
 */
@Service
public class WriteupHttpClient {
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final CrawlerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public WriteupHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getPoolWidth());
    }

    public FetchOutcome get(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return FetchOutcome.TransientFailure.ofError(url, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;

            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", CrawlerProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", ACCEPT_HTML)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                return FetchOutcome.TransientFailure.ofStatus(url, response.statusCode());
            }
            byte[] responseBytes = response.body();
            String body = responseBytes == null ? "" : new String(responseBytes, StandardCharsets.UTF_8);
            return new FetchOutcome.Success(url, response.statusCode(), body);
        } catch (HttpTimeoutException e) {
            return FetchOutcome.TransientFailure.ofError(url, "timeout", e.getMessage());
        } catch (IOException e) {
            return FetchOutcome.TransientFailure.ofError(url, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.TransientFailure.ofError(url, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return FetchOutcome.TransientFailure.ofError(url, "invalid_url", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }

    private static URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
