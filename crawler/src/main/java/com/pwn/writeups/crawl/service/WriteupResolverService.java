package com.pwn.writeups.crawl.service;

import com.pwn.writeups.config.CrawlerProperties;
import com.pwn.writeups.crawl.extract.WriteupPageExtractor;
import com.pwn.writeups.crawl.http.WriteupHttpClient;
import com.pwn.writeups.crawl.model.CatalogRow;
import com.pwn.writeups.crawl.model.DetailLinks;
import com.pwn.writeups.crawl.model.FetchOutcome;
import com.pwn.writeups.crawl.model.ResolvedRecord;
import com.pwn.writeups.crawl.model.RowOutcome;
import com.pwn.writeups.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Resolves the canonical write-up URL of one catalogue row.
 * <p>
 * The detail page is searched for, in order: a link in the first paragraphs of the description,
 * the "Original writeup" link, and finally the detail page URL itself. Failed fetches are retried
 * with {@link RetryBackoff} up to {@code crawler.max-attempts} times.
 */
@Service
public class WriteupResolverService {
    private static final Logger log = LoggerFactory.getLogger(WriteupResolverService.class);

    private final CrawlerProperties properties;
    private final WriteupHttpClient httpClient;
    private final WriteupPageExtractor extractor;
    private final RetryBackoff backoff;

    public WriteupResolverService(
        CrawlerProperties properties,
        WriteupHttpClient httpClient,
        WriteupPageExtractor extractor,
        RetryBackoff backoff
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.extractor = extractor;
        this.backoff = backoff;
    }

    public ResolvedRecord resolve(CatalogRow row) {
        return resolveRow(row, CrawlDeadline.none()).record();
    }

    /**
     * @throws ResolutionFailedException once every attempt failed, the deadline passed or the worker was interrupted
     */
    public RowOutcome.Resolved resolveRow(CatalogRow row, CrawlDeadline deadline) {
        int maxAttempts = properties.getMaxAttempts();
        String detailUrl = detailUrl(row);
        String lastReason = ReasonCodeClassifier.UNKNOWN;
        int attempts = 0;

        for (int i = 0; i < maxAttempts; i++) {
            if (deadline.isExpired()) {
                throw new ResolutionFailedException(row.ctf(), row.challenge(), attempts, ReasonCodeClassifier.DEADLINE_EXCEEDED);
            }
            attempts++;
            ResolutionAttempt attempt = attemptOnce(row, detailUrl);
            if (attempt instanceof ResolutionAttempt.Succeeded succeeded) {
                log.debug("Fetched info for {} - {}.", row.ctf(), row.challenge());
                return new RowOutcome.Resolved(row, succeeded.record(), attempts);
            }

            ResolutionAttempt.Retryable retryable = (ResolutionAttempt.Retryable) attempt;
            lastReason = retryable.reasonCode();
            if (attempts >= maxAttempts) {
                break;
            }
            if (deadline.isExpired()) {
                throw new ResolutionFailedException(row.ctf(), row.challenge(), attempts, ReasonCodeClassifier.DEADLINE_EXCEEDED);
            }
            Duration delay = backoff.delayFor(i);
            log.debug(
                "Failed to request {} ({}: {}). Retrying in {}ms.",
                detailUrl,
                retryable.reasonCode(),
                retryable.detail(),
                String.format(Locale.ROOT, "%.0f", delay.toNanos() / 1_000_000d)
            );
            if (!backoff.pause(delay)) {
                throw new ResolutionFailedException(row.ctf(), row.challenge(), attempts, ReasonCodeClassifier.INTERRUPTED);
            }
        }

        log.warn("Giving up on {} - {} after {} attempts (last reason {})", row.ctf(), row.challenge(), attempts, lastReason);
        throw new ResolutionFailedException(row.ctf(), row.challenge(), attempts, lastReason);
    }

    String detailUrl(CatalogRow row) {
        String path = row.detailPath();
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        return properties.getBaseUrl() + path;
    }

    private ResolutionAttempt attemptOnce(CatalogRow row, String detailUrl) {
        FetchOutcome outcome = httpClient.get(detailUrl);
        if (outcome instanceof FetchOutcome.TransientFailure failure) {
            String detail = failure.message() == null ? "status " + failure.statusCode() : failure.message();
            return new ResolutionAttempt.Retryable(ReasonCodeClassifier.classify(failure), detail);
        }

        FetchOutcome.Success success = (FetchOutcome.Success) outcome;
        DetailLinks links = extractor.extractLinks(success.body(), detailUrl);
        String writeupUrl = links.inlineLink()
            .or(links::fallbackLink)
            .orElse(detailUrl);
        return new ResolutionAttempt.Succeeded(new ResolvedRecord(row.ctf(), row.challenge(), writeupUrl));
    }
}
