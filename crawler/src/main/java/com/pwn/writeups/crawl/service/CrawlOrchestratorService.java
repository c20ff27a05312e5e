package com.pwn.writeups.crawl.service;

import com.pwn.writeups.config.CrawlerProperties;
import com.pwn.writeups.crawl.extract.WriteupPageExtractor;
import com.pwn.writeups.crawl.http.WriteupHttpClient;
import com.pwn.writeups.crawl.model.CatalogRow;
import com.pwn.writeups.crawl.model.CrawlRunSummary;
import com.pwn.writeups.crawl.model.FetchOutcome;
import com.pwn.writeups.crawl.model.RowOutcome;
import com.pwn.writeups.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one crawl: a single index fetch, then one resolution task per catalogue row on a worker
 * pool of {@code crawler.pool-width} threads. The pool lives for exactly one call.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final CrawlerProperties properties;
    private final WriteupHttpClient httpClient;
    private final WriteupPageExtractor extractor;
    private final WriteupResolverService resolverService;
    private final Clock clock;

    public CrawlOrchestratorService(
        CrawlerProperties properties,
        WriteupHttpClient httpClient,
        WriteupPageExtractor extractor,
        WriteupResolverService resolverService,
        Clock clock
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.extractor = extractor;
        this.resolverService = resolverService;
        this.clock = clock;
    }

    public CrawlRunSummary crawl() {
        return crawl(CrawlDeadline.after(clock, properties.getRun().getMaxDurationSeconds()));
    }

    /**
     * @throws CrawlAbortedException if the index page cannot be fetched
     * @throws com.pwn.writeups.crawl.extract.PageStructureException if the index page has drifted
     */
    public CrawlRunSummary crawl(CrawlDeadline deadline) {
        Instant startedAt = clock.instant();
        String indexUrl = properties.getIndexUrl();

        FetchOutcome outcome = httpClient.get(indexUrl);
        if (outcome instanceof FetchOutcome.TransientFailure failure) {
            throw new CrawlAbortedException(
                "Could not fetch the write-ups index " + indexUrl + ": "
                    + ReasonCodeClassifier.classify(failure) + " (status " + failure.statusCode() + ")"
            );
        }
        FetchOutcome.Success index = (FetchOutcome.Success) outcome;
        List<CatalogRow> rows = extractor.extractRows(index.body(), indexUrl);
        log.info("Fetched the write-ups list: {} rows from {}", rows.size(), indexUrl);

        List<RowOutcome> outcomes = rows.isEmpty() ? List.of() : resolveAll(rows, deadline);

        int failed = (int) outcomes.stream().filter(RowOutcome.Failed.class::isInstance).count();
        String status = failed == 0 ? CrawlRunSummary.COMPLETED : CrawlRunSummary.COMPLETED_WITH_ERRORS;
        CrawlRunSummary summary = new CrawlRunSummary(startedAt, clock.instant(), status, indexUrl, outcomes);
        log.info(
            "Crawl completed with status {}: rows={}, resolved={}, failed={}, durationMs={}",
            status,
            summary.rowCount(),
            summary.rowCount() - failed,
            failed,
            summary.durationMs()
        );
        return summary;
    }

    private List<RowOutcome> resolveAll(List<CatalogRow> rows, CrawlDeadline deadline) {
        ExecutorService pool = Executors.newFixedThreadPool(properties.getPoolWidth(), workerThreadFactory());
        boolean drained = false;
        try {
            List<CompletableFuture<RowOutcome>> futures = new ArrayList<>();
            for (CatalogRow row : rows) {
                futures.add(CompletableFuture.supplyAsync(() -> resolveOne(row, deadline), pool));
            }

            List<RowOutcome> outcomes = new ArrayList<>(rows.size());
            for (int i = 0; i < futures.size(); i++) {
                CatalogRow row = rows.get(i);
                try {
                    outcomes.add(futures.get(i).join());
                } catch (CompletionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Resolution task crashed for {} - {}", row.ctf(), row.challenge(), cause);
                    outcomes.add(new RowOutcome.Failed(row, 0, ReasonCodeClassifier.UNEXPECTED_ERROR, String.valueOf(cause)));
                }
            }
            drained = true;
            return outcomes;
        } finally {
            shutdown(pool, drained);
        }
    }

    private RowOutcome resolveOne(CatalogRow row, CrawlDeadline deadline) {
        try {
            return resolverService.resolveRow(row, deadline);
        } catch (ResolutionFailedException e) {
            return new RowOutcome.Failed(row, e.getAttempts(), e.getReasonCode(), e.getMessage());
        }
    }

    private void shutdown(ExecutorService pool, boolean drained) {
        if (!drained) {
            pool.shutdownNow();
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "writeup-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
