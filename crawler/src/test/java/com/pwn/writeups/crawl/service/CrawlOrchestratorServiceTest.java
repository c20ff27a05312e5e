package com.pwn.writeups.crawl.service;

import com.pwn.writeups.config.CrawlerProperties;
import com.pwn.writeups.crawl.WriteupPages;
import com.pwn.writeups.crawl.extract.PageStructureException;
import com.pwn.writeups.crawl.extract.WriteupPageExtractor;
import com.pwn.writeups.crawl.http.WriteupHttpClient;
import com.pwn.writeups.crawl.model.CatalogRow;
import com.pwn.writeups.crawl.model.CrawlRunSummary;
import com.pwn.writeups.crawl.model.ResolvedRecord;
import com.pwn.writeups.crawl.model.RowFailure;
import com.pwn.writeups.crawl.model.RowOutcome;
import com.pwn.writeups.crawl.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlOrchestratorServiceTest {
    private static final String INDEX_PATH = "/writeups?tags=pwn&hidden-tags=pwn";

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private CrawlerProperties properties;
    private final Map<String, Supplier<MockResponse>> pages = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private volatile long detailDelayMs;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                String path = request.getPath();
                hits.computeIfAbsent(path, ignored -> new AtomicInteger()).incrementAndGet();
                int now = inFlight.incrementAndGet();
                peakInFlight.accumulateAndGet(now, Math::max);
                try {
                    if (!INDEX_PATH.equals(path) && detailDelayMs > 0) {
                        Thread.sleep(detailDelayMs);
                    }
                    Supplier<MockResponse> response = pages.get(path);
                    return response == null ? new MockResponse().setResponseCode(404) : response.get();
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        });
        server.start();

        properties = new CrawlerProperties();
        properties.setBaseUrl(server.url("/").toString());
        properties.setRetryBaseDelayMs(0);
        properties.setRequestTimeoutSeconds(5);
        httpExecutor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (httpExecutor != null) {
            httpExecutor.shutdownNow();
        }
    }

    @Test
    void resolvesEveryRowOfTheIndex() {
        servePage(INDEX_PATH, WriteupPages.index(
            new CatalogRow("CTF1", "pwn200", "/writeup/1"),
            new CatalogRow("CTF2", "pwn300", "/writeup/2")
        ));
        servePage("/writeup/1", WriteupPages.detail("https://github.com/a/a", null));
        servePage("/writeup/2", WriteupPages.detail(null, "https://blog.example/b"));

        CrawlRunSummary summary = createService().crawl();

        assertThat(summary.status()).isEqualTo(CrawlRunSummary.COMPLETED);
        assertThat(summary.records()).containsExactlyInAnyOrder(
            new ResolvedRecord("CTF1", "pwn200", "https://github.com/a/a"),
            new ResolvedRecord("CTF2", "pwn300", "https://blog.example/b")
        );
        assertThat(summary.failures()).isEmpty();
        assertThat(hitsFor(INDEX_PATH)).isEqualTo(1);
        assertThat(hitsFor("/writeup/1")).isEqualTo(1);
        assertThat(hitsFor("/writeup/2")).isEqualTo(1);
    }

    @Test
    void rowWithoutLinksResolvesToItsDetailPage() {
        servePage(INDEX_PATH, WriteupPages.index(new CatalogRow("CTF9", "heap", "/writeup/9")));
        servePage("/writeup/9", WriteupPages.detail(null, null));

        CrawlRunSummary summary = createService().crawl();

        assertThat(summary.records()).containsExactly(
            new ResolvedRecord("CTF9", "heap", properties.getBaseUrl() + "/writeup/9")
        );
    }

    @Test
    void failingRowIsReportedWithoutAbortingSiblings() {
        properties.setMaxAttempts(3);
        servePage(INDEX_PATH, WriteupPages.index(
            new CatalogRow("CTF1", "pwn200", "/writeup/1"),
            new CatalogRow("CTF2", "pwn300", "/writeup/missing"),
            new CatalogRow("CTF3", "pwn400", "/writeup/3")
        ));
        servePage("/writeup/1", WriteupPages.detail("https://github.com/a/a", null));
        servePage("/writeup/3", WriteupPages.detail(null, null));

        CrawlRunSummary summary = createService().crawl();

        assertThat(summary.status()).isEqualTo(CrawlRunSummary.COMPLETED_WITH_ERRORS);
        assertThat(summary.outcomes()).hasSize(3);
        assertThat(summary.records()).extracting(ResolvedRecord::ctf).containsExactlyInAnyOrder("CTF1", "CTF3");
        assertThat(summary.failures()).containsExactly(new RowFailure(
            "CTF2",
            "pwn300",
            "/writeup/missing",
            3,
            ReasonCodeClassifier.HTTP_404,
            "Could not fetch write-up URL (CTF2 - pwn300) after 3 attempts, last reason HTTP_404"
        ));
        assertThat(hitsFor("/writeup/missing")).isEqualTo(3);
    }

    @Test
    void outcomesFollowIndexOrder() {
        List<CatalogRow> rows = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            rows.add(new CatalogRow("CTF" + i, "pwn" + i, "/writeup/" + i));
            servePage("/writeup/" + i, WriteupPages.detail("https://github.com/t/" + i, null));
        }
        servePage(INDEX_PATH, WriteupPages.index(rows.toArray(new CatalogRow[0])));

        CrawlRunSummary summary = createService().crawl();

        assertThat(summary.outcomes()).extracting(RowOutcome::row).containsExactlyElementsOf(rows);
    }

    @Test
    void neverExceedsPoolWidthConcurrentFetches() {
        properties.setPoolWidth(2);
        detailDelayMs = 150;
        List<CatalogRow> rows = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            rows.add(new CatalogRow("CTF" + i, "pwn" + i, "/writeup/" + i));
            servePage("/writeup/" + i, WriteupPages.detail(null, "https://blog.example/" + i));
        }
        servePage(INDEX_PATH, WriteupPages.index(rows.toArray(new CatalogRow[0])));

        CrawlRunSummary summary = createService().crawl();

        assertThat(summary.records()).hasSize(6);
        assertThat(peakInFlight.get()).isBetween(1, 2);
    }

    @Test
    void indexFetchFailureAbortsTheCrawlWithoutRetry() {
        pages.put(INDEX_PATH, () -> new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> createService().crawl())
            .isInstanceOf(CrawlAbortedException.class)
            .hasMessageContaining("HTTP_5XX");
        assertThat(hitsFor(INDEX_PATH)).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void indexStructureDriftIsFatal() {
        servePage(INDEX_PATH, "<html><body><table id=\"other\"></table></body></html>");

        assertThatThrownBy(() -> createService().crawl()).isInstanceOf(PageStructureException.class);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void emptyIndexCompletesWithNoOutcomes() {
        servePage(INDEX_PATH, WriteupPages.index());

        CrawlRunSummary summary = createService().crawl();

        assertThat(summary.outcomes()).isEmpty();
        assertThat(summary.status()).isEqualTo(CrawlRunSummary.COMPLETED);
    }

    @Test
    void cancelledRunStopsIssuingDetailFetches() {
        servePage(INDEX_PATH, WriteupPages.index(
            new CatalogRow("CTF1", "pwn200", "/writeup/1"),
            new CatalogRow("CTF2", "pwn300", "/writeup/2")
        ));
        CrawlDeadline deadline = CrawlDeadline.none();
        deadline.cancel();

        CrawlRunSummary summary = createService().crawl(deadline);

        assertThat(summary.failures())
            .extracting(RowFailure::reasonCode)
            .containsExactly(ReasonCodeClassifier.DEADLINE_EXCEEDED, ReasonCodeClassifier.DEADLINE_EXCEEDED);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    private CrawlOrchestratorService createService() {
        WriteupHttpClient httpClient = new WriteupHttpClient(properties, httpExecutor);
        WriteupPageExtractor extractor = new WriteupPageExtractor(properties);
        WriteupResolverService resolver = new WriteupResolverService(properties, httpClient, extractor, new RetryBackoff(properties));
        return new CrawlOrchestratorService(properties, httpClient, extractor, resolver, Clock.systemUTC());
    }

    private void servePage(String path, String html) {
        pages.put(path, () -> new MockResponse().setResponseCode(200).setHeader("Content-Type", "text/html").setBody(html));
    }

    private int hitsFor(String path) {
        AtomicInteger count = hits.get(path);
        return count == null ? 0 : count.get();
    }
}
