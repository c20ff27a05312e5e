package com.pwn.writeups.crawl.service;

import com.pwn.writeups.config.CrawlerProperties;
import com.pwn.writeups.crawl.extract.PageStructureException;
import com.pwn.writeups.crawl.model.CrawlRunSummary;
import com.pwn.writeups.crawl.model.RowFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final CrawlResultPrinter printer;
    private final ConfigurableApplicationContext applicationContext;
    private volatile int exitCode;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        CrawlResultPrinter printer,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.printer = printer;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        try {
            CrawlRunSummary summary = crawlOrchestratorService.crawl();
            for (RowFailure failure : summary.failures()) {
                log.warn(
                    "Unresolved write-up {} - {}: {} after {} attempts",
                    failure.ctf(),
                    failure.challenge(),
                    failure.reasonCode(),
                    failure.attempts()
                );
            }
            printer.print(summary);
            exitCode = 0;
        } catch (CrawlAbortedException | PageStructureException e) {
            log.error("Could not fetch the write-ups.", e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext);
            System.exit(code);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
