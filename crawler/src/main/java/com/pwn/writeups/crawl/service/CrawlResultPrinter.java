package com.pwn.writeups.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pwn.writeups.crawl.model.CrawlRunSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;

@Component
public class CrawlResultPrinter {
    static final String SEPARATOR = "=".repeat(100);

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public CrawlResultPrinter(ObjectMapper objectMapper) {
        this(objectMapper, System.out);
    }

    CrawlResultPrinter(ObjectMapper objectMapper, PrintStream out) {
        this.objectMapper = objectMapper;
        this.out = out;
    }

    public void print(CrawlRunSummary summary) {
        String json;
        try {
            json = objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not render crawl summary", e);
        }
        out.println(SEPARATOR);
        out.println(json);
        out.flush();
    }
}
