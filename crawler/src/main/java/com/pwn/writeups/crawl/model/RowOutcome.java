package com.pwn.writeups.crawl.model;

public sealed interface RowOutcome permits RowOutcome.Resolved, RowOutcome.Failed {

    CatalogRow row();

    int attempts();

    record Resolved(CatalogRow row, ResolvedRecord record, int attempts) implements RowOutcome {
    }

    record Failed(CatalogRow row, int attempts, String reasonCode, String message) implements RowOutcome {
    }
}
