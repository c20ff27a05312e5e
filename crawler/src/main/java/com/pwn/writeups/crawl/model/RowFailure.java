package com.pwn.writeups.crawl.model;

public record RowFailure(
    String ctf,
    String challenge,
    String detailPath,
    int attempts,
    String reasonCode,
    String message
) {
    public static RowFailure from(RowOutcome.Failed failed) {
        CatalogRow row = failed.row();
        return new RowFailure(
            row.ctf(),
            row.challenge(),
            row.detailPath(),
            failed.attempts(),
            failed.reasonCode(),
            failed.message()
        );
    }
}
