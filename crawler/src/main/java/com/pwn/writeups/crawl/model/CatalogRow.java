package com.pwn.writeups.crawl.model;

public record CatalogRow(
    String ctf,
    String challenge,
    String detailPath
) {
}
