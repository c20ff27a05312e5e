package com.pwn.writeups.crawl.model;

public record ResolvedRecord(
    String ctf,
    String challenge,
    String writeupUrl
) {
}
