package com.pwn.writeups.crawl.model;

import java.util.Optional;

/**
 * Candidate write-up links found on a detail page. Either link may be absent.
 */
public record DetailLinks(
    Optional<String> inlineLink,
    Optional<String> fallbackLink
) {
    public static DetailLinks none() {
        return new DetailLinks(Optional.empty(), Optional.empty());
    }
}
