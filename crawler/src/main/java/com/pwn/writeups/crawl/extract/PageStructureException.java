package com.pwn.writeups.crawl.extract;

/**
 * The fetched markup no longer has the shape the extractor expects.
 */
public class PageStructureException extends RuntimeException {
    public PageStructureException(String message) {
        super(message);
    }
}
