package com.pwn.writeups.crawl.service;

public class CrawlAbortedException extends RuntimeException {
    public CrawlAbortedException(String message) {
        super(message);
    }
}
