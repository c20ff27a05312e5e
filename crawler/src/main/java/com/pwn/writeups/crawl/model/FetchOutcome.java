package com.pwn.writeups.crawl.model;

/**
 * Result of a single GET. Anything but status 200 is a {@link TransientFailure}.
 */
public sealed interface FetchOutcome permits FetchOutcome.Success, FetchOutcome.TransientFailure {
    int NO_STATUS = 0;

    String url();

    int statusCode();

    record Success(String url, int statusCode, String body) implements FetchOutcome {
    }

    record TransientFailure(String url, int statusCode, String errorCode, String message) implements FetchOutcome {
        public static TransientFailure ofStatus(String url, int statusCode) {
            return new TransientFailure(url, statusCode, null, "unexpected status " + statusCode);
        }

        public static TransientFailure ofError(String url, String errorCode, String message) {
            return new TransientFailure(url, NO_STATUS, errorCode, message);
        }
    }
}
