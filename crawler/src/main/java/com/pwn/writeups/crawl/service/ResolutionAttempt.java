package com.pwn.writeups.crawl.service;

import com.pwn.writeups.crawl.model.ResolvedRecord;

sealed interface ResolutionAttempt permits ResolutionAttempt.Succeeded, ResolutionAttempt.Retryable {

    record Succeeded(ResolvedRecord record) implements ResolutionAttempt {
    }

    record Retryable(String reasonCode, String detail) implements ResolutionAttempt {
    }
}
