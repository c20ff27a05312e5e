package com.pwn.writeups.crawl.service;

public class ResolutionFailedException extends RuntimeException {
    private final String ctf;
    private final String challenge;
    private final int attempts;
    private final String reasonCode;

    public ResolutionFailedException(String ctf, String challenge, int attempts, String reasonCode) {
        super("Could not fetch write-up URL (" + ctf + " - " + challenge + ") after " + attempts
            + " attempts, last reason " + reasonCode);
        this.ctf = ctf;
        this.challenge = challenge;
        this.attempts = attempts;
        this.reasonCode = reasonCode;
    }

    public String getCtf() {
        return ctf;
    }

    public String getChallenge() {
        return challenge;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
