package com.webhookretry.exception.guard;

public class DownstreamRateLimitedException extends RuntimeException {
    public DownstreamRateLimitedException(String endpoint, Throwable cause) { super("local rate limit hit for " + endpoint, cause); }
}
