package com.cladgateway.util;

import java.time.Instant;
import java.util.UUID;

/**
 * Identifiers and timestamps for generated completions.
 * <p>
 * Ids come from random UUIDs, never from the clock, so completions created
 * concurrently in one process cannot collide.
 */
public final class CompletionIds {

    private static final String PREFIX = "chatcmpl-";

    private CompletionIds() {
    }

    public static String next() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    public static long nowEpochSeconds() {
        return Instant.now().getEpochSecond();
    }
}
