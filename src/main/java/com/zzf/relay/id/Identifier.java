package com.zzf.relay.id;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier generator: counters for handles, random ids for anything a client may echo back.
 */
public final class Identifier {

    private static final AtomicLong counter = new AtomicLong(System.currentTimeMillis());

    private Identifier() {
    }

    public static String ascending(String prefix) {
        return prefix + "_" + counter.incrementAndGet();
    }

    /**
     * Not guessable from other ids; used for cancel tokens.
     */
    public static String random(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
