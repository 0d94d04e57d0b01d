package com.phillippitts.saleshud.service.insight;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded LRU cache of AI responses with a fixed time-to-live.
 *
 * <p>An entry is stale from the instant its expiry is reached and is never returned after that.
 */
final class ResponseCache {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries;

    private record Entry(CompletionResponse response, Instant expiresAt) {
    }

    ResponseCache(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.maxEntries = maxEntries;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > ResponseCache.this.maxEntries;
            }
        };
    }

    synchronized Optional<CompletionResponse> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.response());
    }

    synchronized void put(String key, CompletionResponse response) {
        entries.put(key, new Entry(response, clock.instant().plus(ttl)));
    }

    /** @return number of entries removed */
    synchronized int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (!now.isBefore(it.next().expiresAt())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    synchronized void invalidate() {
        entries.clear();
    }

    synchronized int size() {
        return entries.size();
    }

    /** SHA-256 over the caller's cache key and the full request content. */
    static String keyFor(String cacheKey, CompletionRequest request) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            update(digest, cacheKey);
            update(digest, request.model());
            update(digest, String.valueOf(request.maxTokens()));
            update(digest, String.valueOf(request.temperature()));
            update(digest, request.system());
            update(digest, request.userContent());
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void update(MessageDigest digest, String value) {
        digest.update((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }
}
