package com.phillippitts.saleshud.service.insight;

import static org.assertj.core.api.Assertions.assertThat;

import com.phillippitts.saleshud.testutil.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new ResponseCache(Duration.ofMinutes(5), 2, clock);
    }

    private static CompletionResponse response(String text) {
        return new CompletionResponse("msg-1", "model", text, 10, 5);
    }

    @Test
    void shouldReturnEntryUntilExpiryInstant() {
        // Arrange
        cache.put("k", response("cached"));

        // Act
        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        boolean freshHit = cache.get("k").isPresent();
        clock.advance(Duration.ofMillis(1));
        boolean expiredHit = cache.get("k").isPresent();

        // Assert
        assertThat(freshHit).isTrue();
        assertThat(expiredHit).isFalse();
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldEvictLeastRecentlyUsedBeyondCapacity() {
        cache.put("a", response("a"));
        cache.put("b", response("b"));
        cache.get("a");

        cache.put("c", response("c"));

        assertThat(cache.get("a")).isPresent();
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("c")).isPresent();
    }

    @Test
    void shouldEvictOnlyExpiredEntries() {
        cache.put("old", response("old"));
        clock.advance(Duration.ofMinutes(3));
        cache.put("new", response("new"));
        clock.advance(Duration.ofMinutes(2));

        int removed = cache.evictExpired();

        assertThat(removed).isEqualTo(1);
        assertThat(cache.get("new")).isPresent();
    }

    @Test
    void shouldKeyOnCacheKeyAndFullRequestContent() {
        CompletionRequest request = new CompletionRequest("model", 100, 0.1, "system", "transcript");
        CompletionRequest otherContent = new CompletionRequest("model", 100, 0.1, "system", "transcript!");

        String key = ResponseCache.keyFor("analysis", request);

        assertThat(key).hasSize(64).isEqualTo(ResponseCache.keyFor("analysis", request));
        assertThat(key).isNotEqualTo(ResponseCache.keyFor("summary", request));
        assertThat(key).isNotEqualTo(ResponseCache.keyFor("analysis", otherContent));
    }

    @Test
    void shouldClearEverythingOnInvalidate() {
        cache.put("a", response("a"));

        cache.invalidate();

        assertThat(cache.size()).isZero();
    }
}
