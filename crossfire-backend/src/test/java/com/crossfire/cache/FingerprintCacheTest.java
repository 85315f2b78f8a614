package com.crossfire.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FingerprintCacheTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryCacheStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryCacheStorage();
    }

    private FingerprintCache<String> cacheAt(Instant now) {
        return new FingerprintCache<>(storage, new StringCacheValueCodec(), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void missingKeyIsAbsent() {
        assertThat(cacheAt(T0).get("nothing")).isEmpty();
        assertThat(cacheAt(T0).getAll("nothing")).isEmpty();
    }

    @Test
    void returnsValueWithinTtl() {
        cacheAt(T0).set("key", "host-a", "result", 60);

        assertThat(cacheAt(T0.plusSeconds(60)).get("key"))
                .hasValueSatisfying(e -> {
                    assertThat(e.getValue()).isEqualTo("result");
                    assertThat(e.getSessionId()).isEqualTo("host-a");
                    assertThat(e.getCreatedAt()).isEqualTo(T0);
                });
    }

    @Test
    void expiredEntriesAreSkippedButKept() {
        cacheAt(T0).set("key", "host-a", "result", 60);

        assertThat(cacheAt(T0.plusSeconds(61)).get("key")).isEmpty();
        assertThat(storage.findAll("key")).hasSize(1);
    }

    @Test
    void defaultTtlApplies() {
        cacheAt(T0).set("key", "host-a", "result");

        assertThat(cacheAt(T0.plus(Duration.ofSeconds(CacheEntry.DEFAULT_TTL_SECONDS))).get("key")).isPresent();
        assertThat(cacheAt(T0.plus(Duration.ofSeconds(CacheEntry.DEFAULT_TTL_SECONDS + 1))).get("key")).isEmpty();
    }

    @Test
    void sameSessionOverwritesOwnRecord() {
        cacheAt(T0).set("key", "host-a", "first", 60);
        cacheAt(T0.plusSeconds(30)).set("key", "host-a", "second", 60);

        List<CacheEntry<String>> entries = cacheAt(T0.plusSeconds(80)).getAll("key");
        assertThat(entries).extracting(CacheEntry::getValue).containsExactly("second");
    }

    @Test
    void sessionsDoNotOverwriteEachOther() {
        cacheAt(T0).set("key", "host-a", "from-a", 60);
        cacheAt(T0.plusSeconds(50)).set("key", "host-b", "from-b", 60);

        assertThat(cacheAt(T0.plusSeconds(55)).getAll("key"))
                .extracting(CacheEntry::getValue)
                .containsExactlyInAnyOrder("from-a", "from-b");
        assertThat(cacheAt(T0.plusSeconds(70)).getAll("key"))
                .extracting(CacheEntry::getValue)
                .containsExactly("from-b");
    }

    @Test
    void groupKeysAreIsolated() {
        cacheAt(T0).set("key-1", "host-a", "one", 60);
        cacheAt(T0).set("key-2", "host-a", "two", 60);

        assertThat(cacheAt(T0).getAll("key-1")).extracting(CacheEntry::getValue).containsExactly("one");
        assertThat(storage.findAll("")).hasSize(2);
    }

    @Test
    void storageFailurePropagates() {
        CacheStorage failing = mock(CacheStorage.class);
        when(failing.findAll(anyString())).thenThrow(new CacheStorageException("storage down", null));
        FingerprintCache<String> cache = new FingerprintCache<>(failing, new StringCacheValueCodec(), Clock.fixed(T0, ZoneOffset.UTC));

        assertThatThrownBy(() -> cache.get("key")).isInstanceOf(CacheStorageException.class);
    }
}
