package com.jamcycle.repository;

import com.jamcycle.config.JamCycleProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisGuildStateStoreTest {

    private static final String KEY = "jamcycle:test:guild:guild-1";

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    private RedisGuildStateStore store;

    @BeforeEach
    void setUp() {
        JamCycleProperties properties = new JamCycleProperties();
        properties.getStore().setRedisKeyPrefix("jamcycle:test:guild");
        store = new RedisGuildStateStore(stringRedisTemplate, properties);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    void readAllReturnsHashEntries() {
        when(stringRedisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        when(hashOperations.entries(KEY)).thenReturn(Map.<Object, Object>of("current_phase", "voting"));

        assertEquals(Map.of("current_phase", "voting"), store.readAll("guild-1").join());
    }

    @Test
    void redisFailureSurfacesAsStoreException() {
        when(stringRedisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        when(hashOperations.entries(KEY)).thenThrow(new RuntimeException("connection refused"));

        CompletionException ex = assertThrows(CompletionException.class, () -> store.readAll("guild-1").join());

        assertInstanceOf(GuildStateStoreException.class, ex.getCause());
    }

    @Test
    void compareAndSetReportsScriptResult() {
        when(stringRedisTemplate.execute(eq(RedisGuildStateStore.GUARDED_WRITE_SCRIPT), eq(List.of(KEY)), any(Object[].class)))
                .thenReturn(1L, 0L);

        assertTrue(store.compareAndSet("guild-1", "last_announcement", "winner_2026-W43", Map.of("current_phase", "ended")).join());
        assertFalse(store.compareAndSet("guild-1", "last_announcement", "winner_2026-W43", Map.of("current_phase", "ended")).join());
    }

    @Test
    void scriptArgsEncodeGuardAndDeletes() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("current_phase", "ended");
        fields.put("next_week_theme", null);

        List<String> args = RedisGuildStateStore.scriptArgs(true, "last_announcement", "winner_2026-W43", fields);

        assertEquals(List.of(
                "1", "last_announcement", "0", "winner_2026-W43",
                "current_phase", "s", "ended",
                "next_week_theme", "d", ""), args);
    }

    @Test
    void scriptArgsEncodeAbsentExpectation() {
        Map<String, String> fields = new HashMap<>();
        fields.put("current_phase", "submission");

        List<String> args = RedisGuildStateStore.scriptArgs(true, "current_phase", null, fields);

        assertEquals(List.of("1", "current_phase", "1", "", "current_phase", "s", "submission"), args);
    }

    @Test
    void blankTenantIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.readAll(" "));
    }
}
