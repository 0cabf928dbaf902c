package com.jamcycle.repository;

import com.jamcycle.config.JamCycleProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Stores each tenant as one Redis hash. Multi-field writes go through a Lua script so they land
 * as a single update, optionally guarded by the current value of one field.
 */
@Repository
@ConditionalOnProperty(
        prefix = "jamcycle.store",
        name = "mode",
        havingValue = "redis"
)
public class RedisGuildStateStore implements GuildStateStore {

    private static final Logger log = LoggerFactory.getLogger(RedisGuildStateStore.class);

    static final RedisScript<Long> GUARDED_WRITE_SCRIPT = new DefaultRedisScript<>("""
            if ARGV[1] == '1' then
              local current = redis.call('HGET', KEYS[1], ARGV[2])
              if ARGV[3] == '1' then
                if current then return 0 end
              elseif current ~= ARGV[4] then
                return 0
              end
            end
            local i = 5
            while i <= #ARGV do
              if ARGV[i + 1] == 'd' then
                redis.call('HDEL', KEYS[1], ARGV[i])
              else
                redis.call('HSET', KEYS[1], ARGV[i], ARGV[i + 2])
              end
              i = i + 3
            end
            return 1
            """, Long.class);

    private static final String FLAG_ON = "1";
    private static final String FLAG_OFF = "0";
    private static final String OP_SET = "s";
    private static final String OP_DELETE = "d";

    private final StringRedisTemplate stringRedisTemplate;
    private final JamCycleProperties jamCycleProperties;
    private final ExecutorService executor;

    public RedisGuildStateStore(StringRedisTemplate stringRedisTemplate, JamCycleProperties jamCycleProperties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.jamCycleProperties = jamCycleProperties;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "guild-state-redis-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public CompletableFuture<Map<String, String>> readAll(String tenantId) {
        String key = keyFor(tenantId);
        return supply(() -> {
            Map<Object, Object> entries = stringRedisTemplate.opsForHash().entries(key);
            Map<String, String> fields = new HashMap<>();
            entries.forEach((field, value) -> fields.put(String.valueOf(field), String.valueOf(value)));
            return fields;
        });
    }

    @Override
    public CompletableFuture<Void> set(String tenantId, String field, String value) {
        Map<String, String> changes = new HashMap<>();
        changes.put(Objects.requireNonNull(field, "field is required"), value);
        return setAll(tenantId, changes);
    }

    @Override
    public CompletableFuture<Void> setAll(String tenantId, Map<String, String> fields) {
        String key = keyFor(tenantId);
        List<String> args = scriptArgs(false, null, null, fields);
        return supply(() -> {
            stringRedisTemplate.execute(GUARDED_WRITE_SCRIPT, List.of(key), args.toArray());
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> compareAndSet(
            String tenantId,
            String guardField,
            String expected,
            Map<String, String> fields
    ) {
        String key = keyFor(tenantId);
        List<String> args = scriptArgs(true, Objects.requireNonNull(guardField, "guardField is required"), expected, fields);
        return supply(() -> {
            Long written = stringRedisTemplate.execute(GUARDED_WRITE_SCRIPT, List.of(key), args.toArray());
            return written != null && written == 1L;
        });
    }

    static List<String> scriptArgs(boolean guarded, String guardField, String expected, Map<String, String> fields) {
        List<String> args = new ArrayList<>();
        args.add(guarded ? FLAG_ON : FLAG_OFF);
        args.add(guardField == null ? "" : guardField);
        args.add(expected == null ? FLAG_ON : FLAG_OFF);
        args.add(expected == null ? "" : expected);
        new LinkedHashMap<>(fields).forEach((field, value) -> {
            args.add(field);
            args.add(value == null ? OP_DELETE : OP_SET);
            args.add(value == null ? "" : value);
        });
        return args;
    }

    private String keyFor(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        String prefix = jamCycleProperties.getStore().getRedisKeyPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException("jamcycle.store.redis-key-prefix must not be blank");
        }
        return prefix.trim() + ":" + tenantId.trim();
    }

    private <T> CompletableFuture<T> supply(Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.get();
            } catch (RuntimeException ex) {
                log.debug("Redis state store call failed: {}", ex.getMessage());
                throw new GuildStateStoreException("Redis state store call failed", ex);
            }
        }, executor);
    }
}
