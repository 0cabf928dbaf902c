package com.jamcycle.repository;

import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.GuildState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Typed, blocking access to the state store with a bounded wait on every call.
 * <p>
 * Writes that race with the other loop are guarded by compare-and-set on the dedup token or the
 * phase; a lost race is reported to the caller instead of being overwritten.
 */
@Repository
@RequiredArgsConstructor
public class GuildStateRepository {

    private final GuildStateStore guildStateStore;
    private final JamCycleProperties jamCycleProperties;

    public GuildState load(String tenantId) {
        return GuildStateCodec.decode(tenantId, readRaw(tenantId));
    }

    public Map<String, String> readRaw(String tenantId) {
        return await(guildStateStore.readAll(tenantId), "read " + tenantId);
    }

    public void save(String tenantId, GuildStateUpdate update) {
        if (update.isEmpty()) {
            return;
        }
        await(guildStateStore.setAll(tenantId, update.fields()), "write " + tenantId);
    }

    /**
     * Writes the update only if the stored dedup token still equals {@code expectedToken}.
     */
    public boolean saveIfTokenMatches(String tenantId, String expectedToken, GuildStateUpdate update) {
        return Boolean.TRUE.equals(await(
                guildStateStore.compareAndSet(tenantId, GuildFields.LAST_ANNOUNCEMENT, expectedToken, update.fields()),
                "guarded write " + tenantId
        ));
    }

    /**
     * Writes the update only if the stored phase still equals {@code expectedPhase}. An absent
     * phase field reads as {@link CompetitionPhase#INACTIVE}.
     */
    public boolean saveIfPhaseMatches(String tenantId, CompetitionPhase expectedPhase, GuildStateUpdate update) {
        boolean written = Boolean.TRUE.equals(await(
                guildStateStore.compareAndSet(tenantId, GuildFields.CURRENT_PHASE, expectedPhase.wireValue(), update.fields()),
                "guarded write " + tenantId
        ));
        if (written || expectedPhase != CompetitionPhase.INACTIVE) {
            return written;
        }
        return Boolean.TRUE.equals(await(
                guildStateStore.compareAndSet(tenantId, GuildFields.CURRENT_PHASE, null, update.fields()),
                "guarded write " + tenantId
        ));
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        long timeoutSeconds = Math.max(1, jamCycleProperties.getStore().getTimeoutSeconds());
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new GuildStateStoreException("State store timed out during " + operation, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GuildStateStoreException("Interrupted during " + operation, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof GuildStateStoreException storeException) {
                throw storeException;
            }
            throw new GuildStateStoreException("State store failed during " + operation, cause);
        }
    }
}
