package com.jamcycle.command;

import com.jamcycle.config.JamCycleProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Emits at most one log line per tenant and concern every {@code error-log-interval-seconds}.
 * Suppressed occurrences are counted and reported with the next emitted line.
 */
@Component
@RequiredArgsConstructor
public class ThrottledLogger {

    private final JamCycleProperties jamCycleProperties;
    private final Clock clock;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public boolean warn(Logger logger, String tenantId, String concern, String message) {
        return log(logger, tenantId, concern, message, false);
    }

    public boolean error(Logger logger, String tenantId, String concern, String message) {
        return log(logger, tenantId, concern, message, true);
    }

    private boolean log(Logger logger, String tenantId, String concern, String message, boolean error) {
        Instant now = clock.instant();
        Duration interval = Duration.ofSeconds(Math.max(0, jamCycleProperties.getAdminPanel().getErrorLogIntervalSeconds()));
        String key = tenantId + "|" + concern;
        Window window = windows.computeIfAbsent(key, ignored -> new Window());
        int suppressed;
        synchronized (window) {
            if (window.lastLogged != null && now.isBefore(window.lastLogged.plus(interval))) {
                window.suppressed++;
                return false;
            }
            suppressed = window.suppressed;
            window.suppressed = 0;
            window.lastLogged = now;
        }
        String suffix = suppressed > 0 ? " (" + suppressed + " similar message(s) suppressed)" : "";
        if (error) {
            logger.error("[tenant {}] {}{}", tenantId, message, suffix);
        } else {
            logger.warn("[tenant {}] {}{}", tenantId, message, suffix);
        }
        return true;
    }

    private static final class Window {
        private Instant lastLogged;
        private int suppressed;
    }
}
