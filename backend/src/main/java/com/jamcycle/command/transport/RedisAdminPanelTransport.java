package com.jamcycle.command.transport;

import com.jamcycle.command.AdminCommand;
import com.jamcycle.command.CommandResult;
import com.jamcycle.command.StatusSnapshot;
import com.jamcycle.config.JamCycleProperties;
import com.jamcycle.model.TenantDescriptor;
import com.jamcycle.model.TransportKind;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Queue transport over Redis:
 * <ul>
 *     <li>commands are popped from {@code <prefix>:<tenantId>:actions}</li>
 *     <li>results are stored at {@code <prefix>:action:<id>} with a TTL</li>
 *     <li>the status snapshot is stored at {@code <prefix>:<tenantId>:status}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "jamcycle.admin-panel",
        name = "queue-enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class RedisAdminPanelTransport implements AdminPanelTransport {

    private static final Logger log = LoggerFactory.getLogger(RedisAdminPanelTransport.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final JamCycleProperties jamCycleProperties;

    @Override
    public TransportKind kind() {
        return TransportKind.QUEUE;
    }

    @Override
    public boolean supports(TenantDescriptor tenant) {
        return true;
    }

    @Override
    public List<AdminCommand> poll(TenantDescriptor tenant) {
        String key = actionsKey(tenant.id());
        int limit = Math.max(1, jamCycleProperties.getAdminPanel().getMaxCommandsPerPoll());
        List<AdminCommand> commands = new ArrayList<>();
        try {
            for (int i = 0; i < limit; i++) {
                String payload = stringRedisTemplate.opsForList().rightPop(key);
                if (payload == null) {
                    break;
                }
                commands.add(AdminPanelJsonCodec.readCommand(payload));
            }
        } catch (RuntimeException ex) {
            if (commands.isEmpty()) {
                throw new AdminPanelTransportException("Redis pop from " + key + " failed: " + safeMessage(ex), ex);
            }
            log.warn("Redis pop from {} failed after {} command(s); processing those first: {}",
                    key, commands.size(), safeMessage(ex));
        }
        return commands;
    }

    @Override
    public void publishResult(TenantDescriptor tenant, CommandResult result) {
        String key = prefix() + ":action:" + result.id();
        Duration ttl = Duration.ofSeconds(Math.max(1, jamCycleProperties.getAdminPanel().getResultTtlSeconds()));
        try {
            stringRedisTemplate.opsForValue().set(key, AdminPanelJsonCodec.write(result), ttl);
        } catch (RuntimeException ex) {
            throw new AdminPanelTransportException("Redis result write to " + key + " failed: " + safeMessage(ex), ex);
        }
    }

    @Override
    public void publishStatus(TenantDescriptor tenant, StatusSnapshot snapshot) {
        String key = prefix() + ":" + tenant.id() + ":status";
        try {
            stringRedisTemplate.opsForValue().set(key, AdminPanelJsonCodec.write(snapshot));
        } catch (RuntimeException ex) {
            throw new AdminPanelTransportException("Redis status write to " + key + " failed: " + safeMessage(ex), ex);
        }
    }

    String actionsKey(String tenantId) {
        return prefix() + ":" + tenantId + ":actions";
    }

    private String prefix() {
        String prefix = jamCycleProperties.getAdminPanel().getRedisKeyPrefix();
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalStateException("jamcycle.admin-panel.redis-key-prefix must not be blank");
        }
        return prefix.trim();
    }

    private static String safeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
