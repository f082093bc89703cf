package io.hivemesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.hivemesh.broker.BrokerSettings;
import io.hivemesh.model.AgentRole;
import io.hivemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Process configuration. Precedence, lowest first: built-in defaults, the JSON settings
 * file, environment variables. Command-line options are applied on top through the
 * {@code with*} methods.
 */
public final class HiveMeshConfig {
    public static final String DEFAULT_SETTINGS_FILE = "hivemesh-settings.json";
    public static final String DEFAULT_BROKER_URL = "amqp://localhost:5672";
    public static final int DEFAULT_HEARTBEAT_SECONDS = 30;
    public static final int DEFAULT_PREFETCH_COUNT = 1;
    public static final boolean DEFAULT_AUTO_RECONNECT = true;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_COLLABORATION_WAIT_MS = 5_000L;
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = BrokerSettings.DEFAULT_MAX_RECONNECT_ATTEMPTS;
    public static final int DEFAULT_DEAD_LETTER_CAPACITY = 1_000;

    public static final String ENV_RABBITMQ_URL = "RABBITMQ_URL";
    public static final String ENV_AGENT_ID = "AGENT_ID";
    public static final String ENV_AGENT_NAME = "AGENT_NAME";
    public static final String ENV_AGENT_TYPE = "AGENT_TYPE";
    public static final String ENV_HEARTBEAT_INTERVAL = "HEARTBEAT_INTERVAL";
    public static final String ENV_AUTO_RECONNECT = "AUTO_RECONNECT";
    public static final String ENV_PREFETCH_COUNT = "PREFETCH_COUNT";
    public static final String ENV_MAX_RETRIES = "MAX_RETRIES";
    public static final String ENV_COLLABORATION_WAIT_MS = "COLLABORATION_WAIT_MS";
    public static final String ENV_AUDIT_SIGNING_SECRET = "AUDIT_SIGNING_SECRET";

    private final String brokerUrl;
    private final String agentId;
    private final String agentName;
    private final AgentRole role;
    private final int heartbeatSeconds;
    private final boolean autoReconnect;
    private final int prefetchCount;
    private final int maxRetries;
    private final long collaborationWaitMs;
    private final String auditSigningSecret;
    private final int maxReconnectAttempts;
    private final int deadLetterCapacity;

    public HiveMeshConfig(
            String brokerUrl,
            String agentId,
            String agentName,
            AgentRole role,
            int heartbeatSeconds,
            boolean autoReconnect,
            int prefetchCount,
            int maxRetries,
            long collaborationWaitMs,
            String auditSigningSecret,
            int maxReconnectAttempts,
            int deadLetterCapacity
    ) {
        this.brokerUrl = brokerUrl;
        this.agentId = agentId;
        this.agentName = agentName;
        this.role = role;
        this.heartbeatSeconds = heartbeatSeconds;
        this.autoReconnect = autoReconnect;
        this.prefetchCount = prefetchCount;
        this.maxRetries = maxRetries;
        this.collaborationWaitMs = collaborationWaitMs;
        this.auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.deadLetterCapacity = deadLetterCapacity;
    }

    public static HiveMeshConfig defaults() {
        return fromEnvironment(Map.of());
    }

    public static HiveMeshConfig fromEnvironment(Map<String, String> env) {
        return resolve(new Settings(null, null, null, null, null, null, null, null, null, null, null, null), env);
    }

    /**
     * Reads {@code settingsFile} when it exists, then lets {@code env} override it.
     */
    public static HiveMeshConfig load(Path settingsFile, Map<String, String> env) {
        Settings settings = new Settings(null, null, null, null, null, null, null, null, null, null, null, null);
        if (settingsFile != null && Files.isRegularFile(settingsFile)) {
            try {
                settings = Jsons.mapper().readValue(settingsFile.toFile(), Settings.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid settings file " + settingsFile + ": " + e.getMessage(), e);
            }
        }
        return resolve(settings, env);
    }

    private static HiveMeshConfig resolve(Settings file, Map<String, String> env) {
        Map<String, String> vars = env == null ? Map.of() : env;
        AgentRole role = AgentRole.fromString(firstNonBlank(vars.get(ENV_AGENT_TYPE), file.agentType(), "worker"));
        String agentId = firstNonBlank(vars.get(ENV_AGENT_ID), file.agentId(), "agent-" + UUID.randomUUID());
        String agentName = firstNonBlank(vars.get(ENV_AGENT_NAME), file.agentName(), "Agent-" + role.wireName());
        return new HiveMeshConfig(
                firstNonBlank(vars.get(ENV_RABBITMQ_URL), file.brokerUrl(), DEFAULT_BROKER_URL),
                agentId,
                agentName,
                role,
                positiveInt(vars.get(ENV_HEARTBEAT_INTERVAL), file.heartbeatSeconds(), DEFAULT_HEARTBEAT_SECONDS),
                bool(vars.get(ENV_AUTO_RECONNECT), file.autoReconnect(), DEFAULT_AUTO_RECONNECT),
                positiveInt(vars.get(ENV_PREFETCH_COUNT), file.prefetchCount(), DEFAULT_PREFETCH_COUNT),
                nonNegativeInt(vars.get(ENV_MAX_RETRIES), file.maxRetries(), DEFAULT_MAX_RETRIES),
                nonNegativeLong(vars.get(ENV_COLLABORATION_WAIT_MS), file.collaborationWaitMs(), DEFAULT_COLLABORATION_WAIT_MS),
                firstNonBlank(vars.get(ENV_AUDIT_SIGNING_SECRET), file.auditSigningSecret(), ""),
                file.maxReconnectAttempts() == null || file.maxReconnectAttempts() < 0
                        ? DEFAULT_MAX_RECONNECT_ATTEMPTS : file.maxReconnectAttempts(),
                file.deadLetterCapacity() == null || file.deadLetterCapacity() <= 0
                        ? DEFAULT_DEAD_LETTER_CAPACITY : file.deadLetterCapacity()
        );
    }

    public HiveMeshConfig withBrokerUrl(String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        return new HiveMeshConfig(value, agentId, agentName, role, heartbeatSeconds, autoReconnect, prefetchCount,
                maxRetries, collaborationWaitMs, auditSigningSecret, maxReconnectAttempts, deadLetterCapacity);
    }

    public HiveMeshConfig withAgentId(String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        return new HiveMeshConfig(brokerUrl, value, agentName, role, heartbeatSeconds, autoReconnect, prefetchCount,
                maxRetries, collaborationWaitMs, auditSigningSecret, maxReconnectAttempts, deadLetterCapacity);
    }

    public HiveMeshConfig withRole(AgentRole value) {
        if (value == null) {
            return this;
        }
        return new HiveMeshConfig(brokerUrl, agentId, agentName, value, heartbeatSeconds, autoReconnect, prefetchCount,
                maxRetries, collaborationWaitMs, auditSigningSecret, maxReconnectAttempts, deadLetterCapacity);
    }

    public HiveMeshConfig withPrefetchCount(Integer value) {
        if (value == null || value <= 0) {
            return this;
        }
        return new HiveMeshConfig(brokerUrl, agentId, agentName, role, heartbeatSeconds, autoReconnect, value,
                maxRetries, collaborationWaitMs, auditSigningSecret, maxReconnectAttempts, deadLetterCapacity);
    }

    public BrokerSettings brokerSettings() {
        return new BrokerSettings(brokerUrl, agentName + " (" + agentId + ")", heartbeatSeconds, prefetchCount,
                autoReconnect, maxReconnectAttempts);
    }

    public String brokerUrl() {
        return brokerUrl;
    }

    public String agentId() {
        return agentId;
    }

    public String agentName() {
        return agentName;
    }

    public AgentRole role() {
        return role;
    }

    public int heartbeatSeconds() {
        return heartbeatSeconds;
    }

    public boolean autoReconnect() {
        return autoReconnect;
    }

    public int prefetchCount() {
        return prefetchCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public long collaborationWaitMs() {
        return collaborationWaitMs;
    }

    public String auditSigningSecret() {
        return auditSigningSecret;
    }

    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public int deadLetterCapacity() {
        return deadLetterCapacity;
    }

    private static String firstNonBlank(String env, String file, String fallback) {
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        if (file != null && !file.isBlank()) {
            return file.trim();
        }
        return fallback;
    }

    // Unparseable or out-of-range values fall through to the next source.
    private static int positiveInt(String env, Integer file, int fallback) {
        Integer parsed = parseInt(env);
        if (parsed != null && parsed > 0) {
            return parsed;
        }
        return file != null && file > 0 ? file : fallback;
    }

    private static int nonNegativeInt(String env, Integer file, int fallback) {
        Integer parsed = parseInt(env);
        if (parsed != null && parsed >= 0) {
            return parsed;
        }
        return file != null && file >= 0 ? file : fallback;
    }

    private static long nonNegativeLong(String env, Long file, long fallback) {
        Long parsed = parseLong(env);
        if (parsed != null && parsed >= 0) {
            return parsed;
        }
        return file != null && file >= 0 ? file : fallback;
    }

    private static boolean bool(String env, Boolean file, boolean fallback) {
        if (env != null && !env.isBlank()) {
            // only an explicit "false" switches it off
            return !"false".equals(env.trim().toLowerCase(Locale.ROOT));
        }
        return file != null ? file : fallback;
    }

    private static Integer parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLong(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Settings(
            String brokerUrl,
            String agentId,
            String agentName,
            String agentType,
            Integer heartbeatSeconds,
            Boolean autoReconnect,
            Integer prefetchCount,
            Integer maxRetries,
            Long collaborationWaitMs,
            String auditSigningSecret,
            Integer maxReconnectAttempts,
            Integer deadLetterCapacity
    ) {
    }
}
