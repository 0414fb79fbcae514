package com.example.skirmish.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

/**
 * Engine settings loaded from the classpath resource {@code /skirmish.yaml}.
 * 
 * Every key can be overridden with a system property of the same name
 * prefixed by {@code skirmish.}, e.g. {@code -Dskirmish.max-steps=200}.
 * Missing keys fall back to defaults.
 */
public final class EngineConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);
    
    public static final String DEFAULT_RESOURCE = "/skirmish.yaml";
    public static final String PROPERTY_PREFIX = "skirmish.";
    
    public static final int DEFAULT_MAX_STEPS = 64;
    public static final double DEFAULT_CRITICAL_MULTIPLIER = 1.5;
    
    private final int maxSteps;
    private final TurnOrderPolicy turnOrder;
    private final boolean moraleEnabled;
    private final double criticalMultiplier;
    private final boolean autoAssignOppositionAi;
    
    public EngineConfig(int maxSteps, TurnOrderPolicy turnOrder, boolean moraleEnabled,
                        double criticalMultiplier, boolean autoAssignOppositionAi) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("max-steps must be at least 1: " + maxSteps);
        }
        if (turnOrder == null) {
            throw new IllegalArgumentException("turn-order must not be null");
        }
        if (criticalMultiplier < 1.0) {
            throw new IllegalArgumentException("critical-multiplier must be at least 1.0: " + criticalMultiplier);
        }
        this.maxSteps = maxSteps;
        this.turnOrder = turnOrder;
        this.moraleEnabled = moraleEnabled;
        this.criticalMultiplier = criticalMultiplier;
        this.autoAssignOppositionAi = autoAssignOppositionAi;
    }
    
    /** Built-in defaults, ignoring resources and system properties. */
    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_MAX_STEPS, TurnOrderPolicy.ROSTER, true, DEFAULT_CRITICAL_MULTIPLIER, true);
    }
    
    /** Load {@code /skirmish.yaml} with system property overrides. */
    public static EngineConfig load() {
        return load(DEFAULT_RESOURCE);
    }
    
    /**
     * Load settings from a classpath resource, then apply system property overrides.
     * A missing resource is not an error.
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static EngineConfig load(String resourcePath) {
        Map<String, Object> values = readResource(resourcePath);
        
        int maxSteps = parseInt(setting(values, "max-steps"), DEFAULT_MAX_STEPS, "max-steps");
        String order = setting(values, "turn-order");
        TurnOrderPolicy turnOrder;
        try {
            turnOrder = order == null ? TurnOrderPolicy.ROSTER
                    : TurnOrderPolicy.valueOf(order.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown turn-order: " + order, e);
        }
        boolean morale = parseBoolean(setting(values, "morale-enabled"), true);
        double multiplier = parseDouble(setting(values, "critical-multiplier"), DEFAULT_CRITICAL_MULTIPLIER,
                "critical-multiplier");
        boolean autoAi = parseBoolean(setting(values, "auto-assign-opposition-ai"), true);
        
        EngineConfig config = new EngineConfig(maxSteps, turnOrder, morale, multiplier, autoAi);
        logger.debug("[EngineConfig] Loaded {}", config);
        return config;
    }
    
    private static Map<String, Object> readResource(String resourcePath) {
        try (InputStream in = EngineConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.debug("[EngineConfig] {} not found, using defaults", resourcePath);
                return Map.of();
            }
            Object loaded = new Yaml().load(in);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map)) {
                throw new IllegalArgumentException(resourcePath + " must be a YAML mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> values = (Map<String, Object>) loaded;
            return values;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + resourcePath, e);
        }
    }
    
    // System property wins over the resource value
    private static String setting(Map<String, Object> values, String key) {
        String override = System.getProperty(PROPERTY_PREFIX + key);
        if (override != null && !override.isBlank()) {
            return override;
        }
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }
    
    private static int parseInt(String value, int defaultValue, String key) {
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }
    
    private static double parseDouble(String value, double defaultValue, String key) {
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + value, e);
        }
    }
    
    private static boolean parseBoolean(String value, boolean defaultValue) {
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
    
    public int getMaxSteps() { return maxSteps; }
    public TurnOrderPolicy getTurnOrder() { return turnOrder; }
    public boolean isMoraleEnabled() { return moraleEnabled; }
    public double getCriticalMultiplier() { return criticalMultiplier; }
    public boolean isAutoAssignOppositionAi() { return autoAssignOppositionAi; }
    
    public EngineConfig withMaxSteps(int value) {
        return new EngineConfig(value, turnOrder, moraleEnabled, criticalMultiplier, autoAssignOppositionAi);
    }
    
    public EngineConfig withTurnOrder(TurnOrderPolicy value) {
        return new EngineConfig(maxSteps, value, moraleEnabled, criticalMultiplier, autoAssignOppositionAi);
    }
    
    public EngineConfig withMoraleEnabled(boolean value) {
        return new EngineConfig(maxSteps, turnOrder, value, criticalMultiplier, autoAssignOppositionAi);
    }
    
    public EngineConfig withAutoAssignOppositionAi(boolean value) {
        return new EngineConfig(maxSteps, turnOrder, moraleEnabled, criticalMultiplier, value);
    }
    
    @Override
    public String toString() {
        return "EngineConfig{maxSteps=" + maxSteps + ", turnOrder=" + turnOrder
                + ", moraleEnabled=" + moraleEnabled + ", criticalMultiplier=" + criticalMultiplier
                + ", autoAssignOppositionAi=" + autoAssignOppositionAi + "}";
    }
}
