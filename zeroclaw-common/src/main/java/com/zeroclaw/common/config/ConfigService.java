package com.zeroclaw.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches ZeroClaw configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ZeroClawConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System::getenv);
    }

    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ZeroClawConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ZeroClawConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }

    private ZeroClawConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ZeroClawConfig());
        }
        try {
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);
            ZeroClawConfig config = raw.isBlank()
                    ? new ZeroClawConfig()
                    : objectMapper.readValue(raw, ZeroClawConfig.class);
            config = applyDefaults(config);
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new ZeroClawConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default sections and clamp numeric knobs to usable minimums.
     */
    ZeroClawConfig applyDefaults(ZeroClawConfig config) {
        if (config.getCron() == null) {
            config.setCron(new ZeroClawConfig.CronConfig());
        }
        if (config.getScheduler() == null) {
            config.setScheduler(new ZeroClawConfig.SchedulerConfig());
        }
        if (config.getReliability() == null) {
            config.setReliability(new ZeroClawConfig.ReliabilityConfig());
        }

        ZeroClawConfig.CronConfig cron = config.getCron();
        cron.setMaxRunHistory(Math.max(1, cron.getMaxRunHistory()));
        cron.setRunsMaxLimit(Math.max(1, cron.getRunsMaxLimit()));
        cron.setRunsDefaultLimit(Math.min(cron.getRunsMaxLimit(), Math.max(1, cron.getRunsDefaultLimit())));

        ZeroClawConfig.SchedulerConfig scheduler = config.getScheduler();
        scheduler.setMaxConcurrent(Math.max(1, scheduler.getMaxConcurrent()));
        scheduler.setMaxTasks(Math.max(1, scheduler.getMaxTasks()));
        scheduler.setJobTimeoutSecs(Math.max(1, scheduler.getJobTimeoutSecs()));

        ZeroClawConfig.ReliabilityConfig reliability = config.getReliability();
        reliability.setSchedulerPollSecs(Math.max(1, reliability.getSchedulerPollSecs()));
        reliability.setSchedulerRetries(Math.max(0, reliability.getSchedulerRetries()));
        return config;
    }
}
