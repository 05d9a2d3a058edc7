package com.zeroclaw.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cron job type definitions: schedule variants, payload kinds, delivery
 * configuration, and create/patch DTOs.
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    /**
     * When a job runs. Serialized with a {@code kind} discriminator.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = CronSchedule.Cron.class, name = "cron"),
            @JsonSubTypes.Type(value = CronSchedule.At.class, name = "at"),
            @JsonSubTypes.Type(value = CronSchedule.Every.class, name = "every")
    })
    public sealed interface CronSchedule permits CronSchedule.Cron, CronSchedule.At, CronSchedule.Every {

        @JsonIgnore
        String kind();

        /** Five-field cron expression, optionally pinned to an IANA zone. */
        record Cron(@JsonProperty("expr") String expr, @JsonProperty("tz") String tz) implements CronSchedule {
            public static Cron of(String expr) {
                return new Cron(expr, null);
            }

            @Override
            public String kind() {
                return "cron";
            }
        }

        /** One-shot run at a fixed instant. */
        record At(@JsonProperty("at") Instant at) implements CronSchedule {
            @Override
            public String kind() {
                return "at";
            }
        }

        /** Fixed interval, in milliseconds. */
        record Every(@JsonProperty("every_ms") long everyMs) implements CronSchedule {
            @Override
            public String kind() {
                return "every";
            }
        }
    }

    // =========================================================================
    // Job kinds and targets
    // =========================================================================

    public enum JobType {
        SHELL, AGENT;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static JobType fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase()) {
                case "shell", "command" -> SHELL;
                case "agent", "agentturn", "prompt" -> AGENT;
                default -> null;
            };
        }
    }

    public enum SessionTarget {
        ISOLATED, MAIN;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static SessionTarget fromKey(String key) {
            if ("main".equalsIgnoreCase(key) || "shared".equalsIgnoreCase(key))
                return MAIN;
            return ISOLATED;
        }
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    public enum DeliveryMode {
        NONE, ANNOUNCE;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static DeliveryMode fromKey(String key) {
            if ("announce".equalsIgnoreCase(key) || "deliver".equalsIgnoreCase(key))
                return ANNOUNCE;
            return NONE;
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronDelivery {
        @Builder.Default
        private DeliveryMode mode = DeliveryMode.NONE;
        private String channel;
        private String to;
        /** When true a failed delivery is logged and otherwise ignored. */
        private boolean bestEffort;

        public static CronDelivery none() {
            return new CronDelivery(DeliveryMode.NONE, null, null, false);
        }
    }

    // =========================================================================
    // Run status
    // =========================================================================

    public enum RunStatus {
        OK, ERROR;

        @JsonValue
        public String key() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static RunStatus fromKey(String key) {
            if (key == null)
                return null;
            return "ok".equalsIgnoreCase(key) ? OK : ERROR;
        }
    }

    // =========================================================================
    // Create/Patch DTOs
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String name;
        private JobType jobType;
        private CronSchedule schedule;
        private String command;
        private String prompt;
        private String model;
        private SessionTarget sessionTarget;
        private CronDelivery delivery;
        private Boolean enabled;
        private Boolean deleteAfterRun;
    }

    /** Partial update; {@code null} fields are left untouched. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobPatch {
        private String name;
        private JobType jobType;
        private CronSchedule schedule;
        private String command;
        private String prompt;
        private String model;
        private SessionTarget sessionTarget;
        private CronDelivery delivery;
        private Boolean enabled;
        private Boolean deleteAfterRun;
    }

    // =========================================================================
    // Store format
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronStoreFile {
        @Builder.Default
        private int version = 1;
        private Instant savedAt;
        private long lastRunId;
        @Builder.Default
        private List<CronJob> jobs = new ArrayList<>();
        @Builder.Default
        private Map<String, List<CronRun>> runs = new LinkedHashMap<>();
    }
}
