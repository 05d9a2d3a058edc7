package com.zeroclaw.cron.delivery;

import com.zeroclaw.cron.CronJob;
import com.zeroclaw.cron.CronTypes;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decides whether and where a finalized run is announced.
 */
public final class CronDeliveryResolver {

    private CronDeliveryResolver() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeliveryPlan {
        private CronTypes.DeliveryMode mode;
        private String channel;
        private String to;
        private boolean bestEffort;
        private boolean requested;
    }

    /**
     * Resolve the delivery plan for a job. A missing delivery block means none.
     */
    public static DeliveryPlan resolve(CronJob job) {
        CronTypes.CronDelivery delivery = job.getDelivery();
        if (delivery == null) {
            return DeliveryPlan.builder()
                    .mode(CronTypes.DeliveryMode.NONE)
                    .requested(false)
                    .build();
        }

        CronTypes.DeliveryMode mode = delivery.getMode() != null ? delivery.getMode() : CronTypes.DeliveryMode.NONE;
        return DeliveryPlan.builder()
                .mode(mode)
                .channel(normalizeChannel(delivery.getChannel()))
                .to(normalizeTo(delivery.getTo()))
                .bestEffort(delivery.isBestEffort())
                .requested(mode == CronTypes.DeliveryMode.ANNOUNCE)
                .build();
    }

    private static String normalizeChannel(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim().toLowerCase();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String normalizeTo(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
