package com.zeroclaw.cron.delivery;

/**
 * Result of a delivery attempt.
 */
public record DeliveryOutcome(Status status, String error, boolean bestEffort) {

    public enum Status {
        NOT_REQUESTED, DELIVERED, FAILED
    }

    public static DeliveryOutcome notRequested() {
        return new DeliveryOutcome(Status.NOT_REQUESTED, null, false);
    }

    public static DeliveryOutcome delivered() {
        return new DeliveryOutcome(Status.DELIVERED, null, false);
    }

    public static DeliveryOutcome failed(String error, boolean bestEffort) {
        return new DeliveryOutcome(Status.FAILED, error, bestEffort);
    }

    /**
     * Error to record on the run: set only for failed, non best-effort deliveries.
     */
    public String recordedError() {
        return status == Status.FAILED && !bestEffort ? error : null;
    }
}
