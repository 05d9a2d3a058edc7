package com.zeroclaw.cron;

/**
 * Base type for errors raised by the cron store and service.
 * Execution and delivery failures are not exceptions; they are recorded on
 * {@link CronRun}.
 */
public class CronException extends RuntimeException {

    public CronException(String message) {
        super(message);
    }

    public CronException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Malformed or out-of-range schedule, rejected before anything is stored. */
    public static class InvalidSchedule extends CronException {
        private final ScheduleError error;

        public InvalidSchedule(ScheduleError error) {
            super(error.message());
            this.error = error;
        }

        public ScheduleError getError() {
            return error;
        }

        public ScheduleError.Reason getReason() {
            return error.reason();
        }
    }

    /** Payload or delivery invariants violated. */
    public static class InvalidJob extends CronException {
        public InvalidJob(String message) {
            super(message);
        }

        public InvalidJob(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** The store already holds {@code scheduler.max_tasks} jobs. */
    public static class AdmissionRejected extends CronException {
        private final int limit;

        public AdmissionRejected(int limit) {
            super("cron job limit reached (max_tasks=" + limit + ")");
            this.limit = limit;
        }

        public int getLimit() {
            return limit;
        }
    }

    public static class JobNotFound extends CronException {
        private final String jobId;

        public JobNotFound(String jobId) {
            super("cron job not found: " + jobId);
            this.jobId = jobId;
        }

        public String getJobId() {
            return jobId;
        }
    }

    /** Persistence backend could not be read or written. */
    public static class StoreUnavailable extends CronException {
        public StoreUnavailable(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
