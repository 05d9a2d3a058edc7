package com.zeroclaw.cron;

import com.zeroclaw.cron.CronTypes.CronDelivery;
import com.zeroclaw.cron.CronTypes.DeliveryMode;
import com.zeroclaw.cron.CronTypes.JobType;

/**
 * Job invariants checked before a definition is stored.
 */
final class CronJobValidation {

    private CronJobValidation() {
    }

    static void validate(CronJob job) {
        if (job.getSchedule() == null) {
            throw CronSchedules.invalid("schedule", null, "schedule is required");
        }
        CronSchedules.validate(job.getSchedule());

        JobType type = job.getJobType();
        if (type == null) {
            throw new CronException.InvalidJob("job_type is required (shell or agent)");
        }
        boolean hasCommand = notBlank(job.getCommand());
        boolean hasPrompt = notBlank(job.getPrompt());
        if (type == JobType.SHELL && (!hasCommand || hasPrompt)) {
            throw new CronException.InvalidJob("shell jobs need a command and no prompt");
        }
        if (type == JobType.AGENT && (!hasPrompt || hasCommand)) {
            throw new CronException.InvalidJob("agent jobs need a prompt and no command");
        }

        CronDelivery delivery = job.getDelivery();
        if (delivery != null && delivery.getMode() == DeliveryMode.ANNOUNCE && !notBlank(delivery.getChannel())) {
            throw new CronException.InvalidJob("announce delivery needs a channel");
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
