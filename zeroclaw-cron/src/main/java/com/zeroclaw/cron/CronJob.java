package com.zeroclaw.cron;

import com.zeroclaw.cron.CronTypes.CronDelivery;
import com.zeroclaw.cron.CronTypes.CronSchedule;
import com.zeroclaw.cron.CronTypes.JobType;
import com.zeroclaw.cron.CronTypes.RunStatus;
import com.zeroclaw.cron.CronTypes.SessionTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Recurring job definition plus its scheduling state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CronJob {
    private String id;
    private String name;
    private JobType jobType;
    private CronSchedule schedule;
    /** Shell command, for {@link JobType#SHELL}. */
    private String command;
    /** Agent prompt, for {@link JobType#AGENT}. */
    private String prompt;
    private String model;
    @Builder.Default
    private SessionTarget sessionTarget = SessionTarget.ISOLATED;
    private CronDelivery delivery;
    @Builder.Default
    private boolean enabled = true;
    private boolean deleteAfterRun;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant nextRun;
    private Instant lastRun;
    private RunStatus lastStatus;
    private String lastOutput;

    /**
     * Copy that shares no mutable state with this instance.
     */
    public CronJob copy() {
        CronJobBuilder builder = toBuilder();
        if (delivery != null) {
            builder.delivery(delivery.toBuilder().build());
        }
        return builder.build();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
