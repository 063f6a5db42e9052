package io.b2mash.b2b.accessaudit.job;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

/**
 * Input of {@link JobService#createJob}.
 *
 * @param module ansible module for ad-hoc jobs
 * @param playbookId playbook for playbook jobs
 * @param timeout seconds; zero or negative means one hour
 * @param interval hours between runs of a periodic job
 * @param crontab cron expression of a periodic job
 * @param runAfterSave start one execution right after the job is saved
 */
public record JobRequest(
    @NotBlank String name,
    @NotNull JobType type,
    String module,
    String args,
    UUID playbookId,
    List<UUID> assetIds,
    RunasPolicy runasPolicy,
    @NotBlank String runas,
    int timeout,
    String chdir,
    String comment,
    boolean periodic,
    Integer interval,
    String crontab,
    boolean runAfterSave) {}
