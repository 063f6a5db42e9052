package io.b2mash.b2b.accessaudit.job;

import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.exception.InvalidStateException;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import io.b2mash.b2b.accessaudit.store.AuditedEntityStore;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tracks job executions handed to the {@link JobRunner}. Starting a run goes through {@link
 * AuditedEntityStore}, so the new execution and the job's last-run stamp are audited. Completion is
 * a runner callback without an acting user and is not.
 */
@Service
public class JobExecutionService {

  private static final Logger log = LoggerFactory.getLogger(JobExecutionService.class);

  private final JobRepository jobRepository;
  private final JobExecutionRepository executionRepository;
  private final JobRunner jobRunner;
  private final AuditedEntityStore store;

  public JobExecutionService(
      JobRepository jobRepository,
      JobExecutionRepository executionRepository,
      JobRunner jobRunner,
      AuditedEntityStore store) {
    this.jobRepository = jobRepository;
    this.executionRepository = executionRepository;
    this.jobRunner = jobRunner;
    this.store = store;
  }

  /** Records a new execution, submits it and stamps the job's last run. */
  @Transactional
  public JobExecution start(AuditContext context, UUID jobId, String parameters) {
    var job =
        jobRepository
            .findById(jobId)
            .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    var user = context.user();
    String creator =
        user != null && user.authenticated() ? user.display() : JobService.SYSTEM_CREATOR;

    var execution = store.save(context, new JobExecution(job, parameters, creator));
    String taskId = jobRunner.submit(execution);
    Instant now = Instant.now();
    execution.start(taskId, now);
    job.markRun(now);
    store.save(context, job, Set.of(Job.LAST_RUN_FIELD));
    log.info(
        "Started execution {} of job {}: taskId={}", execution.getId(), job.getName(), taskId);
    return execution;
  }

  /** Records the outcome reported by the runner. An execution finishes at most once. */
  @Transactional
  public JobExecution finish(UUID executionId, boolean success, String summary) {
    var execution = requireExecution(executionId);
    if (execution.isFinished()) {
      throw new InvalidStateException(
          "Execution already finished", "Execution " + executionId + " has already finished");
    }
    execution.finish(success, summary, Instant.now());
    log.info(
        "Finished execution {}: success={}, timeCost={}s",
        executionId,
        success,
        execution.getTimeCost());
    return execution;
  }

  /** Average time cost in seconds over the job's finished executions; 0 when there are none. */
  @Transactional(readOnly = true)
  public double averageTimeCost(UUID jobId) {
    Double average = executionRepository.averageTimeCost(jobId);
    return average != null ? average : 0.0;
  }

  @Transactional(readOnly = true)
  public Page<JobExecution> findExecutions(
      String tenantId, UUID jobId, Boolean finished, Pageable pageable) {
    return executionRepository.findByFilter(tenantId, jobId, finished, pageable);
  }

  private JobExecution requireExecution(UUID executionId) {
    return executionRepository
        .findById(executionId)
        .orElseThrow(() -> new ResourceNotFoundException("JobExecution", executionId));
  }
}
