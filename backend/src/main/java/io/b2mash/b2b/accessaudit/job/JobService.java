package io.b2mash.b2b.accessaudit.job;

import io.b2mash.b2b.accessaudit.asset.AssetRepository;
import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.exception.InvalidStateException;
import io.b2mash.b2b.accessaudit.exception.ResourceNotFoundException;
import io.b2mash.b2b.accessaudit.store.AuditedEntityStore;
import jakarta.validation.Valid;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/** Creates and schedules jobs. Jobs are written through the audited store. */
@Service
@Validated
public class JobService {

  private static final Logger log = LoggerFactory.getLogger(JobService.class);

  static final int DEFAULT_TIMEOUT = 3600;
  static final String SYSTEM_CREATOR = "System";

  private final JobRepository jobRepository;
  private final AssetRepository assetRepository;
  private final AuditedEntityStore store;
  private final JobExecutionService executionService;

  public JobService(
      JobRepository jobRepository,
      AssetRepository assetRepository,
      AuditedEntityStore store,
      JobExecutionService executionService) {
    this.jobRepository = jobRepository;
    this.assetRepository = assetRepository;
    this.store = store;
    this.executionService = executionService;
  }

  /**
   * Validates and saves a new job. With {@code runAfterSave} one execution is started in the same
   * transaction.
   */
  @Transactional
  public Job createJob(AuditContext context, @Valid JobRequest request) {
    validateMaterial(request);
    if (request.periodic()) {
      validatePeriodic(request.interval(), request.crontab());
    }

    var job =
        new Job(
            request.name(),
            request.type(),
            request.module(),
            request.args(),
            request.playbookId(),
            request.runasPolicy() != null ? request.runasPolicy() : RunasPolicy.SKIP,
            request.runas(),
            creatorOf(context),
            request.timeout() > 0 ? request.timeout() : DEFAULT_TIMEOUT,
            request.chdir(),
            request.comment(),
            context.tenantId());
    if (request.assetIds() != null && !request.assetIds().isEmpty()) {
      job.assignAssets(new HashSet<>(assetRepository.findAllById(request.assetIds())));
    }
    if (request.periodic()) {
      job.schedule(request.interval(), request.crontab());
    }

    var saved = store.save(context, job);
    log.info(
        "Created {} job {} (periodic={})", saved.getType(), saved.getName(), saved.isPeriodic());

    if (request.runAfterSave()) {
      executionService.start(context, saved.getId(), null);
    }
    return saved;
  }

  @Transactional
  public Job schedule(AuditContext context, UUID jobId, Integer interval, String crontab) {
    validatePeriodic(interval, crontab);
    var job = requireJob(jobId);
    job.schedule(interval, crontab);
    return store.save(context, job, Set.of("periodic", "interval", "crontab"));
  }

  @Transactional
  public Job unschedule(AuditContext context, UUID jobId) {
    var job = requireJob(jobId);
    job.unschedule();
    return store.save(context, job, Set.of("periodic", "interval", "crontab"));
  }

  @Transactional
  public void deleteJob(AuditContext context, UUID jobId) {
    var job = requireJob(jobId);
    store.delete(context, job);
    log.info("Deleted job {}", job.getName());
  }

  @Transactional(readOnly = true)
  public List<Job> listJobs(String tenantId) {
    return jobRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
  }

  static void validatePeriodic(Integer interval, String crontab) {
    boolean hasInterval = interval != null;
    boolean hasCrontab = crontab != null && !crontab.isBlank();
    if (hasInterval == hasCrontab) {
      throw new InvalidStateException(
          "Invalid schedule", "A periodic job needs exactly one of interval or crontab");
    }
    if (hasInterval && interval <= 0) {
      throw new InvalidStateException(
          "Invalid schedule", "Interval must be a positive number of hours, got " + interval);
    }
  }

  private static void validateMaterial(JobRequest request) {
    if (request.type() == JobType.ADHOC
        && (request.module() == null || request.module().isBlank())) {
      throw new InvalidStateException("Invalid job", "An ad-hoc job needs a module");
    }
    if (request.type() == JobType.PLAYBOOK && request.playbookId() == null) {
      throw new InvalidStateException("Invalid job", "A playbook job needs a playbook");
    }
  }

  private static String creatorOf(AuditContext context) {
    var user = context.user();
    return user != null && user.authenticated() ? user.display() : SYSTEM_CREATOR;
  }

  private Job requireJob(UUID jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
  }
}
