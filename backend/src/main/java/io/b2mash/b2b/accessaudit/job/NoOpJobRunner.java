package io.b2mash.b2b.accessaudit.job;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback {@link JobRunner} used when no execution engine is configured. Logs the submission and
 * returns a synthetic task id; the execution stays unfinished.
 */
public class NoOpJobRunner implements JobRunner {

  private static final Logger log = LoggerFactory.getLogger(NoOpJobRunner.class);

  @Override
  public String submit(JobExecution execution) {
    log.info(
        "NoOp job runner: would run job '{}' (execution {})",
        execution.getJob().getName(),
        execution.getId());
    return "NOOP-" + UUID.randomUUID();
  }
}
