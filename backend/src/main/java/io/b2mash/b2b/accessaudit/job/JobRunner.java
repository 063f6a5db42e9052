package io.b2mash.b2b.accessaudit.job;

/** Execution engine that actually runs jobs on assets. */
public interface JobRunner {

  /**
   * Hands the execution to the engine. The engine reports completion through {@link
   * JobExecutionService#finish}.
   *
   * @return the engine's task id
   */
  String submit(JobExecution execution);
}
