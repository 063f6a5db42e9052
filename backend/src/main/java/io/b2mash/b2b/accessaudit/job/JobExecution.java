package io.b2mash.b2b.accessaudit.job;

import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/** One run of a {@link Job}. Created when submitted, completed once by {@link #finish}. */
@Entity
@Table(name = "job_executions")
public class JobExecution implements AuditableEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "job_id", nullable = false)
  private Job job;

  @Column(name = "task_id")
  private String taskId;

  @Column(name = "parameters", length = 8192)
  private String parameters;

  @Column(name = "creator", nullable = false, length = 128)
  private String creator;

  @Column(name = "is_finished", nullable = false)
  private boolean finished;

  @Column(name = "is_success", nullable = false)
  private boolean success;

  @Column(name = "date_start")
  private Instant dateStart;

  @Column(name = "date_finished")
  private Instant dateFinished;

  @Column(name = "time_cost")
  private Double timeCost;

  @Column(name = "summary", length = 8192)
  private String summary;

  @Column(name = "org_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "date_created", nullable = false, updatable = false)
  private Instant dateCreated;

  protected JobExecution() {}

  public JobExecution(Job job, String parameters, String creator) {
    this.job = job;
    this.parameters = parameters;
    this.creator = creator;
    this.tenantId = job.getTenantId();
    this.dateCreated = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  /** Job name followed by the first block of the execution id. */
  @Override
  public String getDisplayName() {
    String name = job.getName();
    return id != null ? name + " #" + id.toString().substring(0, 8) : name;
  }

  public Job getJob() {
    return job;
  }

  public String getTaskId() {
    return taskId;
  }

  public String getParameters() {
    return parameters;
  }

  public String getCreator() {
    return creator;
  }

  public boolean isFinished() {
    return finished;
  }

  public boolean isSuccess() {
    return success;
  }

  public Instant getDateStart() {
    return dateStart;
  }

  public Instant getDateFinished() {
    return dateFinished;
  }

  public Double getTimeCost() {
    return timeCost;
  }

  public String getSummary() {
    return summary;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getDateCreated() {
    return dateCreated;
  }

  public void start(String taskId, Instant at) {
    this.taskId = taskId;
    this.dateStart = at;
  }

  /** Records the outcome; time cost is seconds since {@link #start}, or null if never started. */
  public void finish(boolean success, String summary, Instant at) {
    this.finished = true;
    this.success = success;
    this.summary = summary;
    this.dateFinished = at;
    this.timeCost = dateStart != null ? Duration.between(dateStart, at).toMillis() / 1000.0 : null;
  }
}
