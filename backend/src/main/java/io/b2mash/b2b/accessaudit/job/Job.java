package io.b2mash.b2b.accessaudit.job;

import io.b2mash.b2b.accessaudit.asset.Asset;
import io.b2mash.b2b.accessaudit.store.AuditableEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Administrative job run against a set of assets: an ad-hoc module call or a playbook. Periodic
 * jobs carry either an interval (hours) or a crontab expression, never both.
 */
@Entity
@Table(name = "jobs")
public class Job implements AuditableEntity {

  public static final String LAST_RUN_FIELD = "dateLastRun";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 16)
  private JobType type;

  @Column(name = "module", length = 128)
  private String module;

  @Column(name = "args", length = 8192)
  private String args;

  @Column(name = "playbook_id")
  private UUID playbookId;

  @ManyToMany
  @JoinTable(
      name = "jobs_assets",
      joinColumns = @JoinColumn(name = "job_id"),
      inverseJoinColumns = @JoinColumn(name = "asset_id"))
  private Set<Asset> assets = new HashSet<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "runas_policy", nullable = false, length = 32)
  private RunasPolicy runasPolicy;

  @Column(name = "runas", nullable = false, length = 128)
  private String runas;

  @Column(name = "creator", nullable = false, length = 128)
  private String creator;

  @Column(name = "timeout", nullable = false)
  private int timeout;

  @Column(name = "chdir", length = 1024)
  private String chdir;

  @Column(name = "comment", length = 1024)
  private String comment;

  @Column(name = "is_periodic", nullable = false)
  private boolean periodic;

  @Column(name = "interval_hours")
  private Integer interval;

  @Column(name = "crontab", length = 128)
  private String crontab;

  @Column(name = "date_last_run")
  private Instant dateLastRun;

  @Column(name = "org_id", nullable = false, length = 64)
  private String tenantId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Job() {}

  public Job(
      String name,
      JobType type,
      String module,
      String args,
      UUID playbookId,
      RunasPolicy runasPolicy,
      String runas,
      String creator,
      int timeout,
      String chdir,
      String comment,
      String tenantId) {
    this.name = name;
    this.type = type;
    this.module = module;
    this.args = args;
    this.playbookId = playbookId;
    this.runasPolicy = runasPolicy;
    this.runas = runas;
    this.creator = creator;
    this.timeout = timeout;
    this.chdir = chdir;
    this.comment = comment;
    this.tenantId = tenantId;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public String getDisplayName() {
    return name;
  }

  public String getName() {
    return name;
  }

  public JobType getType() {
    return type;
  }

  public String getModule() {
    return module;
  }

  public String getArgs() {
    return args;
  }

  public UUID getPlaybookId() {
    return playbookId;
  }

  public Set<Asset> getAssets() {
    return assets;
  }

  public RunasPolicy getRunasPolicy() {
    return runasPolicy;
  }

  public String getRunas() {
    return runas;
  }

  public String getCreator() {
    return creator;
  }

  public int getTimeout() {
    return timeout;
  }

  public String getChdir() {
    return chdir;
  }

  public String getComment() {
    return comment;
  }

  public boolean isPeriodic() {
    return periodic;
  }

  public Integer getInterval() {
    return interval;
  }

  public String getCrontab() {
    return crontab;
  }

  public Instant getDateLastRun() {
    return dateLastRun;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void assignAssets(Set<Asset> assets) {
    this.assets.clear();
    this.assets.addAll(assets);
  }

  public void schedule(Integer interval, String crontab) {
    this.periodic = true;
    this.interval = interval;
    this.crontab = crontab;
    this.updatedAt = Instant.now();
  }

  public void unschedule() {
    this.periodic = false;
    this.interval = null;
    this.crontab = null;
    this.updatedAt = Instant.now();
  }

  public void markRun(Instant at) {
    this.dateLastRun = at;
  }
}
