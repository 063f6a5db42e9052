package io.b2mash.b2b.accessaudit.terminal;

import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogCategory;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirrorListener;
import io.b2mash.b2b.accessaudit.audit.mirror.MirroredRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Interactive session opened through a terminal gateway. Mirrored once when the session starts;
 * finishing it only updates the row.
 */
@Entity
@Table(name = "terminal_sessions")
@EntityListeners(AuditLogMirrorListener.class)
public class TerminalSession implements MirroredRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, length = 128)
  private String user;

  @Column(name = "asset", nullable = false, length = 128)
  private String asset;

  @Column(name = "account", nullable = false, length = 128)
  private String account;

  @Column(name = "protocol", nullable = false, length = 16)
  private String protocol;

  @Column(name = "login_from", nullable = false, length = 2)
  private String loginFrom;

  @Column(name = "remote_addr", length = 128)
  private String remoteAddr;

  @Column(name = "is_finished", nullable = false)
  private boolean finished;

  @Column(name = "date_start", nullable = false)
  private Instant dateStart;

  @Column(name = "date_end")
  private Instant dateEnd;

  @Column(name = "org_id", nullable = false, length = 64)
  private String tenantId;

  protected TerminalSession() {}

  public TerminalSession(
      String user,
      String asset,
      String account,
      String protocol,
      String loginFrom,
      String remoteAddr,
      String tenantId) {
    this.user = user;
    this.asset = asset;
    this.account = account;
    this.protocol = protocol;
    this.loginFrom = loginFrom;
    this.remoteAddr = remoteAddr;
    this.tenantId = tenantId;
    this.dateStart = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public AuditLogCategory mirrorCategory() {
    return AuditLogCategory.HOST_SESSION_LOG;
  }

  public String getUser() {
    return user;
  }

  public String getAsset() {
    return asset;
  }

  public String getAccount() {
    return account;
  }

  public String getProtocol() {
    return protocol;
  }

  public String getLoginFrom() {
    return loginFrom;
  }

  public String getRemoteAddr() {
    return remoteAddr;
  }

  public boolean isFinished() {
    return finished;
  }

  public Instant getDateStart() {
    return dateStart;
  }

  public Instant getDateEnd() {
    return dateEnd;
  }

  public String getTenantId() {
    return tenantId;
  }

  public void finish(Instant at) {
    this.finished = true;
    this.dateEnd = at;
  }
}
