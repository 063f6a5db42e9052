package io.b2mash.b2b.accessaudit.audit;

import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogCategory;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirrorListener;
import io.b2mash.b2b.accessaudit.audit.mirror.MirroredRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** File transfer operation reported by the SFTP/FTP gateway. Immutable. */
@Entity
@Table(name = "ftp_logs")
@EntityListeners(AuditLogMirrorListener.class)
public class FtpLog implements MirroredRecord {

  private static final int PATH_MAX_LENGTH = 1024;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "username", nullable = false, length = 128, updatable = false)
  private String user;

  @Column(name = "remote_addr", length = 128, updatable = false)
  private String remoteAddr;

  @Column(name = "asset", nullable = false, length = 1024, updatable = false)
  private String asset;

  @Column(name = "account", nullable = false, length = 128, updatable = false)
  private String account;

  @Enumerated(EnumType.STRING)
  @Column(name = "operate", nullable = false, length = 16, updatable = false)
  private FtpOperation operate;

  @Column(name = "filename", nullable = false, length = 1024, updatable = false)
  private String filename;

  @Column(name = "is_success", nullable = false, updatable = false)
  private boolean success;

  @Column(name = "org_id", nullable = false, length = 64, updatable = false)
  private String tenantId;

  @Column(name = "date_start", nullable = false, updatable = false)
  private Instant dateStart;

  protected FtpLog() {}

  public FtpLog(
      String user,
      String remoteAddr,
      String asset,
      String account,
      FtpOperation operate,
      String filename,
      boolean success,
      String tenantId) {
    this.user = AuditText.truncate(user, AuditText.USER_MAX_LENGTH);
    this.remoteAddr = AuditText.truncate(remoteAddr, AuditText.REMOTE_ADDR_MAX_LENGTH);
    this.asset = AuditText.truncate(asset, PATH_MAX_LENGTH);
    this.account = AuditText.truncate(account, AuditText.USER_MAX_LENGTH);
    this.operate = operate;
    this.filename = AuditText.truncate(filename, PATH_MAX_LENGTH);
    this.success = success;
    this.tenantId = tenantId;
    this.dateStart = Instant.now();
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public AuditLogCategory mirrorCategory() {
    return AuditLogCategory.FTP_LOG;
  }

  public String getUser() {
    return user;
  }

  public String getRemoteAddr() {
    return remoteAddr;
  }

  public String getAsset() {
    return asset;
  }

  public String getAccount() {
    return account;
  }

  public FtpOperation getOperate() {
    return operate;
  }

  public String getFilename() {
    return filename;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getTenantId() {
    return tenantId;
  }

  public Instant getDateStart() {
    return dateStart;
  }
}
