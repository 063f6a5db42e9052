package io.b2mash.b2b.accessaudit.audit;

import io.b2mash.b2b.accessaudit.audit.login.UserLoginLog;
import io.b2mash.b2b.accessaudit.audit.login.UserLoginLogRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists audit records. Every write participates in the caller's transaction (no REQUIRES_NEW):
 * if the audited operation rolls back, so does its record. Store failures propagate.
 *
 * <p>Each persisted record is mirrored to the secondary log by {@link
 * io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirrorListener}.
 */
@Service
public class AuditLogWriter {

  private static final Logger log = LoggerFactory.getLogger(AuditLogWriter.class);

  private final OperateLogRepository operateLogRepository;
  private final PasswordChangeLogRepository passwordChangeLogRepository;
  private final UserLoginLogRepository userLoginLogRepository;
  private final FtpLogRepository ftpLogRepository;

  public AuditLogWriter(
      OperateLogRepository operateLogRepository,
      PasswordChangeLogRepository passwordChangeLogRepository,
      UserLoginLogRepository userLoginLogRepository,
      FtpLogRepository ftpLogRepository) {
    this.operateLogRepository = operateLogRepository;
    this.passwordChangeLogRepository = passwordChangeLogRepository;
    this.userLoginLogRepository = userLoginLogRepository;
    this.ftpLogRepository = ftpLogRepository;
  }

  @Transactional
  public OperateLog writeOperateLog(OperateLog record) {
    var saved = operateLogRepository.save(record);
    log.debug(
        "Recorded operate log: action={}, resourceType={}, user={}, tenant={}",
        saved.getAction(),
        saved.getResourceType(),
        saved.getUser(),
        saved.getTenantId());
    return saved;
  }

  /** Writes all records in one batch insert. An empty list writes nothing. */
  @Transactional
  public List<OperateLog> writeOperateLogs(List<OperateLog> records) {
    if (records.isEmpty()) {
      return List.of();
    }
    var saved = operateLogRepository.saveAll(records);
    log.debug(
        "Recorded {} operate logs: action={}, resourceType={}",
        saved.size(),
        saved.get(0).getAction(),
        saved.get(0).getResourceType());
    return saved;
  }

  @Transactional
  public PasswordChangeLog writePasswordChangeLog(PasswordChangeLog record) {
    var saved = passwordChangeLogRepository.save(record);
    log.debug(
        "Recorded password change: user={}, changeBy={}", saved.getUser(), saved.getChangeBy());
    return saved;
  }

  @Transactional
  public UserLoginLog writeLoginLog(UserLoginLog record) {
    var saved = userLoginLogRepository.save(record);
    log.debug(
        "Recorded login: username={}, status={}, type={}",
        saved.getUsername(),
        saved.isStatus(),
        saved.getType());
    return saved;
  }

  @Transactional
  public FtpLog writeFtpLog(FtpLog record) {
    var saved = ftpLogRepository.save(record);
    log.debug(
        "Recorded ftp log: user={}, operate={}, success={}",
        saved.getUser(),
        saved.getOperate(),
        saved.isSuccess());
    return saved;
  }
}
