package io.b2mash.b2b.accessaudit.audit;

import io.b2mash.b2b.accessaudit.audit.login.LoginLogFilter;
import io.b2mash.b2b.accessaudit.audit.login.UserLoginLog;
import io.b2mash.b2b.accessaudit.audit.login.UserLoginLogRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read side of the audit records. */
@Service
public class AuditLogQueryService {

  private final OperateLogRepository operateLogRepository;
  private final PasswordChangeLogRepository passwordChangeLogRepository;
  private final UserLoginLogRepository userLoginLogRepository;

  public AuditLogQueryService(
      OperateLogRepository operateLogRepository,
      PasswordChangeLogRepository passwordChangeLogRepository,
      UserLoginLogRepository userLoginLogRepository) {
    this.operateLogRepository = operateLogRepository;
    this.passwordChangeLogRepository = passwordChangeLogRepository;
    this.userLoginLogRepository = userLoginLogRepository;
  }

  @Transactional(readOnly = true)
  public Page<OperateLog> findOperateLogs(OperateLogFilter filter, Pageable pageable) {
    return operateLogRepository.findByFilter(
        filter.tenantId(),
        filter.user(),
        filter.action(),
        filter.resourceType(),
        filter.resource(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Transactional(readOnly = true)
  public Page<UserLoginLog> findLoginLogs(LoginLogFilter filter, Pageable pageable) {
    return userLoginLogRepository.findByFilter(
        filter.username(), filter.ip(), filter.status(), filter.from(), filter.to(), pageable);
  }

  /**
   * @param user subject display form to filter by, or null for all users
   */
  @Transactional(readOnly = true)
  public Page<PasswordChangeLog> findPasswordChangeLogs(
      String tenantId, String user, Pageable pageable) {
    return passwordChangeLogRepository.findByFilter(tenantId, user, pageable);
  }
}
