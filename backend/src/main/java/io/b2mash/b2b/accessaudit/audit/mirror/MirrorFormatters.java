package io.b2mash.b2b.accessaudit.audit.mirror;

import io.b2mash.b2b.accessaudit.audit.FtpLog;
import io.b2mash.b2b.accessaudit.audit.OperateLog;
import io.b2mash.b2b.accessaudit.audit.PasswordChangeLog;
import io.b2mash.b2b.accessaudit.audit.login.UserLoginLog;
import io.b2mash.b2b.accessaudit.terminal.SessionCommand;
import io.b2mash.b2b.accessaudit.terminal.TerminalSession;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/** Flattens each mirrored record type into the snake_case fields of its log line. */
final class MirrorFormatters {

  private MirrorFormatters() {}

  /** Routing table: one formatter per category. */
  static Map<AuditLogCategory, Function<MirroredRecord, Map<String, Object>>> routingTable() {
    var table =
        new EnumMap<AuditLogCategory, Function<MirroredRecord, Map<String, Object>>>(
            AuditLogCategory.class);
    table.put(AuditLogCategory.LOGIN_LOG, r -> loginLog((UserLoginLog) r));
    table.put(AuditLogCategory.FTP_LOG, r -> ftpLog((FtpLog) r));
    table.put(AuditLogCategory.OPERATION_LOG, r -> operateLog((OperateLog) r));
    table.put(AuditLogCategory.PASSWORD_CHANGE_LOG, r -> passwordChangeLog((PasswordChangeLog) r));
    table.put(AuditLogCategory.HOST_SESSION_LOG, r -> terminalSession((TerminalSession) r));
    table.put(AuditLogCategory.SESSION_COMMAND_LOG, r -> sessionCommand((SessionCommand) r));
    return table;
  }

  static Map<String, Object> loginLog(UserLoginLog log) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("id", log.getId());
    fields.put("username", log.getUsername());
    fields.put("type", log.getType().code());
    fields.put("ip", log.getIp());
    fields.put("user_agent", log.getUserAgent());
    fields.put("backend", log.getBackend());
    fields.put("mfa", log.getMfa().code());
    fields.put("status", log.isStatus());
    fields.put("reason", log.getReason());
    fields.put("datetime", timestamp(log.getDatetime()));
    return fields;
  }

  static Map<String, Object> ftpLog(FtpLog log) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("id", log.getId());
    fields.put("user", log.getUser());
    fields.put("remote_addr", log.getRemoteAddr());
    fields.put("asset", log.getAsset());
    fields.put("account", log.getAccount());
    fields.put("operate", log.getOperate().name());
    fields.put("filename", log.getFilename());
    fields.put("is_success", log.isSuccess());
    fields.put("org_id", log.getTenantId());
    fields.put("date_start", timestamp(log.getDateStart()));
    return fields;
  }

  static Map<String, Object> operateLog(OperateLog log) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("id", log.getId());
    fields.put("user", log.getUser());
    fields.put("action", log.getAction().value());
    fields.put("resource_type", log.getResourceType());
    fields.put("resource", log.getResource());
    fields.put("remote_addr", log.getRemoteAddr());
    fields.put("org_id", log.getTenantId());
    fields.put("datetime", timestamp(log.getDatetime()));
    return fields;
  }

  static Map<String, Object> passwordChangeLog(PasswordChangeLog log) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("id", log.getId());
    fields.put("user", log.getUser());
    fields.put("change_by", log.getChangeBy());
    fields.put("remote_addr", log.getRemoteAddr());
    fields.put("org_id", log.getTenantId());
    fields.put("datetime", timestamp(log.getDatetime()));
    return fields;
  }

  static Map<String, Object> terminalSession(TerminalSession session) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("id", session.getId());
    fields.put("user", session.getUser());
    fields.put("asset", session.getAsset());
    fields.put("account", session.getAccount());
    fields.put("protocol", session.getProtocol());
    fields.put("login_from", session.getLoginFrom());
    fields.put("remote_addr", session.getRemoteAddr());
    fields.put("is_finished", session.isFinished());
    fields.put("org_id", session.getTenantId());
    fields.put("date_start", timestamp(session.getDateStart()));
    fields.put("date_end", timestamp(session.getDateEnd()));
    return fields;
  }

  static Map<String, Object> sessionCommand(SessionCommand command) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("id", command.getId());
    fields.put("user", command.getUser());
    fields.put("asset", command.getAsset());
    fields.put("account", command.getAccount());
    fields.put("input", command.getInput());
    fields.put("risk_level", command.getRiskLevel());
    fields.put("session", command.getSessionId());
    fields.put("org_id", command.getTenantId());
    fields.put("timestamp", timestamp(command.getTimestamp()));
    return fields;
  }

  private static String timestamp(Instant instant) {
    return instant != null ? instant.toString() : null;
  }
}
