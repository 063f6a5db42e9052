package io.b2mash.b2b.accessaudit.audit.mirror;

/** Record categories mirrored to the secondary log stream, keyed by their line prefix. */
public enum AuditLogCategory {
  LOGIN_LOG("login_log"),
  FTP_LOG("ftp_log"),
  OPERATION_LOG("operation_log"),
  PASSWORD_CHANGE_LOG("password_change_log"),
  HOST_SESSION_LOG("host_session_log"),
  SESSION_COMMAND_LOG("session_command_log");

  private final String code;

  AuditLogCategory(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
