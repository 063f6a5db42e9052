package io.b2mash.b2b.accessaudit.audit.mirror;

import static io.b2mash.b2b.accessaudit.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.accessaudit.audit.ActionType;
import io.b2mash.b2b.accessaudit.audit.FtpLog;
import io.b2mash.b2b.accessaudit.audit.FtpOperation;
import io.b2mash.b2b.accessaudit.audit.OperateLog;
import io.b2mash.b2b.accessaudit.audit.PasswordChangeLog;
import io.b2mash.b2b.accessaudit.audit.login.LoginType;
import io.b2mash.b2b.accessaudit.audit.login.MfaStatus;
import io.b2mash.b2b.accessaudit.audit.login.UserLoginLog;
import io.b2mash.b2b.accessaudit.terminal.SessionCommand;
import io.b2mash.b2b.accessaudit.terminal.TerminalSession;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuditLogMirrorTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<String> lines = new ArrayList<>();
  private final AuditLogMirror mirror = new AuditLogMirror(objectMapper, lines::add, true);

  @Test
  void mirror_writesCategoryPrefixedJsonLine() throws Exception {
    var log =
        withId(
            new OperateLog(
                "Alice(alice)", ActionType.CREATE, "User", "Bob(bob)", "192.0.2.1", "tenant-1"));

    mirror.mirror(log);

    assertThat(lines).hasSize(1);
    var line = lines.get(0);
    assertThat(line).startsWith("operation_log - {").doesNotContain("\n");
    var json = objectMapper.readTree(line.substring("operation_log - ".length()));
    assertThat(json.get("id").asText()).isEqualTo(log.getId().toString());
    assertThat(json.get("user").asText()).isEqualTo("Alice(alice)");
    assertThat(json.get("action").asText()).isEqualTo("create");
    assertThat(json.get("resource_type").asText()).isEqualTo("User");
    assertThat(json.get("org_id").asText()).isEqualTo("tenant-1");
    assertThat(Instant.parse(json.get("datetime").asText())).isEqualTo(log.getDatetime());
  }

  @Test
  void mirror_routesEachCategoryToItsFormatter() {
    var session =
        withId(new TerminalSession("alice", "web-1", "root", "ssh", "WT", "10.0.0.1", "t-1"));

    mirror.mirror(
        withId(
            new UserLoginLog(
                "alice",
                "10.0.0.1",
                LoginType.WEB,
                "Mozilla",
                Instant.now(),
                "Password",
                MfaStatus.DISABLED,
                true,
                "")));
    mirror.mirror(
        withId(
            new FtpLog(
                "alice", "10.0.0.1", "web-1", "root", FtpOperation.UPLOAD, "/tmp/a", true, "t-1")));
    mirror.mirror(withId(new PasswordChangeLog("Alice(alice)", "System", "127.0.0.1", "t-1")));
    mirror.mirror(session);
    mirror.mirror(withId(new SessionCommand(session, "ls -la", 0, Instant.now())));

    assertThat(lines)
        .extracting(line -> line.substring(0, line.indexOf(" - ")))
        .containsExactly(
            "login_log",
            "ftp_log",
            "password_change_log",
            "host_session_log",
            "session_command_log");
    assertThat(lines.get(0))
        .contains("\"type\":\"W\"")
        .contains("\"mfa\":0")
        .contains("\"status\":true");
    assertThat(lines.get(4)).contains("\"input\":\"ls -la\"");
  }

  @Test
  void mirror_appenderFailureIsSwallowed() {
    var failing =
        new AuditLogMirror(
            objectMapper,
            line -> {
              throw new IllegalStateException("syslog unreachable");
            },
            true);
    var log =
        withId(new OperateLog("Alice(alice)", ActionType.DELETE, "User", "Bob(bob)", "", "t-1"));

    assertThatCode(() -> failing.mirror(log)).doesNotThrowAnyException();
  }

  @Test
  void mirror_disabledWritesNothing() {
    var disabled = new AuditLogMirror(objectMapper, lines::add, false);

    disabled.mirror(
        withId(new OperateLog("Alice(alice)", ActionType.UPDATE, "User", "Bob(bob)", "", "t-1")));

    assertThat(lines).isEmpty();
  }
}
