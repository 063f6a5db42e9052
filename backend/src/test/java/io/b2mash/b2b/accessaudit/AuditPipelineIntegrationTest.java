package io.b2mash.b2b.accessaudit;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.accessaudit.audit.ActionType;
import io.b2mash.b2b.accessaudit.audit.AuditLogQueryService;
import io.b2mash.b2b.accessaudit.audit.OperateLog;
import io.b2mash.b2b.accessaudit.audit.OperateLogFilter;
import io.b2mash.b2b.accessaudit.audit.login.AuthFailedEvent;
import io.b2mash.b2b.accessaudit.audit.login.LoginLogFilter;
import io.b2mash.b2b.accessaudit.audit.mirror.SecondaryLogAppender;
import io.b2mash.b2b.accessaudit.context.AuditContext;
import io.b2mash.b2b.accessaudit.context.RequestContext;
import io.b2mash.b2b.accessaudit.context.UserRef;
import io.b2mash.b2b.accessaudit.identity.UserGroup;
import io.b2mash.b2b.accessaudit.identity.UserGroupRepository;
import io.b2mash.b2b.accessaudit.identity.UserService;
import io.b2mash.b2b.accessaudit.identity.UserSource;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * End-to-end audit capture against a real Postgres: domain writes through the audited store,
 * event-driven login and password records, and mirroring of every persisted record.
 */
@SpringBootTest
@Import({
  TestcontainersConfiguration.class,
  AuditPipelineIntegrationTest.CapturingAppenderConfig.class
})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AuditPipelineIntegrationTest {

  @Autowired private UserService userService;
  @Autowired private UserGroupRepository userGroupRepository;
  @Autowired private AuditLogQueryService queryService;
  @Autowired private ApplicationEventPublisher eventPublisher;
  @Autowired private CapturingAppender mirror;

  @Test
  void joiningGroupsWritesOneRecordPerGroup() {
    String tenant = "tenant-" + UUID.randomUUID();
    var context = adminContext(tenant);
    var alice =
        userService.createUser(
            context, "alice-" + UUID.randomUUID(), "Alice", null, UserSource.LOCAL);
    var admins = userGroupRepository.save(new UserGroup("admins", null, tenant));
    var ops = userGroupRepository.save(new UserGroup("ops", null, tenant));

    userService.joinGroups(context, alice.getId(), List.of(admins.getId(), ops.getId()));

    var records =
        queryService
            .findOperateLogs(
                new OperateLogFilter(
                    tenant, null, ActionType.CREATE, "User and Group", null, null, null),
                PageRequest.of(0, 20))
            .getContent();
    assertThat(records)
        .extracting(OperateLog::getResource)
        .containsExactlyInAnyOrder(
            alice.getDisplayName() + " JOINED admins", alice.getDisplayName() + " JOINED ops");
    assertThat(records).allSatisfy(r -> assertThat(r.getUser()).isEqualTo("Admin(admin)"));
    assertThat(mirror.lines)
        .anyMatch(
            line ->
                line.startsWith("operation_log - ")
                    && line.contains(alice.getDisplayName() + " JOINED admins"));
  }

  @Test
  void recordingLastLoginWritesNoOperateLog() {
    String tenant = "tenant-" + UUID.randomUUID();
    var context = adminContext(tenant);
    var bob =
        userService.createUser(context, "bob-" + UUID.randomUUID(), "Bob", null, UserSource.LOCAL);

    userService.recordLogin(context, bob.getId());

    var records =
        queryService
            .findOperateLogs(OperateLogFilter.forTenant(tenant), PageRequest.of(0, 20))
            .getContent();
    assertThat(records).extracting(OperateLog::getAction).containsExactly(ActionType.CREATE);
  }

  @Test
  void systemPasswordChangeIsAttributedToSystem() {
    String tenant = "tenant-" + UUID.randomUUID();
    var carol =
        userService.createUser(
            adminContext(tenant), "carol-" + UUID.randomUUID(), "Carol", null, UserSource.LOCAL);

    userService.changePassword(AuditContext.background(tenant), carol.getId(), "n3w-Secret");

    var logs =
        queryService
            .findPasswordChangeLogs(tenant, carol.getDisplayName(), PageRequest.of(0, 10))
            .getContent();
    assertThat(logs).hasSize(1);
    assertThat(logs.get(0).getChangeBy()).isEqualTo("System");
    assertThat(logs.get(0).getRemoteAddr()).isEqualTo("127.0.0.1");
  }

  @Test
  void failedLoginIsRecordedAndMirrored() {
    String username = "mallory-" + UUID.randomUUID();
    var request = RequestContext.of("203.0.113.50", Map.of("User-Agent", "curl/8.0"));

    eventPublisher.publishEvent(new AuthFailedEvent(username, request, "Password is wrong"));

    var logs =
        queryService
            .findLoginLogs(
                new LoginLogFilter(username, null, false, null, null), PageRequest.of(0, 10))
            .getContent();
    assertThat(logs).hasSize(1);
    assertThat(logs.get(0).getIp()).isEqualTo("203.0.113.50");
    assertThat(logs.get(0).getReason()).isEqualTo("Password is wrong");
    assertThat(mirror.lines)
        .anyMatch(line -> line.startsWith("login_log - ") && line.contains(username));
  }

  private static AuditContext adminContext(String tenant) {
    return AuditContext.of(
        new UserRef(UUID.randomUUID(), "admin", "Admin", true),
        tenant,
        RequestContext.of("192.0.2.1", Map.of()));
  }

  static class CapturingAppender implements SecondaryLogAppender {

    final List<String> lines = new CopyOnWriteArrayList<>();

    @Override
    public void append(String line) {
      lines.add(line);
    }
  }

  @TestConfiguration(proxyBeanMethods = false)
  static class CapturingAppenderConfig {

    @Bean
    @Primary
    CapturingAppender capturingAppender() {
      return new CapturingAppender();
    }
  }
}
