package io.b2mash.b2b.accessaudit.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

class AuditContextFactoryTest {

  private final AuditContextFactory factory = new AuditContextFactory();

  @Test
  void fromRequest_authenticatedPrincipalBecomesUser() {
    var request = new MockHttpServletRequest("POST", "/api/v1/users/");
    request.setRemoteAddr("192.0.2.5");
    var authentication =
        UsernamePasswordAuthenticationToken.authenticated("alice", "n/a", List.of());

    var context = factory.fromRequest(request, authentication, "tenant-1");

    assertThat(context.user().username()).isEqualTo("alice");
    assertThat(context.user().authenticated()).isTrue();
    assertThat(context.tenantId()).isEqualTo("tenant-1");
    assertThat(context.request().apiRequest()).isTrue();
    assertThat(ClientIpResolver.resolve(context.request())).isEqualTo("192.0.2.5");
  }

  @Test
  void fromRequest_anonymousTokenIsUnauthenticated() {
    var request = new MockHttpServletRequest("GET", "/core/auth/login/");
    var anonymous =
        new AnonymousAuthenticationToken(
            "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

    var context = factory.fromRequest(request, anonymous, null);

    assertThat(context.user().authenticated()).isFalse();
    assertThat(context.request().apiRequest()).isFalse();
  }

  @Test
  void fromRequest_withoutAuthenticationHasNoUser() {
    var request = new MockHttpServletRequest("GET", "/api/v1/assets/");

    var context = factory.fromRequest(request, null, "tenant-1");

    assertThat(context.user()).isNull();
    assertThat(context.hasRequest()).isTrue();
  }

  @Test
  void fromRequest_sessionWritesReachServletSession() {
    var request = new MockHttpServletRequest("POST", "/api/v1/authentication/tokens/");
    var context = factory.fromRequest(request, null, null);

    context.request().session().setAttribute("login_time", "2024-01-01 00:00:00");

    assertThat(request.getSession().getAttribute("login_time")).isEqualTo("2024-01-01 00:00:00");
  }
}
