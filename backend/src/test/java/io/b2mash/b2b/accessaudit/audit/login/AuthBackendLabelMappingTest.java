package io.b2mash.b2b.accessaudit.audit.login;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.accessaudit.identity.AuthBackends;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.StaticMessageSource;

class AuthBackendLabelMappingTest {

  @Test
  void create_backendsInheritTheirSourceLabel() {
    var messages = new StaticMessageSource();
    messages.addMessage("user.source.openid", Locale.ENGLISH, "OpenID");
    messages.addMessage("user.source.ldap", Locale.ENGLISH, "LDAP/AD");

    var mapping = AuthBackendLabelMapping.create(messages, Locale.ENGLISH);

    assertThat(mapping.labelFor(AuthBackends.OIDC_PASSWORD)).isEqualTo("OpenID");
    assertThat(mapping.labelFor(AuthBackends.OIDC_CODE)).isEqualTo("OpenID");
    assertThat(mapping.labelFor(AuthBackends.LDAP)).isEqualTo("LDAP/AD");
  }

  @Test
  void create_ownLabelsOverrideSourceLabel() {
    var messages = new StaticMessageSource();
    messages.addMessage("user.source.local", Locale.ENGLISH, "Local");
    messages.addMessage("auth.backend.pubkey", Locale.ENGLISH, "SSH Key");
    messages.addMessage("auth.backend.password", Locale.ENGLISH, "Password");

    var mapping = AuthBackendLabelMapping.create(messages, Locale.ENGLISH);

    assertThat(mapping.labelFor(AuthBackends.PUBLIC_KEY)).isEqualTo("SSH Key");
    assertThat(mapping.labelFor(AuthBackends.PASSWORD)).isEqualTo("Password");
  }

  @Test
  void create_resolvesInTheConfiguredLocale() {
    var messages = new StaticMessageSource();
    messages.addMessage("auth.backend.temp-token", Locale.ENGLISH, "Temporary token");
    messages.addMessage("auth.backend.temp-token", Locale.SIMPLIFIED_CHINESE, "临时密码");

    var mapping = AuthBackendLabelMapping.create(messages, Locale.SIMPLIFIED_CHINESE);

    assertThat(mapping.labelFor(AuthBackends.TEMP_TOKEN)).isEqualTo("临时密码");
  }

  @Test
  void labelFor_unknownOrMissingBackendIsEmpty() {
    var mapping = AuthBackendLabelMapping.create(new StaticMessageSource(), Locale.ENGLISH);

    assertThat(mapping.labelFor("kerberos")).isEmpty();
    assertThat(mapping.labelFor(null)).isEmpty();
  }

  @Test
  void asMap_isImmutable() {
    var mapping = AuthBackendLabelMapping.create(new StaticMessageSource(), Locale.ENGLISH);

    assertThat(mapping.asMap()).containsKey(AuthBackends.SAML2);
    assertThatThrownBy(() -> mapping.asMap().put("kerberos", "Kerberos"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
