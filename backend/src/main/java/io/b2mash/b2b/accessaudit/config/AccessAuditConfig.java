package io.b2mash.b2b.accessaudit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.accessaudit.audit.login.AuthBackendLabelMapping;
import io.b2mash.b2b.accessaudit.audit.login.RecentLoginLocationChecker;
import io.b2mash.b2b.accessaudit.audit.login.UnusualLoginChecker;
import io.b2mash.b2b.accessaudit.audit.login.UserLoginLogRepository;
import io.b2mash.b2b.accessaudit.audit.mirror.AuditLogMirror;
import io.b2mash.b2b.accessaudit.audit.mirror.SecondaryLogAppender;
import io.b2mash.b2b.accessaudit.audit.mirror.Slf4jSecondaryLogAppender;
import io.b2mash.b2b.accessaudit.job.JobRunner;
import io.b2mash.b2b.accessaudit.job.NoOpJobRunner;
import java.util.Locale;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@EnableConfigurationProperties(AuditProperties.class)
public class AccessAuditConfig {

  @Bean
  AuthBackendLabelMapping authBackendLabelMapping(
      MessageSource messageSource, AuditProperties properties) {
    return AuthBackendLabelMapping.create(
        messageSource, Locale.forLanguageTag(properties.labelLocale()));
  }

  @Bean
  @ConditionalOnMissingBean(SecondaryLogAppender.class)
  SecondaryLogAppender secondaryLogAppender(AuditProperties properties) {
    return new Slf4jSecondaryLogAppender(properties.mirror().loggerName());
  }

  @Bean
  AuditLogMirror auditLogMirror(
      ObjectMapper objectMapper, SecondaryLogAppender appender, AuditProperties properties) {
    return new AuditLogMirror(objectMapper, appender, properties.mirror().enabled());
  }

  @Bean
  @ConditionalOnMissingBean(UnusualLoginChecker.class)
  UnusualLoginChecker unusualLoginChecker(UserLoginLogRepository loginLogRepository) {
    return new RecentLoginLocationChecker(loginLogRepository);
  }

  @Bean
  @ConditionalOnMissingBean(JobRunner.class)
  JobRunner jobRunner() {
    return new NoOpJobRunner();
  }

  @Bean
  PasswordEncoder passwordEncoder() {
    return PasswordEncoderFactories.createDelegatingPasswordEncoder();
  }
}
