package com.codeheadsystems.gitgate.springboot.config;

import com.codeheadsystems.gitgate.server.auth.Authenticator;
import com.codeheadsystems.gitgate.server.auth.CredentialExtractor;
import com.codeheadsystems.gitgate.server.auth.PrincipalResolver;
import com.codeheadsystems.gitgate.server.auth.TokenAuthenticator;
import com.codeheadsystems.gitgate.server.store.InMemoryServiceAccountStore;
import com.codeheadsystems.gitgate.server.store.InMemoryTokenStore;
import com.codeheadsystems.gitgate.server.store.InMemoryUserStore;
import com.codeheadsystems.gitgate.server.store.ServiceAccountStore;
import com.codeheadsystems.gitgate.server.store.TokenStore;
import com.codeheadsystems.gitgate.server.store.UserStore;
import com.codeheadsystems.gitgate.springboot.security.GitGateSecurityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(GitGateProperties.class)
@Import(GitGateSecurityConfig.class)
public class GitGateAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(GitGateAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public UserStore userStore() {
    log.warn("Using in-memory user store. All data will be lost on restart. Do not use in production.");
    return new InMemoryUserStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public ServiceAccountStore serviceAccountStore() {
    log.warn("Using in-memory service account store. All data will be lost on restart. Do not use in production.");
    return new InMemoryServiceAccountStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenStore tokenStore() {
    log.warn("Using in-memory token store. All data will be lost on restart. Do not use in production.");
    return new InMemoryTokenStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialExtractor credentialExtractor() {
    return new CredentialExtractor();
  }

  @Bean
  @ConditionalOnMissingBean
  public PrincipalResolver principalResolver(UserStore userStore,
                                             ServiceAccountStore serviceAccountStore) {
    return new PrincipalResolver(userStore, serviceAccountStore);
  }

  /**
   * Default authenticator for every inbound request. Declare any other {@link Authenticator} bean
   * to replace it in the security filter.
   */
  @Bean
  @ConditionalOnMissingBean(Authenticator.class)
  public TokenAuthenticator tokenAuthenticator(CredentialExtractor credentialExtractor,
                                               PrincipalResolver principalResolver,
                                               TokenStore tokenStore) {
    return new TokenAuthenticator(credentialExtractor, principalResolver, tokenStore);
  }
}
