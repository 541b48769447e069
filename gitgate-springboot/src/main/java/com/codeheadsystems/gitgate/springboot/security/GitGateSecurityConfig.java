package com.codeheadsystems.gitgate.springboot.security;

import com.codeheadsystems.gitgate.server.auth.Authenticator;
import com.codeheadsystems.gitgate.springboot.config.GitGateProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class GitGateSecurityConfig {

  @Bean
  public TokenAuthenticationFilter tokenAuthenticationFilter(Authenticator authenticator) {
    return new TokenAuthenticationFilter(authenticator);
  }

  /**
   * Keeps the servlet container from running the filter outside the security chain.
   */
  @Bean
  public FilterRegistrationBean<TokenAuthenticationFilter> tokenAuthenticationFilterRegistration(
      TokenAuthenticationFilter filter) {
    FilterRegistrationBean<TokenAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 GitGateProperties props,
                                                 TokenAuthenticationFilter tokenFilter) throws Exception {
    String[] permitAll = props.getPermitAllPaths().toArray(String[]::new);
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> {
          if (permitAll.length > 0) {
            auth.requestMatchers(permitAll).permitAll();
          }
          auth.anyRequest().authenticated();
        })
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(tokenFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
