package io.timezz.backend.security;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.web.cors.CorsConfigurationSource;

/**
 * Permit-all filter chain for {@code timezz.security.mode=demo}. Every request runs as the demo
 * user resolved by {@link DemoIdentityProvider}.
 */
@Configuration
@EnableWebSecurity
@ConditionalOnProperty(name = "timezz.security.mode", havingValue = "demo")
public class DemoSecurityConfig {

  private final UserContextFilter userContextFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final CorsConfigurationSource corsConfigurationSource;

  public DemoSecurityConfig(
      UserContextFilter userContextFilter,
      RequestLoggingFilter requestLoggingFilter,
      @Qualifier("corsConfigurationSource") CorsConfigurationSource corsConfigurationSource) {
    this.userContextFilter = userContextFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.corsConfigurationSource = corsConfigurationSource;
  }

  @Bean
  public SecurityFilterChain demoSecurityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .addFilterAfter(userContextFilter, AnonymousAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, UserContextFilter.class);

    return http.build();
  }
}
