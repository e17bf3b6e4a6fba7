package io.timezz.backend.security;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfigurationSource;

/**
 * Filter chain for {@code timezz.security.mode=jwt}: every {@code /api/v1/**} request except login
 * needs a session token issued by {@link SessionTokenService}.
 */
@Configuration
@EnableWebSecurity
@ConditionalOnProperty(name = "timezz.security.mode", havingValue = "jwt", matchIfMissing = true)
public class SecurityConfig {

  private final UserContextFilter userContextFilter;
  private final RequestLoggingFilter requestLoggingFilter;
  private final LoggingAuthenticationEntryPoint authenticationEntryPoint;
  private final CorsConfigurationSource corsConfigurationSource;

  public SecurityConfig(
      UserContextFilter userContextFilter,
      RequestLoggingFilter requestLoggingFilter,
      LoggingAuthenticationEntryPoint authenticationEntryPoint,
      @Qualifier("corsConfigurationSource") CorsConfigurationSource corsConfigurationSource) {
    this.userContextFilter = userContextFilter;
    this.requestLoggingFilter = requestLoggingFilter;
    this.authenticationEntryPoint = authenticationEntryPoint;
    this.corsConfigurationSource = corsConfigurationSource;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.cors(cors -> cors.configurationSource(corsConfigurationSource))
        .csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/**")
                    .permitAll()
                    .requestMatchers("/api/v1/auth/**")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 -> oauth2.jwt(jwt -> {}).authenticationEntryPoint(authenticationEntryPoint))
        .addFilterAfter(userContextFilter, BearerTokenAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, UserContextFilter.class);

    return http.build();
  }

  @Bean
  JwtDecoder jwtDecoder(SessionTokenService sessionTokenService) {
    var decoder =
        NimbusJwtDecoder.withSecretKey(sessionTokenService.secretKey())
            .macAlgorithm(MacAlgorithm.HS256)
            .build();
    decoder.setJwtValidator(JwtValidators.createDefaultWithIssuer(sessionTokenService.issuer()));
    return decoder;
  }
}
