/*
 * どこで: Notification セキュリティ設定
 * 何を: Bearer トークン必須の読み取り API と、公開する status/health/WebSocket の境界を定義する
 * なぜ: 通知の閲覧と既読化を、検証済みの本人に限定するため
 */
package io.eventboard.notification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventboard.notification.api.ApiErrorCode;
import io.eventboard.notification.auth.TokenVerifier;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableConfigurationProperties({
  NotificationCorsProperties.class,
  NotificationWebSocketProperties.class
})
public class NotificationSecurityConfig {

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(
      TokenVerifier tokenVerifier,
      ObjectMapper objectMapper,
      NotificationWebSocketProperties webSocketProperties) {
    return new BearerTokenAuthenticationFilter(
        tokenVerifier, objectMapper, webSocketProperties.path());
  }

  // Security チェーン内でのみ動かす。サーブレットフィルタとしての自動登録は止める
  @Bean
  FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenFilterRegistration(
      BearerTokenAuthenticationFilter filter) {
    final FilterRegistrationBean<BearerTokenAuthenticationFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource(NotificationCorsProperties properties) {
    final CorsConfiguration configuration = new CorsConfiguration();
    configuration.setAllowedOriginPatterns(properties.allowedOrigins());
    configuration.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
    configuration.setAllowedHeaders(List.of("*"));
    configuration.setAllowCredentials(true);
    final UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", configuration);
    return source;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      NotificationWebSocketProperties webSocketProperties)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .cors(Customizer.withDefaults())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(
            exceptions ->
                exceptions.authenticationEntryPoint(
                    (request, response, ex) ->
                        bearerTokenAuthenticationFilter.writeError(
                            response,
                            HttpStatus.UNAUTHORIZED,
                            ApiErrorCode.UNAUTHORIZED,
                            "bearer token is required")))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus",
                        webSocketProperties.path())
                    .permitAll()
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
