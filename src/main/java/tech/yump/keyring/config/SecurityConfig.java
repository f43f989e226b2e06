package tech.yump.keyring.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.keyring.audit.AuditBackend;
import tech.yump.keyring.auth.StaticTokenAuthFilter;

import java.time.Clock;
import java.util.Collections;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  public static final String KEY_ADMIN_AUTHORITY = StaticTokenAuthFilter.POLICY_AUTHORITY_PREFIX + "key-admin";
  public static final String TOKEN_ISSUER_AUTHORITY = StaticTokenAuthFilter.POLICY_AUTHORITY_PREFIX + "token-issuer";

  private final KeyringProperties keyringProperties;
  private final AuditBackend auditBackend;
  private final Clock clock;

  @Bean
  public StaticTokenAuthFilter staticTokenAuthFilter() {
    KeyringProperties.AuthProperties authProps = keyringProperties.auth();
    KeyringProperties.AuthProperties.StaticTokenAuthProperties staticTokenProps = (authProps != null) ? authProps.staticTokens() : null;

    if (staticTokenProps == null || !staticTokenProps.enabled()) {
      log.debug("Static token authentication disabled. Creating pass-through StaticTokenAuthFilter.");
      staticTokenProps = new KeyringProperties.AuthProperties.StaticTokenAuthProperties(false, Collections.emptyList());
    }
    return new StaticTokenAuthFilter(staticTokenProps, auditBackend, clock);
  }

  // Runs inside the security filter chain only, not as a standalone servlet filter.
  @Bean
  public FilterRegistrationBean<StaticTokenAuthFilter> staticTokenAuthFilterRegistration(StaticTokenAuthFilter filter) {
    FilterRegistrationBean<StaticTokenAuthFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

    KeyringProperties.AuthProperties authProps = keyringProperties.auth();
    boolean staticAuthEnabled = authProps != null
            && authProps.staticTokens() != null
            && authProps.staticTokens().enabled();

    if (staticAuthEnabled) {
      log.info("Configuring Spring Security for static token authentication.");
      http
              .addFilterBefore(staticTokenAuthFilter(), UsernamePasswordAuthenticationFilter.class)
              .authorizeHttpRequests(authz -> authz
                      .requestMatchers(HttpMethod.GET, "/", "/.well-known/jwks.json").permitAll()
                      .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                      .requestMatchers("/v1/keys/**").hasAuthority(KEY_ADMIN_AUTHORITY)
                      .requestMatchers("/v1/tokens/**").hasAnyAuthority(TOKEN_ISSUER_AUTHORITY, KEY_ADMIN_AUTHORITY)
                      .anyRequest().authenticated()
              );
    } else {
      log.warn("Keyring static token authentication is disabled via configuration (keyring.auth.static-tokens.enabled=false). All API endpoints, including forced rotation, are accessible without authentication. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }
}
