package tech.yump.keyring.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.keyring.audit.AuditBackend;
import tech.yump.keyring.audit.AuditEvent;
import tech.yump.keyring.config.KeyringProperties;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates requests carrying a configured static token in the {@value #KEYRING_TOKEN_HEADER}
 * header. The token's policy names become {@code POLICY_<name>} authorities, which
 * {@code SecurityConfig} matches against the URL rules. Unknown tokens are audited and the
 * request continues unauthenticated.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String KEYRING_TOKEN_HEADER = "X-Keyring-Token";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";
  public static final String POLICY_AUTHORITY_PREFIX = "POLICY_";

  private static final List<String> PUBLIC_PATHS = List.of("/", "/.well-known/jwks.json");

  private final boolean staticAuthEnabled;
  private final List<KeyringProperties.AuthProperties.StaticTokenPolicyMapping> tokenMappings;
  private final AuditBackend auditBackend;
  private final Clock clock;

  public StaticTokenAuthFilter(
          @Nullable KeyringProperties.AuthProperties.StaticTokenAuthProperties staticTokenProps,
          AuditBackend auditBackend,
          Clock clock
  ) {
    this.staticAuthEnabled = Optional.ofNullable(staticTokenProps)
            .map(KeyringProperties.AuthProperties.StaticTokenAuthProperties::enabled)
            .orElse(false);
    this.tokenMappings = Optional.ofNullable(staticTokenProps)
            .map(KeyringProperties.AuthProperties.StaticTokenAuthProperties::mappings)
            .orElse(Collections.emptyList());
    this.auditBackend = auditBackend;
    this.clock = clock;

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Mappings count: {}",
            this.staticAuthEnabled, this.tokenMappings.size());
    if (this.staticAuthEnabled && this.tokenMappings.isEmpty()) {
      log.warn("Static token authentication is enabled but no token mappings are configured!");
    }
  }

  /**
   * Builds the same kind of {@link Authentication} the filter produces, for tests and tooling.
   */
  public static Authentication createAuthenticationToken(String token, List<String> policyNames) {
    if (token == null || policyNames == null) {
      throw new IllegalArgumentException("Token and policy names are required to build an authentication.");
    }
    return new UsernamePasswordAuthenticationToken(token, null, toAuthorities(policyNames));
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      final String tokenHeader = request.getHeader(KEYRING_TOKEN_HEADER);

      if (!StringUtils.hasText(tokenHeader) || SecurityContextHolder.getContext().getAuthentication() != null) {
        log.trace("No {} header found or authentication already present for {}. Proceeding.",
                KEYRING_TOKEN_HEADER, request.getRequestURI());
        filterChain.doFilter(request, response);
        return;
      }

      final String providedToken = tokenHeader.trim();
      Optional<KeyringProperties.AuthProperties.StaticTokenPolicyMapping> mappingOptional = tokenMappings.stream()
              .filter(mapping -> providedToken.equals(mapping.token()))
              .findFirst();

      if (mappingOptional.isPresent()) {
        KeyringProperties.AuthProperties.StaticTokenPolicyMapping mapping = mappingOptional.get();
        List<String> policyNames = List.copyOf(mapping.policyNames());

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                mapping.token(), null, toAuthorities(policyNames));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated request to {} with static token. Policies: {}", request.getRequestURI(), policyNames);

        logAuditEvent("success", authentication, request, Map.of("policies", policyNames));
      } else {
        log.warn("Invalid or unknown static token received for URI: {}", request.getRequestURI());
        // The request continues unauthenticated; the authorization rules deny it later.
        logAuditEvent("failure", null, request, Map.of("reason", "invalid_token"));
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    if (!staticAuthEnabled) {
      log.trace("Skipping filter as static auth is disabled.");
      return true;
    }
    String path = request.getRequestURI();
    if (PUBLIC_PATHS.contains(path)) {
      log.trace("Path {} is public, skipping StaticTokenAuthFilter.", path);
      return true;
    }
    return false;
  }

  private static List<GrantedAuthority> toAuthorities(List<String> policyNames) {
    return policyNames.stream()
            .map(policyName -> (GrantedAuthority) new SimpleGrantedAuthority(POLICY_AUTHORITY_PREFIX + policyName))
            .toList();
  }

  private void logAuditEvent(String outcome, @Nullable Authentication auth, HttpServletRequest request, Map<String, Object> data) {
    try {
      AuditEvent.AuthInfo.AuthInfoBuilder authInfoBuilder = AuditEvent.AuthInfo.builder()
              .sourceAddress(request.getRemoteAddr());
      if (auth != null && auth.isAuthenticated()) {
        // The principal is the token itself; only a masked form is audited.
        authInfoBuilder.principal(maskToken(auth.getName()));
        authInfoBuilder.metadata(Map.of("policies", data.getOrDefault("policies", List.of())));
      }

      AuditEvent.RequestInfo requestInfo = AuditEvent.RequestInfo.builder()
              .requestId((String) request.getAttribute(REQUEST_ID_ATTR))
              .httpMethod(request.getMethod())
              .path(request.getRequestURI())
              .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
              .build();

      auditBackend.logEvent(AuditEvent.builder()
              .timestamp(clock.instant())
              .type("auth")
              .action("token_validation")
              .outcome(outcome)
              .authInfo(authInfoBuilder.build())
              .requestInfo(requestInfo)
              .data(data)
              .build());
    } catch (Exception e) {
      log.error("Failed to log audit event in StaticTokenAuthFilter: {}", e.getMessage(), e);
    }
  }

  public static String maskToken(String token) {
    if (token == null || token.length() <= 4) {
      return "****";
    }
    return token.substring(0, 4) + "****";
  }
}
