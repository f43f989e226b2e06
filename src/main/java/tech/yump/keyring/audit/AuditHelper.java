package tech.yump.keyring.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.keyring.auth.StaticTokenAuthFilter;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link AuditEvent}s from the current request and security context and hands them
 * to the configured {@link AuditBackend}. Audit failures are logged and never propagated.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    private static final String POLICY_PREFIX = "POLICY_";

    private final AuditBackend auditBackend;
    private final Clock clock;

    /**
     * Logs the outcome of an HTTP request. Request and authentication details are picked up
     * from the current thread when available.
     *
     * @param type         The type of event (e.g., "token_operation", "key_admin").
     * @param action       The specific action performed (e.g., "sign", "rotate").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code returned.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        AuditEvent.AuthInfo authInfo = buildAuthInfo(authentication, request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an event raised outside the request/response cycle, such as a scheduled rotation.
     *
     * @param principal Optional principal; falls back to the security context, then "system".
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        boolean authenticated = authentication != null && authentication.isAuthenticated();
        String effectivePrincipal = Optional.ofNullable(principal)
                .orElseGet(() -> authenticated ? StaticTokenAuthFilter.maskToken(authentication.getName()) : "system");

        AuditEvent.AuthInfo.AuthInfoBuilder authInfoBuilder = AuditEvent.AuthInfo.builder()
                .principal(effectivePrincipal);
        if (authenticated) {
            extractAndAddPolicies(authentication, authInfoBuilder);
        }

        logEventInternal(type, action, outcome, authInfoBuilder.build(), null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(clock.instant())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable Authentication authentication, @Nullable HttpServletRequest request) {
        AuditEvent.AuthInfo.AuthInfoBuilder builder = AuditEvent.AuthInfo.builder()
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown");

        if (authentication != null && authentication.isAuthenticated()
                && !"anonymousUser".equals(authentication.getPrincipal())) {
            builder.principal(StaticTokenAuthFilter.maskToken(authentication.getName()));
            extractAndAddPolicies(authentication, builder);
        } else {
            builder.principal("anonymous");
        }
        return builder.build();
    }

    private void extractAndAddPolicies(Authentication authentication, AuditEvent.AuthInfo.AuthInfoBuilder builder) {
        List<String> policyNames = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(a -> a.startsWith(POLICY_PREFIX))
                .map(a -> a.substring(POLICY_PREFIX.length()))
                .toList();
        if (!policyNames.isEmpty()) {
            builder.metadata(Map.of("policies", policyNames));
        }
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
