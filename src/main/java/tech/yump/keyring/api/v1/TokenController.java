package tech.yump.keyring.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.keyring.audit.AuditHelper;
import tech.yump.keyring.token.TokenIssuer;
import tech.yump.keyring.token.TokenValidator;
import tech.yump.keyring.token.ValidationResult;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/v1/tokens")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tokens", description = "Sign tokens with the active key and validate tokens against all eligible keys")
public class TokenController {

    private final TokenIssuer tokenIssuer;
    private final TokenValidator tokenValidator;
    private final AuditHelper auditHelper;

    @Schema(description = "Claims to sign and an optional lifetime.")
    public record SignRequest(
            @Schema(description = "Claims for the token payload. 'iat' and 'exp' are always set by the service.",
                    example = "{\"sub\": \"user123\", \"aud\": \"my-api\"}")
            Map<String, Object> claims,
            @Schema(description = "ISO-8601 token lifetime; the configured default is used when absent.", example = "PT15M")
            Duration lifetime
    ) {}

    @Schema(description = "Response containing the signed JSON Web Token.")
    public record SignResponse(
            @Schema(description = "The signed JWT.", example = "eyJraWQiOiIuLi4iLCJhbGciOiJSUzI1NiJ9...")
            String token
    ) {}

    @Schema(description = "Token to validate.")
    public record ValidateRequest(
            @NotBlank(message = "token must not be blank")
            String token,
            @Schema(description = "Whether 'exp' and 'nbf' are enforced. Defaults to true.")
            Boolean checkExpiry
    ) {}

    @PostMapping("/sign")
    @Operation(summary = "Sign token", description = "Signs the given claims with the current active key. The key id is placed in the 'kid' header.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Token signed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SignResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid claims or non-positive lifetime.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Permission denied.", content = @Content),
            @ApiResponse(responseCode = "503", description = "Key ring not bootstrapped yet.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<SignResponse> sign(@RequestBody SignRequest request) {
        Map<String, Object> claims = request.claims() != null ? request.claims() : Map.of();
        String token = request.lifetime() != null
                ? tokenIssuer.issue(claims, request.lifetime())
                : tokenIssuer.issue(claims);
        log.info("Controller: Signed token with {} caller claim(s).", claims.size());
        auditHelper.logHttpEvent("token_operation", "sign", "success", HttpStatus.OK.value(), null,
                Map.of("claim_names", claims.keySet().stream().sorted().toList()));
        return ResponseEntity.ok(new SignResponse(token));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate token",
            description = "Verifies the token against the active key and every retiring key inside its overlap window. Invalid tokens are reported in the body, not as errors.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Validation performed; see 'valid' and 'outcome'.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ValidationResult.class))),
            @ApiResponse(responseCode = "400", description = "Missing token.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Permission denied.", content = @Content)
    })
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidateRequest request) {
        boolean checkExpiry = request.checkExpiry() == null || request.checkExpiry();
        ValidationResult result = tokenValidator.validate(request.token(), checkExpiry);
        log.debug("Controller: Token validation outcome {}", result.outcome());
        return ResponseEntity.ok(result);
    }
}
