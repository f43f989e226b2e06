package tech.yump.keyring.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.keyring.jwks.JwksExporter;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "JWKS", description = "Public verification keys")
public class WellKnownController {

  private final JwksExporter jwksExporter;

  @GetMapping(value = "/.well-known/jwks.json", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
          summary = "Get JWKS",
          description = "Public keys of every signing key whose tokens are currently accepted: the active key and retiring keys inside their overlap window. Does not require authentication.",
          security = {}
  )
  @ApiResponses(value = {
          @ApiResponse(responseCode = "200", description = "JWK Set.",
                  content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                          schema = @Schema(type = "object", example = "{\"keys\": [{\"kty\": \"RSA\", \"use\": \"sig\", \"alg\": \"RS256\", \"kid\": \"...\", \"e\": \"AQAB\", \"n\": \"...\"}]}"))),
          @ApiResponse(responseCode = "503", description = "Key ring not bootstrapped yet.",
                  content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<Map<String, Object>> getJsonWebKeySet() {
    Map<String, Object> jwks = jwksExporter.export();
    log.debug("Served JWKS request.");
    return ResponseEntity.ok(jwks);
  }
}
