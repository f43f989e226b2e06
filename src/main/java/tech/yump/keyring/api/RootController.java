package tech.yump.keyring.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.keyring.keys.SigningKeyStore;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information and status endpoints")
public class RootController {

  private final SigningKeyStore keyStore;

  public RootController(SigningKeyStore keyStore) {
    this.keyStore = keyStore;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Welcome message and a coarse readiness flag. Does not require authentication.",
          security = {}
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Welcome to LiteKeyring API\", \"status\": \"OK\", \"signingReady\": true}")))
  public Map<String, Object> getRoot() {
    boolean ready = keyStore.isBootstrapped();
    return Map.of(
            "message", "Welcome to LiteKeyring API",
            "status", ready ? "OK" : "STARTING",
            "signingReady", ready);
  }
}
