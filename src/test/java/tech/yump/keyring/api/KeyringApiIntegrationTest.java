package tech.yump.keyring.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import tech.yump.keyring.auth.StaticTokenAuthFilter;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Integration Test: Keyring HTTP API")
class KeyringApiIntegrationTest {

    private static final String TOKEN_HEADER = StaticTokenAuthFilter.KEYRING_TOKEN_HEADER;
    private static final String ADMIN_TOKEN = "test-admin-token";
    private static final String ISSUER_TOKEN = "test-issuer-token";
    private static final String NO_POLICY_TOKEN = "test-no-policy-token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String sign(Map<String, Object> body) throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/tokens/sign")
                        .header(TOKEN_HEADER, ISSUER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("token").asText();
    }

    private JsonNode validate(String token) throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/tokens/validate")
                        .header(TOKEN_HEADER, ISSUER_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("token", token))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String activeKeyId() throws Exception {
        MvcResult result = mockMvc.perform(get("/v1/keys/health").header(TOKEN_HEADER, ADMIN_TOKEN))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).at("/health/activeKeyId").asText();
    }

    @Nested
    @DisplayName("Public endpoints")
    class PublicEndpoints {

        @Test
        @DisplayName("GET /: Should report readiness without authentication")
        void root() throws Exception {
            mockMvc.perform(get("/"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Welcome to LiteKeyring API"))
                    .andExpect(jsonPath("$.signingReady").value(true));
        }

        @Test
        @DisplayName("GET /.well-known/jwks.json: Should publish public keys without authentication")
        void jwks() throws Exception {
            mockMvc.perform(get("/.well-known/jwks.json"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.keys", hasSize(greaterThanOrEqualTo(1))))
                    .andExpect(jsonPath("$.keys[0].kty").value("EC"))
                    .andExpect(jsonPath("$.keys[0].use").value("sig"))
                    .andExpect(jsonPath("$.keys[0].alg").value("ES256"))
                    .andExpect(jsonPath("$.keys[0].d").doesNotExist());
        }

        @Test
        @DisplayName("GET /v3/api-docs: Should describe the token header security scheme")
        void apiDocs() throws Exception {
            mockMvc.perform(get("/v3/api-docs"))
                    .andExpect(status().isOk())
                    .andExpect(content -> assertThat(content.getResponse().getContentAsString())
                            .contains("KeyringTokenAuth")
                            .contains(TOKEN_HEADER));
        }
    }

    @Nested
    @DisplayName("Authorization")
    class Authorization {

        @Test
        @DisplayName("Should deny signing without a token")
        void sign_withoutToken() throws Exception {
            mockMvc.perform(post("/v1/tokens/sign").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Should deny signing with a token lacking the issuer policy")
        void sign_withoutPolicy() throws Exception {
            mockMvc.perform(post("/v1/tokens/sign")
                            .header(TOKEN_HEADER, NO_POLICY_TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Should deny forced rotation to a token issuer")
        void rotate_asIssuer() throws Exception {
            mockMvc.perform(post("/v1/keys/rotate").header(TOKEN_HEADER, ISSUER_TOKEN))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Should deny requests carrying an unknown token")
        void unknownToken() throws Exception {
            mockMvc.perform(get("/v1/keys/health").header(TOKEN_HEADER, "not-a-configured-token"))
                    .andExpect(status().isForbidden());
        }
    }

    @Nested
    @DisplayName("Token lifecycle")
    class TokenLifecycle {

        @Test
        @DisplayName("Should sign a token with the active key and validate it")
        void signThenValidate() throws Exception {
            String token = sign(Map.of("claims", Map.of("sub", "user-123", "aud", "my-api")));

            JsonNode result = validate(token);

            assertThat(result.get("valid").asBoolean()).isTrue();
            assertThat(result.get("outcome").asText()).isEqualTo("ACCEPTED");
            assertThat(result.get("keyId").asText()).isEqualTo(activeKeyId());
            assertThat(result.at("/claims/sub").asText()).isEqualTo("user-123");
            assertThat(result.at("/claims/iss").asText()).isEqualTo("lite-keyring-test");
        }

        @Test
        @DisplayName("Should keep validating tokens of the previous key after a forced rotation")
        void forcedRotationKeepsOldTokensValid() throws Exception {
            // Arrange
            String oldKid = activeKeyId();
            String oldToken = sign(Map.of("claims", Map.of("sub", "user-1")));

            // Act
            mockMvc.perform(post("/v1/keys/rotate").header(TOKEN_HEADER, ADMIN_TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.rotated").value(true))
                    .andExpect(jsonPath("$.previousKeyId").value(oldKid));

            // Assert
            String newKid = activeKeyId();
            assertThat(newKid).isNotEqualTo(oldKid);

            JsonNode oldResult = validate(oldToken);
            assertThat(oldResult.get("valid").asBoolean()).isTrue();
            assertThat(oldResult.get("keyId").asText()).isEqualTo(oldKid);

            JsonNode newResult = validate(sign(Map.of("claims", Map.of("sub", "user-2"))));
            assertThat(newResult.get("keyId").asText()).isEqualTo(newKid);

            mockMvc.perform(get("/.well-known/jwks.json"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.keys[0].kid").value(newKid))
                    .andExpect(content -> assertThat(content.getResponse().getContentAsString()).contains(oldKid));

            mockMvc.perform(get("/v1/keys/health").header(TOKEN_HEADER, ADMIN_TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.health.controllerState").value("IDLE"))
                    .andExpect(jsonPath("$.events['rotation.completed']").value(greaterThanOrEqualTo(1)));
        }

        @Test
        @DisplayName("Should report a forged token as invalid with 200")
        void validate_forgedToken() throws Exception {
            String[] parts = sign(Map.of("claims", Map.of("sub", "user-1"))).split("\\.");
            String forged = parts[0] + "." + parts[1] + "." + new StringBuilder(parts[2]).reverse();

            JsonNode result = validate(forged);

            assertThat(result.get("valid").asBoolean()).isFalse();
            assertThat(result.get("outcome").asText()).isIn("SIGNATURE_INVALID", "MALFORMED");
            assertThat(result.has("claims")).isFalse();
        }

        @Test
        @DisplayName("Should report an expired token when expiry is checked and accept it otherwise")
        void validate_expiredToken() throws Exception {
            String token = sign(Map.of("claims", Map.of("sub", "user-1"), "lifetime", "PT0.001S"));
            Thread.sleep(1100);

            assertThat(validate(token).get("outcome").asText()).isEqualTo("EXPIRED");

            mockMvc.perform(post("/v1/tokens/validate")
                            .header(TOKEN_HEADER, ISSUER_TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(Map.of("token", token, "checkExpiry", false))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.valid").value(true));
        }
    }

    @Nested
    @DisplayName("Error handling")
    class ErrorHandling {

        @Test
        @DisplayName("Should answer 400 for a malformed request body")
        void malformedJson() throws Exception {
            mockMvc.perform(post("/v1/tokens/sign")
                            .header(TOKEN_HEADER, ISSUER_TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"claims\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Malformed request body. Please check the JSON format."));
        }

        @Test
        @DisplayName("Should answer 400 for a non-positive lifetime")
        void negativeLifetime() throws Exception {
            mockMvc.perform(post("/v1/tokens/sign")
                            .header(TOKEN_HEADER, ISSUER_TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"claims\": {\"sub\": \"x\"}, \"lifetime\": \"PT-1M\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail", containsString("lifetime must be positive")));
        }

        @Test
        @DisplayName("Should answer 400 when the token to validate is blank")
        void blankToken() throws Exception {
            mockMvc.perform(post("/v1/tokens/validate")
                            .header(TOKEN_HEADER, ISSUER_TOKEN)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"token\": \"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail", containsString("token")));
        }
    }
}
