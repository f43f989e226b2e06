package tech.yump.keyring.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.keyring.auth.StaticTokenAuthFilter;

@Configuration
public class OpenApiConfig {

    private static final String API_KEY_HEADER_NAME = StaticTokenAuthFilter.KEYRING_TOKEN_HEADER;
    static final String SECURITY_SCHEME_NAME = "KeyringTokenAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .name(API_KEY_HEADER_NAME)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Static API token ('" + API_KEY_HEADER_NAME + "') required for token signing, validation and key administration.");

        // Public endpoints opt out with @Operation(security = {}).
        return new OpenAPI()
                .info(new Info()
                        .title("LiteKeyring API")
                        .description("Rotating JWT signing keys with overlap windows and JWKS publication."))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME, apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
