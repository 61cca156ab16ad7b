package com.eon.credit.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String CALLER_SCHEME = "caller";

    @Bean
    public OpenAPI creditLedgerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("EON Credit Ledger API")
                        .description("Credit scores, collateralized loans, liquidations and the loss-absorption fund.")
                        .version("v1"))
                .components(new Components().addSecuritySchemes(CALLER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name("X-Caller")
                        .description("Principal the call is made on behalf of")))
                .addSecurityItem(new SecurityRequirement().addList(CALLER_SCHEME));
    }
}
