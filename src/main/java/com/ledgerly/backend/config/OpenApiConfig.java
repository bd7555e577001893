package com.ledgerly.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI ledgerlyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ledgerly API")
                        .description("Personal finance assistant: chat analytics, transaction categorization and ledger summaries.")
                        .version("v1")
                        .contact(new Contact()
                                .name("Ledgerly")
                                .email("support@ledgerly.app")
                        )
                )
                .addTagsItem(new Tag().name("Chatbot").description("Conversational analytics"))
                .addTagsItem(new Tag().name("Classification").description("Transaction categorization"))
                .addTagsItem(new Tag().name("Ledger").description("Balances, breakdowns and transactions"));
    }
}
