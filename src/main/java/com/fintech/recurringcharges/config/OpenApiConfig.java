package com.fintech.recurringcharges.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI recurringChargeDetectionOpenAPI(@Value("${spring.application.name}") String applicationName) {
        return new OpenAPI()
                .info(new Info()
                        .title("Recurring Charge Detection Service API")
                        .description("Detects recurring charges (subscriptions, bills, salaries) in a user's "
                                + "transaction history and turns them into matching criteria. Detected patterns "
                                + "stay inert until a reviewer confirms and activates them; every review call "
                                + "carries the status the reviewer last saw and is refused with 409 if it changed.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name(applicationName)
                                .email("fintech@example.com")))
                .tags(List.of(new Tag()
                        .name("Recurring Charges")
                        .description("Detection, criteria validation, review lifecycle and predictions")));
    }
}
