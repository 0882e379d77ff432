package com.medwatch.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI medWatchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MedWatch Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection for medicine supply data.\n\n" +
                                "**Pipeline (every processing interval):**\n" +
                                "1. Fetch pending medicine records posted via `POST /medicines`\n" +
                                "2. Clean them and derive decline rate, days of cover and projected stockout date\n" +
                                "3. Evaluate supply rules and score the batch with the Isolation Forest\n" +
                                "4. Normalize every finding into an anomaly, persist it, alert when confidence >= alert threshold\n\n" +
                                "**Rule Types:**\n" +
                                "- `LOW_STOCK`: stock below the medicine's critical threshold\n" +
                                "- `DAYS_OF_COVER`: stock runs out within N days\n" +
                                "- `PRICE_SPIKE`: price far above the market average\n" +
                                "- `SUPPLIER_DELAY`: supplier late beyond N days\n" +
                                "- `RAPID_DEPLETION`: stock falling much faster than usual consumption\n\n" +
                                "Rule findings carry confidence 1.0 (critical) or 0.8; model findings carry the IF score.")
                        .contact(new Contact().name("MedWatch Team")));
    }
}
