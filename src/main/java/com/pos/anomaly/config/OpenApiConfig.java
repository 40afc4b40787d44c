package com.pos.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI shiftAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shift Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Flags point-of-sale shifts whose sales fall abnormally below the store's own " +
                                "history for the same weekday and time slot.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Tag each shift with its cohort (`Mon-AM` ... `Sun-PM`, UTC+8 local time)\n" +
                                "2. Split the window: the last 7 days are classified, the rest builds baselines\n" +
                                "3. Compute mean and sample standard deviation per store cohort\n" +
                                "4. Flag a shift when sales < mean - 1.8 x std (statistical) or < 60% of mean (hard rule)\n" +
                                "5. Raise an alert for 3 or more consecutive flagged shifts in a store\n\n" +
                                "**Entry Points:**\n" +
                                "- `POST /analysis` analyses rows supplied in the request body\n" +
                                "- `POST /shifts` stores rows for the daily scheduled run\n" +
                                "- `GET /analysis/latest` returns the last scheduled report")
                        .contact(new Contact().name("Store Operations Analytics")));
    }
}
