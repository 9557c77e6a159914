package com.pharmacy.fraud.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudRankingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pharmacy Fraud Risk Ranking API")
                        .version("1.0.0")
                        .description(
                                "Ranks pharmacies by fraud risk from the output of several independent detectors.\n\n" +
                                "**Ranking Pipeline:**\n" +
                                "1. Receive a claims snapshot via `POST /api/v1/rankings/run`\n" +
                                "2. Run every registered detector in parallel, each under its own timeout\n" +
                                "3. Combine detector scores per pharmacy with the configured weights\n" +
                                "4. Add detector agreement (consistency) and population outlier scores\n" +
                                "5. Classify: **HIGH** (>=0.8), **MEDIUM** (>=0.6), **LOW** (>=0.4), **VERY_LOW** (<0.4)\n" +
                                "6. Rank by final score and summarize detector behavior\n\n" +
                                "Pre-computed detector output can be scored with `POST /api/v1/rankings/aggregate`.\n" +
                                "A failed or timed-out detector is reported in the run summary and never aborts a run.")
                        .contact(new Contact().name("Fraud Analytics Team")));
    }
}
