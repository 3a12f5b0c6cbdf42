package com.assethealth.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI abnormalityScoringOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Abnormality Scoring API")
                        .version("1.0.0")
                        .description(
                                "Per-timestamp abnormality scoring for multivariate process time series.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Upload a CSV via `POST /analyses` (a `Time` column plus numeric sensor columns)\n" +
                                "2. Validate, fill gaps, split into training and analysis windows\n" +
                                "3. Fit an Isolation Forest on the training window (the period of normal operation)\n" +
                                "4. Score every analysis row and attribute the score to the features by perturbation\n" +
                                "5. Map raw scores to **0-100** and list the top 7 contributing features per row\n\n" +
                                "**Score bands:** normal (0-10), slight (11-30), moderate (31-60), " +
                                "significant (61-90), severe (91-100)\n\n" +
                                "The training window is checked after scoring: a mean of 10 or more, or a max of 25 or more, " +
                                "adds a `TRAINING_ANOMALY` warning to the report.")
                        .contact(new Contact().name("Asset Health Analytics")));
    }
}
