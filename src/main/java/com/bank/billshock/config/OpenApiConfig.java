package com.bank.billshock.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI billShockDetectorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bill Shock Detector API")
                        .version("1.0.0")
                        .description(
                                "Flags unusually large transactions (bill shocks) using an Isolation Forest " +
                                "fitted on historical transaction amounts.\n\n" +
                                "**Training:**\n" +
                                "1. `POST /api/v1/models/train` reads a CSV with an `amount` column\n" +
                                "2. Rows with a missing amount are dropped\n" +
                                "3. 100 isolation trees are built over sub-samples of up to 256 amounts\n" +
                                "4. The score threshold is chosen so the top `contamination` fraction of the " +
                                "training data is flagged (contamination 0.01-0.5, default 0.05)\n" +
                                "5. The model is written to the configured model path\n\n" +
                                "**Detection:**\n" +
                                "- `POST /api/v1/detections` scores JSON rows\n" +
                                "- `POST /api/v1/detections/upload` scores an uploaded CSV\n" +
                                "- `POST /api/v1/detections/export` returns the flagged rows as CSV\n\n" +
                                "Only rows labelled **Bill Shock** are returned, in input order, with every " +
                                "original column plus an `Anomaly` label column.")
                        .contact(new Contact().name("Bill Shock Detector Team")));
    }
}
