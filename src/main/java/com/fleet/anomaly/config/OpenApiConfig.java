package com.fleet.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI vehicleAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Vehicle Telemetry Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Real-time anomaly detection for decoded vehicle telemetry.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Receive a decoded message via `POST /telemetry`\n" +
                                "2. Update the vehicle's state and fetch its previous snapshot of the same type\n" +
                                "3. Feed the Isolation Forest collector; once trained, score the message\n" +
                                "4. Evaluate temporal, geography and absolute signal rules\n" +
                                "5. Forward every anomaly to the configured sinks\n\n" +
                                "**Message Types:** `EngineData`, `VehicleData`, `ClimateControl`\n\n" +
                                "**Geographies:** `rainy`, `mountainous`, `urban`, `highway`, `hot`, `snowy`")
                        .contact(new Contact().name("Fleet Telemetry Team")));
    }
}
