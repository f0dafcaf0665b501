package com.assetdesk.allocation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI assetAllocationOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Asset Allocation API")
                .description("Administration API for devices and license pools: assignment and return "
                    + "of resources to employees, expiry alerts, and the request/approval workflow.")
                .version("1.0.0"));
    }
}
