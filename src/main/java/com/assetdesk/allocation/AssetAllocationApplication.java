package com.assetdesk.allocation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetAllocationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetAllocationApplication.class, args);
    }
}
