package com.example.librarysync.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.catalog")
public class AppCatalogProperties {

    private String baseUrl = "http://localhost:9090/catalog/v1";

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 15000;

    private int maxConnections = 20;
}
