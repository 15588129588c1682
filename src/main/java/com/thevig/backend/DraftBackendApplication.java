package com.thevig.backend;

import com.thevig.backend.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class DraftBackendApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DraftBackendApplication.class);
        app.run(args);
    }
}
