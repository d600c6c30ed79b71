package com.example.autocount;

import com.example.autocount.config.VisualSearchProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Auto-Count Symbol Search API",
                version = "1.0",
                description = "REST API for locating and counting symbol occurrences on rasterized drawing pages.",
                contact = @Contact(name = "Auto-Count")))
@SpringBootApplication
@EnableConfigurationProperties(VisualSearchProperties.class)
public class AutoCountApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoCountApplication.class, args);
    }
}
