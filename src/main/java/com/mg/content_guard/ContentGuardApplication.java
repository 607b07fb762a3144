package com.mg.content_guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContentGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentGuardApplication.class, args);
    }
}
