package com.ownding.protect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProtectApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProtectApplication.class, args);
    }
}
