package com.commandcenter.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CommandCenterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommandCenterApplication.class, args);
    }
}
