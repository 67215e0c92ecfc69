package com.keer.studiosync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StudioSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudioSyncApplication.class, args);
    }

}
