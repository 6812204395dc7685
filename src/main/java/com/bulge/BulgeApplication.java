package com.bulge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BulgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulgeApplication.class, args);
    }
}
