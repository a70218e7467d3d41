package com.cohortaccel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CohortAcceleratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CohortAcceleratorApplication.class, args);
    }
}
