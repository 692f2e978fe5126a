package com.flagship.donation_pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DonationPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DonationPipelineApplication.class, args);
    }
}
