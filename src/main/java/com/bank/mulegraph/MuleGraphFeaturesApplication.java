package com.bank.mulegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MuleGraphFeaturesApplication {

    public static void main(String[] args) {
        SpringApplication.run(MuleGraphFeaturesApplication.class, args);
    }
}
