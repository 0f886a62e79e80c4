package com.company.slr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SlrServiceApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SlrServiceApplication.class);
        application.setDefaultProperties(RunMode.fromArgs(args).defaultProperties());
        application.run(args);
    }
}
