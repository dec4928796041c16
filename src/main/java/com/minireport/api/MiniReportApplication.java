package com.minireport.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.minireport")
@ConfigurationPropertiesScan(basePackages = "com.minireport")
public class MiniReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiniReportApplication.class, args);
    }
}
