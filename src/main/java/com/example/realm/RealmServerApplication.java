package com.example.realm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RealmServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(RealmServerApplication.class, args);
    }
}
