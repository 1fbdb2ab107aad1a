package com.example.datadestruction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DataDestructionApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataDestructionApplication.class, args);
    }
}
