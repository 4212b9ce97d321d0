package com.medical.records;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthRecordApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthRecordApplication.class, args);
    }
}
