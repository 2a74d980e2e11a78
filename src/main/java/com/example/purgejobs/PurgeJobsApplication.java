package com.example.purgejobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PurgeJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PurgeJobsApplication.class, args);
    }
}
