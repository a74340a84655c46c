package com.studystats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudyStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyStatsApplication.class, args);
    }
}
