package com.coursemapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseMapperApplication {
    public static void main(String[] args) {
        SpringApplication.run(CourseMapperApplication.class, args);
    }
}
