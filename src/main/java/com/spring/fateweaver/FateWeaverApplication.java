package com.spring.fateweaver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FateWeaverApplication {

    public static void main(String[] args) {
        SpringApplication.run(FateWeaverApplication.class, args);
    }
}
