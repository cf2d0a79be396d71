package com.example.imagebot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ImageBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageBotApplication.class, args);
    }
}
