package com.practicum.homeworkbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HomeworkBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(HomeworkBotApplication.class, args);
    }
}
