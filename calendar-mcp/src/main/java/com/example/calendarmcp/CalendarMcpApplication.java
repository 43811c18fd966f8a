package com.example.calendarmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalendarMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalendarMcpApplication.class, args);
    }
}
