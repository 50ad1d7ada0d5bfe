package com.example.vidqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VidqueueApplication {
    public static void main(String[] args) {
        SpringApplication.run(VidqueueApplication.class, args);
    }
}
