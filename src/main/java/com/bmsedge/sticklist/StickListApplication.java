package com.bmsedge.sticklist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StickListApplication {

    public static void main(String[] args) {
        SpringApplication.run(StickListApplication.class, args);
    }
}
