package com.pgoutbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OutboxCdcApplication {

    public static void main(String[] args) {
        SpringApplication.run(OutboxCdcApplication.class, args);
    }
}
