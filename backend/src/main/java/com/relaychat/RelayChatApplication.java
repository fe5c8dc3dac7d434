package com.relaychat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RelayChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayChatApplication.class, args);
    }
}
