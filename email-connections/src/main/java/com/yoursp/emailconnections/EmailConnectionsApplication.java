package com.yoursp.emailconnections;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmailConnectionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailConnectionsApplication.class, args);
    }
}
