package com.bbms.authbroker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuthBrokerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthBrokerApplication.class, args);
    }
}
