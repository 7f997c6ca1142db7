package com.kaspagateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KaspaGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(KaspaGatewayApplication.class, args);
    }
}
