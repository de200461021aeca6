package com.cardtoken;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Card Token service.
 *
 * Validates gateway-issued card tokens and their expiration and brand metadata
 * before a gateway client builds a payment request from them.
 */
@SpringBootApplication
public class CardTokenApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardTokenApplication.class, args);
    }
}
