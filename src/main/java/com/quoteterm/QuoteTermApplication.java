package com.quoteterm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QuoteTermApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuoteTermApplication.class, args);
    }
}
