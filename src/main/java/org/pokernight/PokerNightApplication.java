package org.pokernight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PokerNightApplication {
    public static void main(String[] args) {
        SpringApplication.run(PokerNightApplication.class, args);
    }
}
