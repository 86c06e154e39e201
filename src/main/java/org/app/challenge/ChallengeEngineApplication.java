package org.app.challenge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChallengeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChallengeEngineApplication.class, args);
    }
}
