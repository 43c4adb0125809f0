package com.ai.trainingstudio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Training Studio Application
 * Local session host that drives the training document-generation service
 * on behalf of a single user.
 */
@SpringBootApplication
public class TrainingStudioApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrainingStudioApplication.class, args);
    }
}
