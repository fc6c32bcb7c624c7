package com.ainotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AINotes Server Application
 *
 * Reactive service that enriches a user's notes with AI-generated tags and
 * embeddings and answers related-note queries from the stored vectors.
 */
@SpringBootApplication
public class AiNotesApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiNotesApplication.class, args);
    }

}
