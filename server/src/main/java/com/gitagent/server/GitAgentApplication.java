package com.gitagent.server;

import com.gitagent.server.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class GitAgentApplication {

    private static final Logger log = LoggerFactory.getLogger(GitAgentApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GitAgentApplication.class, args);
    }

    /**
     * Select a working tree at startup when {@code gitagent.repository} is set, so the UI
     * can start polling without a set-repo round trip.
     *
     * To run:
     *   GEMINI_API_KEY=... mvn -pl server spring-boot:run -Dspring-boot.run.arguments=--gitagent.repository=/path/to/repo
     */
    @Bean
    CommandLineRunner initialRepository(SessionManager sessions,
                                        @Value("${gitagent.repository:}") String repository) {
        return args -> {
            if (repository.isBlank()) {
                return;
            }
            try {
                sessions.select(repository);
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring gitagent.repository={}: {}", repository, e.getMessage());
            }
        };
    }
}
