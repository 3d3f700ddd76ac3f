package org.clinidex.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Clinidex - Main Application Entry Point
 *
 * Versioned clinical document store with write-time search indexing.
 */
@SpringBootApplication(scanBasePackages = "org.clinidex")
@EnableJpaRepositories(basePackages = "org.clinidex.persistence.repository")
@EntityScan(basePackages = "org.clinidex.persistence.entity")
public class ClinidexApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinidexApplication.class, args);
    }
}
