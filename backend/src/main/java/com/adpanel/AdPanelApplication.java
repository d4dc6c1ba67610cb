package com.adpanel;

import com.adpanel.config.AppProperties;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AppProperties.class)
public class AdPanelApplication {

    static {
        // Load .env file before Spring Boot starts
        loadEnvironmentVariables();
    }

    public static void main(String[] args) {
        SpringApplication.run(AdPanelApplication.class, args);
    }

    private static void loadEnvironmentVariables() {
        try {
            Path currentPath = Paths.get(System.getProperty("user.dir"));
            Path envPath = currentPath.resolve(".env");

            // Running from the backend module, check the repository root
            if (!Files.exists(envPath) && currentPath.getFileName().toString().equals("backend")) {
                envPath = currentPath.getParent().resolve(".env");
            }

            if (!Files.exists(envPath)) {
                System.out.println("No .env file found, using system environment variables");
                return;
            }

            Dotenv dotenv =
                    Dotenv.configure()
                            .directory(envPath.getParent().toString())
                            .ignoreIfMissing()
                            .systemProperties()
                            .load();

            System.out.println(
                    "Loaded " + dotenv.entries().size() + " environment variables from " + envPath);
        } catch (Exception e) {
            System.err.println("Error loading .env file: " + e.getMessage());
        }
    }
}
