package com.project.image.fiducial;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point of the Spring Boot application. The purpose of this class is ONLY to bootstrap
 * the app - it must NOT contain business logic.
 *
 * With {@code --app.cli.enabled=true} the measurement runs once from the command line and the process
 * exits with its exit code.
 */
@SpringBootApplication
public class Application {
    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(Application.class, args);
        if (context.getEnvironment().getProperty("app.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
