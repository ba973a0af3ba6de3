package dev.feedbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Feedbridge service.
 *
 * <p>Starts the unattended bridge loop ({@link dev.feedbridge.bridge.BridgeLoop}) that polls the
 * configured feeds and publishes new entries to the read-later destination. There is no web
 * surface; the embedded server is disabled in {@code application.yml}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FeedbridgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(FeedbridgeApplication.class, args);
    }
}
