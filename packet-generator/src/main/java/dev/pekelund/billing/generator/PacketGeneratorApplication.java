package dev.pekelund.billing.generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the weekly billing packet generator. Runs the pipeline once and exits.
 */
@SpringBootApplication
public class PacketGeneratorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PacketGeneratorApplication.class, args)));
    }
}
