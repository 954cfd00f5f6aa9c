package io.github.drompincen.promptgate.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.promptgate")
@EnableScheduling
public class PromptGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptGateApplication.class, args);
    }
}
