package dev.chi.tui;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChiWatchdogApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChiWatchdogApplication.class, args);
    }
}
