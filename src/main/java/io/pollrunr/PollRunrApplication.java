package io.pollrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PollRunr: cron-driven API poller with change-detection notifications.
 */
@SpringBootApplication
public class PollRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(PollRunrApplication.class, args);
    }
}
