package io.jobclock.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JobClockServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobClockServerApplication.class, args);
    }
}
