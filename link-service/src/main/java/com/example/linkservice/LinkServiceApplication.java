package com.example.linkservice;

import com.example.linkservice.scheduler.ManualSyncRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LinkServiceApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(LinkServiceApplication.class, args);

        // One-shot operator sync: exit with the runner's status instead of staying up
        if (context.getEnvironment().acceptsProfiles(Profiles.of(ManualSyncRunner.PROFILE))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
