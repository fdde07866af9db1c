package com.storyscene.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class StorySceneApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorySceneApplication.class, args);
    }

    /**
     * ✅ No scheduling under the test profile: the stale-attempt reconciler would race
     * with tests that drive the pipeline by hand.
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
