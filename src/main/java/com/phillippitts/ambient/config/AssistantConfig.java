package com.phillippitts.ambient.config;

import com.phillippitts.ambient.service.launch.Platform;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Environment beans shared by the sentinels, context engine and command layer.
 * Tests override them with a fixed clock or a specific platform.
 */
@Configuration
public class AssistantConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Platform platform() {
        return Platform.current();
    }
}
