package com.phillippitts.ambient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.ambient.config.properties.AmbientProperties.class,
        com.phillippitts.ambient.config.properties.ScreenProperties.class,
        com.phillippitts.ambient.config.properties.AudioProperties.class,
        com.phillippitts.ambient.config.properties.ContextProperties.class,
        com.phillippitts.ambient.config.properties.CommandProperties.class
})
@EnableScheduling
public class AmbientApplication {

    public static void main(String[] args) {
        SpringApplication.run(AmbientApplication.class, args);
    }

}
