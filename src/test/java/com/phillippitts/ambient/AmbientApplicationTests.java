package com.phillippitts.ambient;

import com.phillippitts.ambient.config.IntegrationTestConfiguration;
import com.phillippitts.ambient.service.audio.AudioSentinel;
import com.phillippitts.ambient.service.context.ContextEngine;
import com.phillippitts.ambient.service.screen.ScreenSentinel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@Import(IntegrationTestConfiguration.class)
@SpringBootTest(properties = {
        "ambient.auto-start=false",
        "ambient.fallback.open-links=false"
})
class AmbientApplicationTests {

    @Autowired
    private ScreenSentinel screenSentinel;

    @Autowired
    private AudioSentinel audioSentinel;

    @Autowired
    private ContextEngine contextEngine;

    @Test
    void contextLoads() {
        assertThat(screenSentinel.isRunning()).isFalse();
        assertThat(audioSentinel.isRunning()).isFalse();
        assertThat(contextEngine.isRunning()).isFalse();
    }
}
