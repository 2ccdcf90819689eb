package com.phillippitts.ambient.config;

import com.phillippitts.ambient.testutil.FakeExternalLauncher;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Keeps Spring context tests away from the real desktop: URIs and app launches are recorded
 * by a {@link FakeExternalLauncher} instead of being handed to the OS.
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public FakeExternalLauncher fakeExternalLauncher() {
        return new FakeExternalLauncher();
    }
}
