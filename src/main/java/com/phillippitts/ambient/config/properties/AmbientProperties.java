package com.phillippitts.ambient.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Top-level switches for the assistant.
 *
 * <p>{@code ultraLightweight} turns both sentinels into logged no-ops for low-power machines.
 * {@code autoStart} starts perception and the context engine with the application context.
 */
@Validated
@ConfigurationProperties(prefix = "ambient")
public class AmbientProperties {

    private boolean ultraLightweight = false;
    private boolean autoStart = false;

    @Valid
    private Store store = new Store();

    @Valid
    private Fallback fallback = new Fallback();

    public boolean isUltraLightweight() {
        return ultraLightweight;
    }

    public void setUltraLightweight(boolean ultraLightweight) {
        this.ultraLightweight = ultraLightweight;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    /**
     * In-memory record store sizing.
     */
    public static class Store {
        /** Records kept per record type. */
        @Min(10)
        @Max(100_000)
        private int capacity = 500;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    /**
     * Fallback resolver side effects.
     */
    public static class Fallback {
        /** Whether store, OAuth and settings links are opened automatically. */
        private boolean openLinks = true;

        public boolean isOpenLinks() {
            return openLinks;
        }

        public void setOpenLinks(boolean openLinks) {
            this.openLinks = openLinks;
        }
    }
}
