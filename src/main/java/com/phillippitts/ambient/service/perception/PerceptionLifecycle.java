package com.phillippitts.ambient.service.perception;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.service.audio.AudioSentinel;
import com.phillippitts.ambient.service.context.ContextEngine;
import com.phillippitts.ambient.service.screen.ScreenSentinel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Starts the context engine and both sentinels with the application context when
 * {@code ambient.auto-start=true}, and stops them on shutdown.
 *
 * <p>The engine starts before the sentinels so no early snapshot is missed.
 */
@Service
public class PerceptionLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(PerceptionLifecycle.class);

    private final ContextEngine context;
    private final ScreenSentinel screen;
    private final AudioSentinel audio;
    private final AmbientProperties props;

    private volatile boolean running;

    public PerceptionLifecycle(ContextEngine context,
                               ScreenSentinel screen,
                               AudioSentinel audio,
                               AmbientProperties props) {
        this.context = context;
        this.screen = screen;
        this.audio = audio;
        this.props = props;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        if (!props.isAutoStart()) {
            LOG.info("Perception auto-start disabled; use the perception endpoints to start sensing");
            return;
        }
        startAll();
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        stopAll();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public void startAll() {
        context.start();
        screen.start();
        audio.start();
        LOG.info("Perception started: screen={}, audio={}, ultraLightweight={}",
                screen.isRunning(), audio.isRunning(), props.isUltraLightweight());
    }

    public void stopAll() {
        screen.stop();
        audio.stop();
        context.stop();
        LOG.info("Perception stopped");
    }

    public PerceptionStatus status() {
        return new PerceptionStatus(props.isUltraLightweight(), screen.isRunning(), audio.isRunning(),
                audio.state(), context.status());
    }
}
