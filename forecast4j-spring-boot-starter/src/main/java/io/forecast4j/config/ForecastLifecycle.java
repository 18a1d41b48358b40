package io.forecast4j.config;

import io.forecast4j.ForecastEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Ties the forecast engine to the application context.
 *
 * <p>The engine starts once every other bean is up and stops first on shutdown. The asynchronous stop drains
 * in-flight executions on its own thread, so other lifecycle beans in the same phase keep stopping while the
 * grace period runs.
 */
public class ForecastLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ForecastLifecycle.class);

    private final ForecastEngine engine;

    public ForecastLifecycle(ForecastEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public void start() {
        engine.start();
    }

    @Override
    public void stop() {
        engine.stop();
    }

    @Override
    public void stop(Runnable callback) {
        Thread stopper = new Thread(() -> {
            try {
                engine.stop();
            } catch (RuntimeException e) {
                log.error("forecast engine stop failed msg={}", e.getMessage(), e);
            } finally {
                callback.run();
            }
        });
        stopper.setName("forecast.lifecycle-stop");
        stopper.setDaemon(true);
        stopper.start();
    }

    @Override
    public boolean isRunning() {
        return engine.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
