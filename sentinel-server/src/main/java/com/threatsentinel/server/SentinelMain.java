package com.threatsentinel.server;

import com.threatsentinel.core.config.RulesLoader;
import com.threatsentinel.core.config.SentinelSettings;
import com.threatsentinel.core.engine.SentinelEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Threat Sentinel service.
 *
 * <h3>Startup</h3>
 * <ol>
 * <li>Resolve {@link SentinelSettings} from environment variables</li>
 * <li>Load the detection rules and assemble the {@link SentinelEngine}</li>
 * <li>Start the metrics loop and the HTTP server</li>
 * </ol>
 *
 * <p>
 * A JVM shutdown hook stops the HTTP server first, then the engine (monitors,
 * metrics loop, background tasks).
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelMain {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelMain.class);

    private SentinelMain() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        SentinelSettings settings = SentinelSettings.fromEnvironment();
        LOG.info("Starting Threat Sentinel with settings: {}", settings);

        SentinelEngine engine = SentinelEngine.builder().settings(settings).build();
        if (engine.getPipeline().getStages().isEmpty() && engine.getPipeline().getExpensiveStage().isEmpty()) {
            engine.close();
            throw new IllegalStateException(
                    "No detection rules defined. Provide rules via "
                            + RulesLoader.ENV_RULES_PATH
                            + " or a classpath rules.yml file.");
        }
        engine.start();

        SentinelServer server = new SentinelServer(engine);
        try {
            server.start(settings.getHttpPort());
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            engine.close();
        }, "sentinel-shutdown"));
    }
}
