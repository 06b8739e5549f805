package orion;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import orion.dal.BackendConfig;
import orion.dal.ConfigurationException;
import orion.dal.ConfigurationService;
import orion.dal.SyncConfig;
import orion.domain.EngineEventBus;
import orion.domain.status.StatusEngine;

import java.util.concurrent.CountDownLatch;

/**
 * Headless launcher: keeps a live status view of the configured printer and logs it
 * @author Orion team
 * @since 16/10/2026
 */
public class Orion {
    private static final Logger logger = LoggerFactory.getLogger(Orion.class);

    public static void main(String[] args) {
        logger.info("Starting Orion status engine...");

        try {
            ConfigurationService configService = new ConfigurationService();
            BackendConfig backendConfig = configService.getBackendConfiguration();
            SyncConfig syncConfig = configService.getSyncConfiguration();

            logger.info("Configuration loaded successfully");
            logger.debug("Backend: {}", backendConfig);
            logger.debug("Sync: {}", syncConfig);

            Injector injector = Guice.createInjector(new GuiceModule(backendConfig, syncConfig));
            StatusEngine engine = injector.getInstance(StatusEngine.class);

            StatusConsoleReporter reporter = new StatusConsoleReporter();
            injector.getInstance(EngineEventBus.class).register(reporter);
            engine.subscribe(reporter);

            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down Orion status engine...");
                engine.dispose();
                stopped.countDown();
            }, "orion-shutdown"));

            engine.start();
            stopped.await();

        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, exiting");

        } catch (Exception e) {
            logger.error("Failed to start status engine", e);
            System.exit(1);
        }
    }
}
