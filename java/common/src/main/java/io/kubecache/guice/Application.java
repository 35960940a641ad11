package io.kubecache.guice;

import javax.inject.Inject;
import javax.inject.Named;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An Application is a collection of Services, managed by a ServiceManager.
 * <p>
 * Shutdown waits at most {@code stopTimeout} for the services to stop. Services still stopping
 * after that are logged and abandoned so that the process can exit.
 */
public class Application implements Callable<Void> {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    private final ServiceManager serviceManager;
    private final Duration stopTimeout;

    @Inject
    public Application(final ServiceManager serviceManager,
                       final @Named("serviceStopTimeout") Duration stopTimeout) {
        this.serviceManager = serviceManager;
        this.stopTimeout = stopTimeout;
    }

    public Void call() throws Exception {
        logger.info("Services to start: {}", serviceManager.servicesByState().get(Service.State.NEW));

        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "ServiceManager Shutdown Hook"));

        // add a listener to catch any service failures
        serviceManager.addListener(new ServiceManager.Listener() {
            @Override
            public void failure(final Service service) {
                logger.error("Service {} failed. Shutting down.", service, service.failureCause());
                System.exit(1);
            }
        }, MoreExecutors.directExecutor());

        try {
            logger.info("Starting services.");
            serviceManager.startAsync().awaitHealthy(1, TimeUnit.MINUTES);
            logger.info("Successfully started all services.");

        } catch (final TimeoutException e) {
            logger.error("Timeout waiting for {} to start.", serviceManager.servicesByState().get(Service.State.STARTING));
            throw e;

        } catch (final IllegalStateException e) {
            logger.error("Services {} failed to start.", serviceManager.servicesByState().get(Service.State.FAILED));
            throw e;
        }

        serviceManager.awaitStopped();

        return null;
    }

    void stop() {
        logger.info("Shutting down {}.", serviceManager.servicesByState().get(Service.State.RUNNING));

        serviceManager.stopAsync();

        try {
            serviceManager.awaitStopped(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.info("Successfully shut down all services.");

        } catch (final TimeoutException e) {
            logger.error("Timeout waiting for {} to stop. Giving up on them.", serviceManager.servicesByState().get(Service.State.STOPPING), e);
        }
    }
}
