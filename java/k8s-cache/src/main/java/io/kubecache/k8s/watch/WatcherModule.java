package io.kubecache.k8s.watch;

import java.time.Duration;

import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import io.kubecache.task.TaskSupervisor;

import static io.kubecache.guice.ServiceBindings.bindService;

public class WatcherModule extends AbstractModule {
    private final WatcherConfig config;
    private final Duration maxRetryWait;

    public WatcherModule(final WatcherConfig config, final Duration maxRetryWait) {
        this.config = config;
        this.maxRetryWait = maxRetryWait;
    }

    @Override
    protected void configure() {
        bind(WatcherConfig.class).toInstance(config);

        bind(Duration.class).annotatedWith(Names.named("maxRetryWait")).toInstance(maxRetryWait);
        bind(Duration.class).annotatedWith(Names.named("taskStopTimeout")).toInstance(config.stopTimeout);

        bind(K8sEventHandler.class).to(EventBusEventHandler.class);

        bindService(binder(), TaskSupervisor.class);
        bindService(binder(), K8sWatcher.class);
    }
}
