package io.kubecache.metrics;

import java.util.Collections;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

public class MetricsModule extends AbstractModule {
    private final Iterable<ResourcePool> resourcePools;

    public MetricsModule(final Iterable<ResourcePool> resourcePools) {
        this.resourcePools = resourcePools;
    }

    public MetricsModule() {
        this(Collections.emptyList());
    }

    @Override
    protected void configure() {
        bind(MetricsSink.class).to(LoggingMetricsSink.class);

        // eager, so that it gets registered with the EventBus before the first event is posted
        bind(SessionMetricsHandler.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    ResourcePoolRepository provideResourcePoolRepository() {
        return new InMemoryResourcePoolRepository(resourcePools);
    }
}
