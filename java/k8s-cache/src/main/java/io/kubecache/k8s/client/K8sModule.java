package io.kubecache.k8s.client;

import javax.inject.Singleton;
import java.io.IOException;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;

public class K8sModule extends AbstractModule {
    private final ClusterOptions options;

    public K8sModule(final ClusterOptions options) {
        this.options = options;
    }

    @Override
    protected void configure() {
        bind(ClusterOptions.class).toInstance(options);
    }

    @Provides
    @Singleton
    ClusterRegistry provideClusterRegistry() throws IOException {
        return new ClusterLoader(options).load();
    }
}
