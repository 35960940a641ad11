package io.kubecache.guice;

import java.time.Duration;
import java.util.Set;

import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.ServiceManager;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import com.google.inject.name.Names;

public class ServiceManagerModule extends AbstractModule {
    private final Duration serviceStopTimeout;

    public ServiceManagerModule(final Duration serviceStopTimeout) {
        this.serviceStopTimeout = serviceStopTimeout;
    }

    @Override
    protected void configure() {
        Multibinder.newSetBinder(binder(), Service.class);

        bind(Duration.class).annotatedWith(Names.named("serviceStopTimeout")).toInstance(serviceStopTimeout);
    }

    @Provides
    @Singleton
    ServiceManager provideServiceManager(final Set<Service> services) {
        return new ServiceManager(services);
    }
}
