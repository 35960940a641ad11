package io.kubecache.guice;

import com.google.common.util.concurrent.Service;
import com.google.inject.Binder;
import com.google.inject.multibindings.Multibinder;

public final class ServiceBindings {
    private ServiceBindings() {}

    /**
     * Binds the Service as an eager singleton and adds it to the set managed by the {@link Application}.
     */
    public static void bindService(final Binder binder, final Class<? extends Service> serviceClass) {
        binder.bind(serviceClass).asEagerSingleton(); // ensure only one copy of the Service exists

        Multibinder.newSetBinder(binder, Service.class).addBinding().to(serviceClass);
    }
}
