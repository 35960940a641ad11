package io.kubecache.k8s.quota;

import com.google.inject.AbstractModule;

public class QuotaModule extends AbstractModule {
    @Override
    protected void configure() {
        bind(QuotaRepository.class);
    }
}
