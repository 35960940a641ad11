package io.kubecache.k8s.cache;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import static io.kubecache.guice.ServiceBindings.bindService;

public class CacheModule extends AbstractModule {
    public enum Backend {
        MEMORY,
        JDBC
    }

    private final Backend backend;
    private final JdbcCacheOptions jdbcOptions;

    public CacheModule(final Backend backend, final JdbcCacheOptions jdbcOptions) {
        this.backend = backend;
        this.jdbcOptions = jdbcOptions;
    }

    public static CacheModule inMemory() {
        return new CacheModule(Backend.MEMORY, new JdbcCacheOptions());
    }

    @Override
    protected void configure() {
        switch (backend) {
            case MEMORY:
                bind(ObjectCache.class).to(InMemoryObjectCache.class).in(Singleton.class);
                break;

            case JDBC:
                bind(ObjectCache.class).to(JdbcObjectCache.class);
                bindService(binder(), JdbcObjectCacheService.class);
                break;
        }
    }

    @Provides
    @Singleton
    HikariDataSource provideDataSource() {
        final HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setAutoCommit(true);
        hikariConfig.setJdbcUrl(jdbcOptions.jdbcUrl);
        hikariConfig.setUsername(jdbcOptions.username);
        hikariConfig.setPassword(jdbcOptions.password);
        hikariConfig.setConnectionTimeout(jdbcOptions.connectionTimeoutMillis);
        hikariConfig.setMaximumPoolSize(jdbcOptions.maximumPoolSize);
        hikariConfig.setPoolName("object-cache");

        return new HikariDataSource(hikariConfig);
    }

    @Provides
    @Singleton
    JdbcObjectCache provideJdbcObjectCache(final HikariDataSource dataSource) {
        return new JdbcObjectCache(dataSource);
    }
}
