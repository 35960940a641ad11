package io.kubecache.k8s.cache;

import javax.inject.Inject;

import com.google.common.util.concurrent.AbstractIdleService;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of the cache database: creates the schema on start, closes the pool on stop.
 */
public class JdbcObjectCacheService extends AbstractIdleService {
    private static final Logger logger = LoggerFactory.getLogger(JdbcObjectCacheService.class);

    private final JdbcObjectCache cache;
    private final HikariDataSource dataSource;

    @Inject
    public JdbcObjectCacheService(final JdbcObjectCache cache, final HikariDataSource dataSource) {
        this.cache = cache;
        this.dataSource = dataSource;
    }

    @Override
    protected void startUp() throws Exception {
        cache.createSchema();
        logger.info("Object cache schema ready in {}.", dataSource.getJdbcUrl());
    }

    @Override
    protected void shutDown() throws Exception {
        dataSource.close();
    }
}
