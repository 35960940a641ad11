package io.kubecache.k8s.cache;

import com.google.common.base.MoreObjects;

public class JdbcCacheOptions {
    public String jdbcUrl;
    public String username;
    public String password;
    public int maximumPoolSize = 10;
    public long connectionTimeoutMillis = 10_000;

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("jdbcUrl", jdbcUrl)
                .add("username", username)
                .add("maximumPoolSize", maximumPoolSize)
                .add("connectionTimeoutMillis", connectionTimeoutMillis)
                .toString();
    }
}
