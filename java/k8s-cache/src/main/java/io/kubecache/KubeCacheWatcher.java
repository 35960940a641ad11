package io.kubecache;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.kubecache.guava.EventBusModule;
import io.kubecache.guice.Application;
import io.kubecache.guice.ServiceManagerModule;
import io.kubecache.k8s.cache.CacheModule;
import io.kubecache.k8s.cache.JdbcCacheOptions;
import io.kubecache.k8s.client.ClusterOptions;
import io.kubecache.k8s.client.K8sModule;
import io.kubecache.k8s.quota.QuotaModule;
import io.kubecache.k8s.watch.TrackedKind;
import io.kubecache.k8s.watch.TrackedKinds;
import io.kubecache.k8s.watch.WatcherConfig;
import io.kubecache.k8s.watch.WatcherModule;
import io.kubecache.metrics.MetricsModule;
import io.kubecache.picocli.DurationTypeConverter;
import io.kubecache.picocli.ExistingDirectoryPathTypeConverter;
import io.kubecache.picocli.PackageVersionProvider;
import io.kubecache.picocli.TrackedKindTypeConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import static io.kubecache.picocli.PackageVersionProvider.logCommandVersionInformation;

@Command(name = "kubecache-watcher",
        mixinStandardHelpOptions = true,
        description = "Mirrors Kubernetes objects of one or more clusters into a local object cache.",
        versionProvider = PackageVersionProvider.class,
        sortOptions = false
)
public class KubeCacheWatcher implements Callable<Void> {
    static final Logger logger = LoggerFactory.getLogger(KubeCacheWatcher.class);

    static class LoggingOptions {
        @Option(names = {"-v", "--verbose"}, description = {"Be verbose for the io.kubecache package (enable DEBUG level logging).",
                                                            "Specify @|italic --verbose|@ twice to increase verbosity (enable TRACE level logging).",
                                                            "For other packages configure Logback via @|italic logback.xml|@"})
        boolean[] verbosity;
    }

    static class ClusterCliOptions {
        @Option(names = {"-n", "--namespace"}, description = "Namespace of the default cluster.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        String namespace = "default";

        @Option(names = "--kubeconfig-dir",
                converter = ExistingDirectoryPathTypeConverter.class,
                description = "Directory of kubeconfig files, one per additional cluster. The cluster id is the file name without extension.")
        Path kubeConfigDirectory;

        @Option(names = "--in-memory-cluster",
                description = {"Use an in-memory cluster with this id instead of connecting to Kubernetes.",
                               "May be specified multiple times. Intended for development."})
        List<String> inMemoryClusters = new ArrayList<>();

        @Option(names = "--page-size", description = "Number of objects per list request.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        int pageSize = 500;
    }

    static class WatcherCliOptions {
        @Option(names = "--sync-period", converter = DurationTypeConverter.class,
                description = "Interval between full resyncs of a cluster.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        Duration syncPeriod = Duration.ofSeconds(600);

        @Option(names = "--reconnect-delay", converter = DurationTypeConverter.class,
                description = "Delay before re-opening a watch that ended or failed.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        Duration reconnectDelay = Duration.ofSeconds(10);

        @Option(names = "--max-retry-wait", converter = DurationTypeConverter.class,
                description = "Upper bound of the delay before restarting a failed task.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        Duration maxRetryWait = Duration.ofSeconds(60);

        @Option(names = "--stop-timeout", converter = DurationTypeConverter.class,
                description = "How long to wait for tasks and services to stop.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        Duration stopTimeout = Duration.ofSeconds(10);

        @Option(names = "--kind", converter = TrackedKindTypeConverter.class,
                description = {"Kind to watch, as @|italic <apiVersion>/<Kind>[,owner=<label>][,cluster-scoped]|@.",
                               "May be specified multiple times. Defaults to sessions, build runs, task runs, resource quotas and priority classes."})
        List<TrackedKind> kinds = new ArrayList<>();
    }

    static class CacheCliOptions {
        @Option(names = "--cache", description = "Object cache backend: ${COMPLETION-CANDIDATES}.", showDefaultValue = CommandLine.Help.Visibility.ALWAYS)
        CacheModule.Backend backend = CacheModule.Backend.MEMORY;

        @Option(names = "--jdbc-url", description = "JDBC URL of the object cache database.")
        String jdbcUrl;

        @Option(names = "--jdbc-user", description = "Object cache database user.")
        String jdbcUser;

        @Option(names = "--jdbc-password", description = "Object cache database password.", arity = "0..1", interactive = true)
        String jdbcPassword;
    }

    @Mixin
    private LoggingOptions loggingOptions;

    @Mixin
    private ClusterCliOptions clusterOptions;

    @Mixin
    private WatcherCliOptions watcherOptions;

    @Mixin
    private CacheCliOptions cacheOptions;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    public static void main(final String[] args) {
        SLF4JBridgeHandler.removeHandlersForRootLogger();
        SLF4JBridgeHandler.install();

        System.exit(new CommandLine(new KubeCacheWatcher())
                            .setCaseInsensitiveEnumValuesAllowed(true)
                            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO))
                            .execute(args));
    }

    @Override
    public Void call() throws Exception {
        if (loggingOptions.verbosity != null) {
            final ch.qos.logback.classic.Logger packageLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("io.kubecache");
            packageLogger.setLevel(loggingOptions.verbosity.length > 1 ? Level.TRACE : Level.DEBUG);
        }

        logCommandVersionInformation(commandSpec);

        if (cacheOptions.backend == CacheModule.Backend.JDBC && cacheOptions.jdbcUrl == null) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), "--jdbc-url is required when --cache=jdbc");
        }

        final Injector injector = Guice.createInjector(
                new ServiceManagerModule(watcherOptions.stopTimeout),
                new EventBusModule(),
                new K8sModule(clusterOptions()),
                new CacheModule(cacheOptions.backend, jdbcCacheOptions()),
                new WatcherModule(watcherConfig(), watcherOptions.maxRetryWait),
                new QuotaModule(),
                new MetricsModule()
        );

        return injector.getInstance(Application.class).call();
    }

    private ClusterOptions clusterOptions() {
        final ClusterOptions options = new ClusterOptions();
        options.namespace = clusterOptions.namespace;
        options.kubeConfigDirectory = clusterOptions.kubeConfigDirectory;
        options.inMemoryClusters = clusterOptions.inMemoryClusters;
        options.client.pageSize = clusterOptions.pageSize;

        logger.debug("Cluster options: {}", options);

        return options;
    }

    private JdbcCacheOptions jdbcCacheOptions() {
        final JdbcCacheOptions options = new JdbcCacheOptions();
        options.jdbcUrl = cacheOptions.jdbcUrl;
        options.username = cacheOptions.jdbcUser;
        options.password = cacheOptions.jdbcPassword;
        options.connectionTimeoutMillis = watcherOptions.stopTimeout.toMillis();

        return options;
    }

    private WatcherConfig watcherConfig() {
        final List<TrackedKind> kinds = watcherOptions.kinds.isEmpty() ? TrackedKinds.defaults() : watcherOptions.kinds;

        return new WatcherConfig(watcherOptions.syncPeriod, watcherOptions.reconnectDelay, watcherOptions.stopTimeout, kinds);
    }
}
