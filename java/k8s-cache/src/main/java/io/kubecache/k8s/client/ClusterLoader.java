package io.kubecache.k8s.client;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.base.Strings;
import com.google.common.io.MoreFiles;
import io.kubecache.k8s.model.ClusterId;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link ClusterRegistry} from configuration.
 * <p>
 * The default cluster uses the standard client configuration (in-cluster service account, {@code $KUBECONFIG}
 * or {@code ~/.kube/config}). Every regular file in the kubeconfig directory adds a cluster whose id is the
 * file name without extension and whose namespace is the one of the file's current context.
 */
public class ClusterLoader {
    private static final Logger logger = LoggerFactory.getLogger(ClusterLoader.class);

    private final ClusterOptions options;

    public ClusterLoader(final ClusterOptions options) {
        this.options = options;
    }

    public ClusterRegistry load() throws IOException {
        final List<Cluster> clusters = new ArrayList<>();

        if (!options.inMemoryClusters.isEmpty()) {
            for (final String id : options.inMemoryClusters) {
                logger.info("Using in-memory cluster {}.", id);
                clusters.add(new Cluster(ClusterId.of(id), options.namespace, new InMemoryClusterConnection(ClusterId.of(id))));
            }

            return new ClusterRegistry(clusters);
        }

        clusters.add(new Cluster(ClusterId.DEFAULT,
                                 options.namespace,
                                 new ApiClusterConnection(ClusterId.DEFAULT, ClientBuilder.standard().build(), ClientBuilder.standard().build(), options.client)));

        if (options.kubeConfigDirectory != null) {
            clusters.addAll(loadDirectory(options.kubeConfigDirectory));
        }

        logger.info("Loaded clusters {}.", clusters.stream().map(cluster -> cluster.id).collect(Collectors.toList()));

        return new ClusterRegistry(clusters);
    }

    private List<Cluster> loadDirectory(final Path directory) throws IOException {
        final List<Path> files;

        try (final Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        final List<Cluster> clusters = new ArrayList<>();

        for (final Path file : files) {
            final ClusterId id = ClusterId.of(MoreFiles.getNameWithoutExtension(file));

            if (id.isDefault()) {
                logger.warn("Skipping {}, the id {} is reserved for the default cluster.", file, id);
                continue;
            }

            try {
                final KubeConfig kubeConfig = loadKubeConfig(file);
                final String namespace = Strings.isNullOrEmpty(kubeConfig.getNamespace()) ? options.namespace : kubeConfig.getNamespace();

                final ApiClient apiClient = ClientBuilder.kubeconfig(kubeConfig).build();
                final ApiClient watchApiClient = ClientBuilder.kubeconfig(loadKubeConfig(file)).build();

                clusters.add(new Cluster(id, namespace, new ApiClusterConnection(id, apiClient, watchApiClient, options.client)));

                logger.info("Loaded cluster {} (namespace {}) from {}.", id, namespace, file);

            } catch (final IOException | RuntimeException e) {
                logger.warn("Skipping cluster configuration {}, it cannot be loaded.", file, e);
            }
        }

        return clusters;
    }

    private static KubeConfig loadKubeConfig(final Path file) throws IOException {
        try (final Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            final KubeConfig kubeConfig = KubeConfig.loadKubeConfig(reader);
            kubeConfig.setFile(file.toFile());
            return kubeConfig;
        }
    }
}
