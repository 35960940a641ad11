package io.kubecache.k8s.cache;

import javax.annotation.Nullable;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.kubecache.k8s.model.ClusterId;
import io.kubecache.k8s.model.GVK;
import io.kubecache.k8s.model.K8sObject;
import io.kubecache.k8s.model.K8sObjectFilter;
import io.kubecache.k8s.model.K8sObjectMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ObjectCache} persisted in a relational database.
 * <p>
 * One row per object, the manifest is stored as JSON text. Absent namespaces (cluster-scoped objects) and
 * the core API group are stored as empty strings so that they can be part of the primary key.
 * Label selectors are evaluated on the loaded manifests.
 */
public class JdbcObjectCache implements ObjectCache {
    private static final Logger logger = LoggerFactory.getLogger(JdbcObjectCache.class);

    static final String TABLE = "k8s_objects";

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
            "cluster_id VARCHAR(255) NOT NULL, " +
            "object_namespace VARCHAR(255) NOT NULL, " +
            "api_group VARCHAR(255) NOT NULL, " +
            "api_version VARCHAR(64) NOT NULL, " +
            "kind VARCHAR(255) NOT NULL, " +
            "object_name VARCHAR(255) NOT NULL, " +
            "user_id VARCHAR(255) NOT NULL, " +
            "manifest TEXT NOT NULL, " +
            "PRIMARY KEY (cluster_id, object_namespace, api_group, api_version, kind, object_name))";

    private static final String IDENTITY = "cluster_id = ? AND object_namespace = ? AND api_group = ? AND api_version = ? AND kind = ? AND object_name = ?";

    private static final String UPDATE = "UPDATE " + TABLE + " SET user_id = ?, manifest = ? WHERE " + IDENTITY;

    private static final String INSERT = "INSERT INTO " + TABLE +
            " (cluster_id, object_namespace, api_group, api_version, kind, object_name, user_id, manifest) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT = "SELECT cluster_id, object_namespace, api_group, api_version, kind, object_name, user_id, manifest FROM " + TABLE;

    private static final String DELETE = "DELETE FROM " + TABLE + " WHERE " + IDENTITY;

    // SQLSTATE class 23: integrity constraint violation
    private static final String INTEGRITY_CONSTRAINT_VIOLATION = "23";

    private final DataSource dataSource;

    public JdbcObjectCache(final DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void createSchema() {
        try (final Connection connection = dataSource.getConnection();
             final Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE);

        } catch (final SQLException e) {
            throw new ObjectCacheException("Failed to create the object cache table.", e);
        }
    }

    @Override
    public void upsert(final K8sObject object) {
        OwnershipValidation.requireUserId(object);

        final K8sObjectMeta meta = object.meta;
        final String manifest = object.manifest().toString();

        try (final Connection connection = dataSource.getConnection()) {
            if (update(connection, meta, manifest)) {
                return;
            }

            try (final PreparedStatement insert = connection.prepareStatement(INSERT)) {
                setIdentity(insert, 1, meta);
                insert.setString(7, meta.userId);
                insert.setString(8, manifest);
                insert.executeUpdate();

            } catch (final SQLException e) {
                // a concurrent upsert inserted the row first
                if (e.getSQLState() != null && e.getSQLState().startsWith(INTEGRITY_CONSTRAINT_VIOLATION)) {
                    logger.debug("Lost insert race for {}, updating instead.", meta);
                    update(connection, meta, manifest);
                    return;
                }

                throw e;
            }

        } catch (final SQLException e) {
            throw new ObjectCacheException(String.format("Failed to upsert %s.", meta), e);
        }
    }

    private static boolean update(final Connection connection, final K8sObjectMeta meta, final String manifest) throws SQLException {
        try (final PreparedStatement update = connection.prepareStatement(UPDATE)) {
            update.setString(1, meta.userId);
            update.setString(2, manifest);
            setIdentity(update, 3, meta);

            return update.executeUpdate() > 0;
        }
    }

    private static void setIdentity(final PreparedStatement statement, final int firstIndex, final K8sObjectMeta meta) throws SQLException {
        statement.setString(firstIndex, meta.cluster.id);
        statement.setString(firstIndex + 1, Strings.nullToEmpty(meta.namespace));
        statement.setString(firstIndex + 2, meta.gvk.apiGroup());
        statement.setString(firstIndex + 3, meta.gvk.version);
        statement.setString(firstIndex + 4, meta.gvk.kind);
        statement.setString(firstIndex + 5, meta.name);
    }

    @Override
    public Optional<K8sObject> get(final K8sObjectMeta meta) {
        try (final Connection connection = dataSource.getConnection();
             final PreparedStatement select = connection.prepareStatement(SELECT + " WHERE " + IDENTITY)) {
            setIdentity(select, 1, meta);

            try (final ResultSet resultSet = select.executeQuery()) {
                return resultSet.next() ? Optional.of(readObject(resultSet)) : Optional.empty();
            }

        } catch (final SQLException e) {
            throw new ObjectCacheException(String.format("Failed to read %s.", meta), e);
        }
    }

    @Override
    public void delete(final K8sObjectMeta meta) {
        try (final Connection connection = dataSource.getConnection();
             final PreparedStatement delete = connection.prepareStatement(DELETE)) {
            setIdentity(delete, 1, meta);
            delete.executeUpdate();

        } catch (final SQLException e) {
            throw new ObjectCacheException(String.format("Failed to delete %s.", meta), e);
        }
    }

    @Override
    public Iterable<K8sObject> list(final K8sObjectFilter filter) {
        final List<String> conditions = new ArrayList<>();
        final List<String> parameters = new ArrayList<>();

        addCondition(conditions, parameters, "cluster_id", filter.cluster == null ? null : filter.cluster.id);
        addCondition(conditions, parameters, "object_namespace", filter.namespace);
        addCondition(conditions, parameters, "object_name", filter.name);
        addCondition(conditions, parameters, "user_id", filter.userId);

        if (filter.gvk != null) {
            addCondition(conditions, parameters, "api_group", filter.gvk.apiGroup());
            addCondition(conditions, parameters, "api_version", filter.gvk.version);
            addCondition(conditions, parameters, "kind", filter.gvk.kind);
        }

        final String sql = conditions.isEmpty() ? SELECT : SELECT + " WHERE " + Joiner.on(" AND ").join(conditions);

        try (final Connection connection = dataSource.getConnection();
             final PreparedStatement select = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.size(); i++) {
                select.setString(i + 1, parameters.get(i));
            }

            final ImmutableList.Builder<K8sObject> objects = ImmutableList.builder();

            try (final ResultSet resultSet = select.executeQuery()) {
                while (resultSet.next()) {
                    final K8sObject object = readObject(resultSet);

                    if (filter.labelsMatch(object.labels())) {
                        objects.add(object);
                    }
                }
            }

            return objects.build();

        } catch (final SQLException e) {
            throw new ObjectCacheException(String.format("Failed to list %s.", filter), e);
        }
    }

    private static void addCondition(final List<String> conditions, final List<String> parameters, final String column, @Nullable final String value) {
        if (value != null) {
            conditions.add(column + " = ?");
            parameters.add(value);
        }
    }

    private static K8sObject readObject(final ResultSet resultSet) throws SQLException {
        final K8sObjectMeta meta = new K8sObjectMeta(
                resultSet.getString("object_name"),
                resultSet.getString("object_namespace"),
                ClusterId.of(resultSet.getString("cluster_id")),
                new GVK(resultSet.getString("api_group"), resultSet.getString("api_version"), resultSet.getString("kind")),
                resultSet.getString("user_id"));

        final JsonObject manifest = JsonParser.parseString(resultSet.getString("manifest")).getAsJsonObject();

        return new K8sObject(meta, manifest);
    }
}
