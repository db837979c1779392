package docbro.shard;

import docbro.config.RegistryConfig;
import docbro.db.SqliteDatabase;
import docbro.db.migration.DatabaseMigrator;
import docbro.errors.RepositoryException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Per-project shard handles, opened lazily and cached by project name for
 * the lifetime of the registry. Concurrent first access to the same project
 * opens the file once; later callers reuse the cached handle.
 */
public class ProjectShards implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectShards.class);

    private final RegistryConfig config;
    private final Clock clock;
    private final Map<String, ShardStore> shards = new ConcurrentHashMap<>();

    public ProjectShards(RegistryConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Get the shard of a project, opening and migrating it on first use.
     */
    public ShardStore get(String projectName) {
        return shards.computeIfAbsent(projectName, this::open);
    }

    private ShardStore open(String projectName) {
        Path file = config.getShardFile(projectName);
        SqliteDatabase database = SqliteDatabase.open(file, config);
        try {
            DatabaseMigrator.forShard(database).migrateToLatest();
        } catch (RuntimeException e) {
            database.close();
            throw e;
        }
        LOG.debug("Opened shard {} for project {}", file, projectName);
        return new ShardStore(projectName, database, clock);
    }

    public boolean isOpen(String projectName) {
        return shards.containsKey(projectName);
    }

    public boolean exists(String projectName) {
        return Files.exists(config.getShardFile(projectName));
    }

    /**
     * Close the cached handle of a project, if any.
     */
    public void close(String projectName) {
        ShardStore shard = shards.remove(projectName);
        if (shard != null) {
            shard.close();
        }
    }

    /**
     * Close the shard and delete the project's directory.
     */
    public void delete(String projectName) {
        close(projectName);
        Path directory = config.getShardFile(projectName).getParent();
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            List<Path> ordered = new ArrayList<>();
            paths.sorted(Comparator.reverseOrder()).forEach(ordered::add);
            for (Path path : ordered) {
                Files.delete(path);
            }
            LOG.info("Deleted shard directory {}", directory);
        } catch (IOException e) {
            throw new RepositoryException("Cannot delete shard directory " + directory, e);
        }
    }

    /**
     * Close every cached shard. The first failure is rethrown after all
     * shards have been attempted.
     */
    @Override
    public void close() {
        RepositoryException failure = null;
        for (String name : new ArrayList<>(shards.keySet())) {
            try {
                close(name);
            } catch (RepositoryException e) {
                LOG.warn("Error closing shard of {}: {}", name, e.getMessage());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
