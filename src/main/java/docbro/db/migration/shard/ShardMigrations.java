package docbro.db.migration.shard;

import docbro.db.migration.SchemaMigration;

import java.util.List;

/**
 * Ordered migrations of a per-project shard file. Independent of the
 * registry's versions.
 */
public final class ShardMigrations {

    private ShardMigrations() {
    }

    public static List<SchemaMigration> all() {
        return List.of(new V1_CrawlTables(), new V2_CrawlIndexes());
    }
}
