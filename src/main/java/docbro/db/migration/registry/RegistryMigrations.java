package docbro.db.migration.registry;

import docbro.db.migration.SchemaMigration;

import java.util.List;

/**
 * Ordered migrations of the registry file.
 */
public final class RegistryMigrations {

    private RegistryMigrations() {
    }

    public static List<SchemaMigration> all() {
        return List.of(
                new V1_ProjectsTable(),
                new V2_ShelvesAndBoxes(),
                new V3_DefaultShelf(),
                new V4_UnifiedProjects(),
                new V5_MigrationAudit(),
                new V6_ProjectIndexes());
    }
}
