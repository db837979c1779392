package docbro.db.migration;

/**
 * Classification of a migration step by how it changes the file.
 */
public enum MigrationKind {
    /** New tables, nullable columns and indexes; idempotent by "if not exists". */
    ADDITIVE,
    /** Default rows detected by name before insertion. */
    SEEDING,
    /** Table rebuilds; backed up first and verified before commit. */
    STRUCTURAL
}
