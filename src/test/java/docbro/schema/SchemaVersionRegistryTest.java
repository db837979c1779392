package docbro.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Schema generations")
class SchemaVersionRegistryTest {

    @Test
    void historyIsAscendingAndEndsAtTheCurrentVersion() {
        assertThat(SchemaVersionRegistry.history())
                .extracting(SchemaVersionDescriptor::getVersion)
                .containsExactly(1, 2, 3);
        assertThat(SchemaVersionRegistry.currentVersion()).isEqualTo(3);
        assertThat(SchemaVersionRegistry.current().getName()).isEqualTo("unified");
        assertThat(SchemaVersionRegistry.describe(42)).isEmpty();
    }

    @Test
    void currentGenerationFieldSets() {
        assertThat(SchemaVersionRegistry.requiredFields()).containsExactlyInAnyOrder(
                "id", "name", "schema_version", "type", "status", "created_at", "updated_at",
                "settings", "statistics", "metadata");
        assertThat(SchemaVersionRegistry.optionalFields()).containsExactlyInAnyOrder(
                "compatibility_status", "last_operation_at", "source_url");
        assertThat(SchemaVersionRegistry.current().isKnownField("source_url")).isTrue();
        assertThat(SchemaVersionRegistry.current().isKnownField("crawl_depth")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 4, 99})
    void everyOtherVersionRequiresRecreationAndNeverAutoMigrates(int version) {
        assertThat(SchemaVersionRegistry.isCurrent(version)).isFalse();
        assertThat(SchemaVersionRegistry.requiresRecreation(version)).isTrue();
        assertThat(SchemaVersionRegistry.canAutoMigrate(version)).isFalse();
    }

    @Test
    void statusIsCompatibleOnlyOnExactMatch() {
        assertThat(CompatibilityStatus.fromSchemaVersion(3, 3)).isEqualTo(CompatibilityStatus.COMPATIBLE);
        assertThat(CompatibilityStatus.fromSchemaVersion(2, 3)).isEqualTo(CompatibilityStatus.INCOMPATIBLE);
        assertThat(CompatibilityStatus.fromSchemaVersion(4, 3)).isEqualTo(CompatibilityStatus.INCOMPATIBLE);
    }

    @Test
    void onlyCompatibleAllowsModificationAndOnlyIncompatibleNeedsRecreation() {
        assertThat(CompatibilityStatus.COMPATIBLE.allowsModification()).isTrue();
        assertThat(CompatibilityStatus.INCOMPATIBLE.allowsModification()).isFalse();
        assertThat(CompatibilityStatus.MIGRATING.allowsModification()).isFalse();

        assertThat(CompatibilityStatus.COMPATIBLE.needsRecreation()).isFalse();
        assertThat(CompatibilityStatus.INCOMPATIBLE.needsRecreation()).isTrue();
        assertThat(CompatibilityStatus.MIGRATING.needsRecreation()).isFalse();
    }
}
