package docbro.schema;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Documentation-level description of one schema generation: what it added,
 * removed and changed relative to its predecessor, and which record fields
 * it requires.
 */
public final class SchemaVersionDescriptor {

    private final int version;
    private final String name;
    private final String description;
    private final List<String> fieldsAdded;
    private final List<String> fieldsRemoved;
    private final List<String> fieldsChanged;
    private final Set<String> requiredFields;
    private final Set<String> optionalFields;

    private SchemaVersionDescriptor(Builder builder) {
        this.version = builder.version;
        this.name = Objects.requireNonNull(builder.name, "name");
        this.description = builder.description;
        this.fieldsAdded = List.copyOf(builder.fieldsAdded);
        this.fieldsRemoved = List.copyOf(builder.fieldsRemoved);
        this.fieldsChanged = List.copyOf(builder.fieldsChanged);
        this.requiredFields = Set.copyOf(builder.requiredFields);
        this.optionalFields = Set.copyOf(builder.optionalFields);
    }

    public static Builder builder(int version, String name) {
        return new Builder(version, name);
    }

    public int getVersion() { return version; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<String> getFieldsAdded() { return fieldsAdded; }
    public List<String> getFieldsRemoved() { return fieldsRemoved; }
    public List<String> getFieldsChanged() { return fieldsChanged; }
    public Set<String> getRequiredFields() { return requiredFields; }
    public Set<String> getOptionalFields() { return optionalFields; }

    public boolean isKnownField(String field) {
        return requiredFields.contains(field) || optionalFields.contains(field);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SchemaVersionDescriptor that = (SchemaVersionDescriptor) o;
        return version == that.version && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, name);
    }

    @Override
    public String toString() {
        return "v" + version + " (" + name + ")";
    }

    public static class Builder {
        private final int version;
        private final String name;
        private String description = "";
        private List<String> fieldsAdded = List.of();
        private List<String> fieldsRemoved = List.of();
        private List<String> fieldsChanged = List.of();
        private Set<String> requiredFields = Set.of();
        private Set<String> optionalFields = Set.of();

        private Builder(int version, String name) {
            if (version < 1) {
                throw new IllegalArgumentException("Schema versions start at 1");
            }
            this.version = version;
            this.name = name;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder added(String... fields) { this.fieldsAdded = List.of(fields); return this; }
        public Builder removed(String... fields) { this.fieldsRemoved = List.of(fields); return this; }
        public Builder changed(String... fields) { this.fieldsChanged = List.of(fields); return this; }
        public Builder required(String... fields) { this.requiredFields = Set.of(fields); return this; }
        public Builder optional(String... fields) { this.optionalFields = Set.of(fields); return this; }

        public SchemaVersionDescriptor build() {
            return new SchemaVersionDescriptor(this);
        }
    }
}
