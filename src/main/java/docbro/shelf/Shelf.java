package docbro.shelf;

import java.time.Instant;

public final class Shelf {

    private final String id;
    private final String name;
    private final boolean defaultShelf;
    private final boolean deletable;
    private final Instant createdAt;
    private final Instant updatedAt;

    Shelf(String id, String name, boolean defaultShelf, boolean deletable, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.name = name;
        this.defaultShelf = defaultShelf;
        this.deletable = deletable;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public boolean isDefault() { return defaultShelf; }
    public boolean isDeletable() { return deletable; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "Shelf{name='" + name + "'" + (defaultShelf ? ", default" : "") + '}';
    }
}
