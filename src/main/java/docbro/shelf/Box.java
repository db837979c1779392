package docbro.shelf;

import java.time.Instant;

public final class Box {

    private final String id;
    private final String name;
    private final BoxType type;
    private final boolean deletable;
    private final String url;
    private final Integer position;
    private final Instant createdAt;
    private final Instant updatedAt;

    Box(String id, String name, BoxType type, boolean deletable, String url, Integer position,
        Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.deletable = deletable;
        this.url = url;
        this.position = position;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public BoxType getType() { return type; }
    public boolean isDeletable() { return deletable; }
    public String getUrl() { return url; }

    /**
     * @return Position on the shelf it was listed from, null when looked up directly
     */
    public Integer getPosition() { return position; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "Box{name='" + name + "', type=" + type + '}';
    }
}
