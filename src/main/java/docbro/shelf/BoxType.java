package docbro.shelf;

import docbro.errors.ValidationException;

/**
 * Kind of content a box holds: crawled documentation, uploaded documents
 * for retrieval, or plain file storage.
 */
public enum BoxType {
    DRAG("drag"),
    RAG("rag"),
    BAG("bag");

    private final String value;

    BoxType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static BoxType fromValue(String value) {
        for (BoxType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("Unknown box type: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
