package in.hostsnap.source;

import java.util.Objects;

/**
 * Identity of one inventory category and the shape of its rows.
 *
 * A category is the query key handed to an {@link InventorySource}. Two categories are equal
 * when both name and record type match.
 *
 * @param <R> record type; must implement value equality
 */
public final class Category<R> {

    private final String name;
    private final Class<R> recordType;
    private final String description;

    private Category(String name, Class<R> recordType, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Category name must not be blank");
        }
        this.name = name;
        this.recordType = Objects.requireNonNull(recordType, "recordType");
        this.description = description == null ? "" : description;
    }

    public static <R> Category<R> of(String name, Class<R> recordType) {
        return new Category<>(name, recordType, "");
    }

    public static <R> Category<R> of(String name, Class<R> recordType, String description) {
        return new Category<>(name, recordType, description);
    }

    public String name() {
        return name;
    }

    public Class<R> recordType() {
        return recordType;
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Category)) return false;
        Category<?> other = (Category<?>) o;
        return name.equals(other.name) && recordType.equals(other.recordType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, recordType);
    }

    @Override
    public String toString() {
        return name + "<" + recordType.getSimpleName() + ">";
    }
}
