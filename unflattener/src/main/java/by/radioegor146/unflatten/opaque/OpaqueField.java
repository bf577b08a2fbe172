package by.radioegor146.unflatten.opaque;

import java.util.OptionalInt;

/**
 * Field written once by a module initializer. An unresolved field is still an opaque predicate
 * candidate, it just has no foldable value.
 */
public final class OpaqueField {

    private final FieldKey key;
    private final Integer value;

    public OpaqueField(FieldKey key, Integer value) {
        this.key = key;
        this.value = value;
    }

    public static OpaqueField unresolved(FieldKey key) {
        return new OpaqueField(key, null);
    }

    public FieldKey getKey() {
        return key;
    }

    public boolean isResolved() {
        return value != null;
    }

    public OptionalInt getValue() {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public String toString() {
        return key + " = " + (value == null ? "?" : value.toString());
    }
}
