package by.radioegor146.unflatten.opaque;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.FieldInsnNode;

import java.util.*;

/**
 * Module-wide result of the opaque field scan. Filled once, read-only while methods are processed.
 */
public final class OpaqueFieldTable {

    private final Map<FieldKey, OpaqueField> fields = new LinkedHashMap<>();
    private final Set<FieldKey> singletons = new HashSet<>();

    public void addSingleton(FieldKey singleton) {
        singletons.add(singleton);
    }

    public void put(OpaqueField field) {
        fields.put(field.getKey(), field);
    }

    public boolean isSingletonLoad(FieldInsnNode insn) {
        return insn.getOpcode() == Opcodes.GETSTATIC && singletons.contains(FieldKey.of(insn));
    }

    public OpaqueField get(FieldKey key) {
        return key == null ? null : fields.get(key);
    }

    public boolean isOpaque(FieldKey key) {
        return key != null && fields.containsKey(key);
    }

    public Collection<OpaqueField> getFields() {
        return Collections.unmodifiableCollection(fields.values());
    }

    public int size() {
        return fields.size();
    }

    public long resolvedCount() {
        return fields.values().stream().filter(OpaqueField::isResolved).count();
    }

    /** Ten points per opaque field. */
    public int detectionScore() {
        return fields.size() * 10;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
