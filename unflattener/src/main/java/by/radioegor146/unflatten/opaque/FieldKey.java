package by.radioegor146.unflatten.opaque;

import org.objectweb.asm.tree.FieldInsnNode;

import java.util.Objects;

public final class FieldKey {

    private final String owner;
    private final String name;
    private final String desc;

    public FieldKey(String owner, String name, String desc) {
        this.owner = owner;
        this.name = name;
        this.desc = desc;
    }

    public static FieldKey of(FieldInsnNode insn) {
        return new FieldKey(insn.owner, insn.name, insn.desc);
    }

    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public String getDesc() {
        return desc;
    }

    public boolean matches(FieldInsnNode insn) {
        return owner.equals(insn.owner) && name.equals(insn.name) && desc.equals(insn.desc);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldKey)) return false;
        FieldKey other = (FieldKey) o;
        return owner.equals(other.owner) && name.equals(other.name) && desc.equals(other.desc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, name, desc);
    }

    @Override
    public String toString() {
        return owner + "." + name + ":" + desc;
    }
}
