package by.radioegor146.unflatten.opaque;

import by.radioegor146.unflatten.analysis.Insns;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recognizes the instruction sequences that read an opaque field:
 * <ul>
 *     <li>{@code GETSTATIC S; GETFIELD F}</li>
 *     <li>{@code INVOKESTATIC m()I} where {@code m} is {@code GETSTATIC S; GETFIELD F; IRETURN}</li>
 *     <li>{@code GETSTATIC S; INVOKEVIRTUAL m()I} where {@code m} is {@code ALOAD 0; GETFIELD F; IRETURN}</li>
 * </ul>
 */
public final class OpaqueLoads implements Opcodes {

    public enum Form {
        DIRECT,
        STATIC_GETTER,
        INSTANCE_GETTER
    }

    /** A matched load: {@code length} real instructions starting at the match index. */
    public static final class Match {
        private final Form form;
        private final int length;
        private final OpaqueField field;

        Match(Form form, int length, OpaqueField field) {
            this.form = form;
            this.length = length;
            this.field = field;
        }

        public Form getForm() {
            return form;
        }

        public int getLength() {
            return length;
        }

        public OpaqueField getField() {
            return field;
        }
    }

    private final OpaqueFieldTable table;
    private final MemberResolver resolver;
    private final Map<MethodNode, FieldKey> getters = new HashMap<>();

    /**
     * Getter bodies are indexed here, before any method is rewritten, so a getter whose own load was
     * inlined still counts as a getter.
     */
    public OpaqueLoads(OpaqueFieldTable table, MemberResolver resolver) {
        this.table = table;
        this.resolver = resolver;
        if (table.isEmpty()) {
            return;
        }
        for (ClassNode cn : resolver.getClasses()) {
            for (MethodNode method : cn.methods) {
                if (!"()I".equals(method.desc)) continue;
                FieldKey key = getterBodyField(method, (method.access & ACC_STATIC) != 0);
                if (key != null) {
                    getters.put(method, key);
                }
            }
        }
    }

    public OpaqueFieldTable getTable() {
        return table;
    }

    public MemberResolver getResolver() {
        return resolver;
    }

    /**
     * @param real  real instructions only
     * @param index position of the first instruction of the candidate sequence
     * @return the match, or null
     */
    public Match match(List<AbstractInsnNode> real, int index) {
        if (table.isEmpty() || index >= real.size()) {
            return null;
        }
        AbstractInsnNode first = real.get(index);
        AbstractInsnNode second = index + 1 < real.size() ? real.get(index + 1) : null;

        if (first.getOpcode() == GETSTATIC && table.isSingletonLoad((FieldInsnNode) first) && second != null) {
            if (second.getOpcode() == GETFIELD) {
                OpaqueField field = opaqueField((FieldInsnNode) second);
                return field == null ? null : new Match(Form.DIRECT, 2, field);
            }
            if (second.getOpcode() == INVOKEVIRTUAL) {
                OpaqueField field = getterField((MethodInsnNode) second, false);
                return field == null ? null : new Match(Form.INSTANCE_GETTER, 2, field);
            }
            return null;
        }
        if (first.getOpcode() == INVOKESTATIC) {
            OpaqueField field = getterField((MethodInsnNode) first, true);
            return field == null ? null : new Match(Form.STATIC_GETTER, 1, field);
        }
        return null;
    }

    /** The opaque field a {@code GETFIELD} reads, or null. */
    public OpaqueField opaqueField(FieldInsnNode insn) {
        if (insn.getOpcode() != GETFIELD || !"I".equals(insn.desc)) {
            return null;
        }
        return table.get(resolver.resolveField(insn.owner, insn.name, insn.desc));
    }

    private OpaqueField getterField(MethodInsnNode call, boolean isStatic) {
        if (!"()I".equals(call.desc)) {
            return null;
        }
        MethodNode target = resolver.resolveMethod(call.owner, call.name, call.desc);
        if (target == null || ((target.access & ACC_STATIC) != 0) != isStatic) {
            return null;
        }
        return table.get(getters.get(target));
    }

    private FieldKey getterBodyField(MethodNode getter, boolean isStatic) {
        if (getter.instructions == null) {
            return null;
        }
        List<AbstractInsnNode> body = new ArrayList<>();
        for (AbstractInsnNode insn = getter.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (Insns.isReal(insn) && insn.getOpcode() != NOP) {
                body.add(insn);
            }
        }
        if (body.size() != 3 || body.get(1).getOpcode() != GETFIELD || body.get(2).getOpcode() != IRETURN) {
            return null;
        }
        AbstractInsnNode receiver = body.get(0);
        if (isStatic) {
            if (receiver.getOpcode() != GETSTATIC || !table.isSingletonLoad((FieldInsnNode) receiver)) {
                return null;
            }
        } else if (receiver.getOpcode() != ALOAD || ((VarInsnNode) receiver).var != 0) {
            return null;
        }
        FieldInsnNode load = (FieldInsnNode) body.get(1);
        return resolver.resolveField(load.owner, load.name, load.desc);
    }
}
