package by.radioegor146.unflatten.opaque;

import by.radioegor146.unflatten.Diagnostics;
import by.radioegor146.unflatten.analysis.Insns;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.*;

/**
 * References to opaque fields that are still present in the module, collected after processing.
 */
public final class OpaqueReferenceReport {

    public static final class Reference {
        private final String location;
        private final OpaqueLoads.Form form;
        private final OpaqueField field;

        Reference(String location, OpaqueLoads.Form form, OpaqueField field) {
            this.location = location;
            this.form = form;
            this.field = field;
        }

        public String getLocation() {
            return location;
        }

        public OpaqueLoads.Form getForm() {
            return form;
        }

        public OpaqueField getField() {
            return field;
        }

        @Override
        public String toString() {
            return form + " " + location + " -> " + field;
        }
    }

    private final List<Reference> references;

    private OpaqueReferenceReport(List<Reference> references) {
        this.references = references;
    }

    public static OpaqueReferenceReport collect(Collection<ClassNode> classes, OpaqueLoads loads) {
        List<Reference> out = new ArrayList<>();
        if (loads.getTable().isEmpty()) {
            return new OpaqueReferenceReport(out);
        }
        for (ClassNode cn : classes) {
            for (MethodNode method : cn.methods) {
                if (method.instructions == null || method.instructions.size() == 0) continue;
                List<AbstractInsnNode> real = new ArrayList<>();
                for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
                    if (Insns.isReal(insn)) real.add(insn);
                }
                String where = cn.name + "." + method.name + method.desc;
                for (int i = 0; i < real.size(); i++) {
                    OpaqueLoads.Match match = loads.match(real, i);
                    if (match != null) {
                        out.add(new Reference(where + " #" + i, match.getForm(), match.getField()));
                        i += match.getLength() - 1;
                    } else if (real.get(i).getOpcode() == Opcodes.GETFIELD) {
                        OpaqueField field = loads.opaqueField((FieldInsnNode) real.get(i));
                        if (field != null) {
                            out.add(new Reference(where + " #" + i, OpaqueLoads.Form.DIRECT, field));
                        }
                    }
                }
            }
        }
        return new OpaqueReferenceReport(out);
    }

    public List<Reference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public Map<OpaqueLoads.Form, Integer> countByForm() {
        Map<OpaqueLoads.Form, Integer> counts = new EnumMap<>(OpaqueLoads.Form.class);
        for (Reference reference : references) {
            counts.merge(reference.getForm(), 1, Integer::sum);
        }
        return counts;
    }

    public void log(Diagnostics diagnostics, int replacedLoads) {
        for (Reference reference : references) {
            diagnostics.detail("  remaining opaque reference {}", reference);
        }
        if (references.isEmpty()) {
            diagnostics.summary("No remaining opaque field references");
        } else {
            diagnostics.summary("{} remaining opaque field references {}", references.size(), countByForm());
        }
        diagnostics.summary("Opaque field loads replaced: {}", replacedLoads);
    }
}
