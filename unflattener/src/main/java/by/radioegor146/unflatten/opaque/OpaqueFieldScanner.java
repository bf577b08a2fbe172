package by.radioegor146.unflatten.opaque;

import by.radioegor146.unflatten.DeobfuscatorConfig;
import by.radioegor146.unflatten.Diagnostics;
import by.radioegor146.unflatten.analysis.Insns;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * One-time scan of the module types for int fields that an initializer assigns through the
 * singleton instance, e.g. {@code GETSTATIC Module.INSTANCE; ICONST_5; ICONST_3; IADD; PUTFIELD Module.a:I}.
 */
public final class OpaqueFieldScanner implements Opcodes {

    private static final Logger logger = LoggerFactory.getLogger(OpaqueFieldScanner.class);

    private final DeobfuscatorConfig config;
    private final Diagnostics diagnostics;

    public OpaqueFieldScanner(DeobfuscatorConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public OpaqueFieldTable scan(Collection<ClassNode> classes) {
        OpaqueFieldTable table = new OpaqueFieldTable();
        for (ClassNode cn : classes) {
            if (!config.isModuleType(cn.name) || cn.fields.size() < config.getMinModuleFields()) {
                continue;
            }
            FieldNode singleton = findSingleton(cn);
            if (singleton == null) {
                logger.debug("Module type {} has no singleton field", cn.name);
                continue;
            }
            MethodNode init = findInitializer(cn);
            if (init == null) {
                logger.debug("Module type {} has no initializer", cn.name);
                continue;
            }
            diagnostics.detail("Module type {}: singleton {}, initializer {}{}", cn.name, singleton.name, init.name, init.desc);
            FieldKey singletonKey = new FieldKey(cn.name, singleton.name, singleton.desc);
            table.addSingleton(singletonKey);
            scanInitializer(cn, singletonKey, init, table);
        }
        invalidateForeignStores(classes, table);

        if (table.isEmpty()) {
            diagnostics.summary("Opaque field scan: no opaque predicate fields detected");
        } else {
            diagnostics.summary("Opaque field scan: {} fields ({} with value), score {}",
                    table.size(), table.resolvedCount(), table.detectionScore());
        }
        return table;
    }

    private static FieldNode findSingleton(ClassNode cn) {
        String selfDesc = "L" + cn.name + ";";
        for (FieldNode field : cn.fields) {
            if ((field.access & ACC_STATIC) != 0 && selfDesc.equals(field.desc)) {
                return field;
            }
        }
        return null;
    }

    private MethodNode findInitializer(ClassNode cn) {
        for (MethodNode method : cn.methods) {
            if (method.instructions == null) continue;
            int stores = 0;
            boolean storesOwnInt = false;
            for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
                if (insn.getOpcode() == PUTFIELD) {
                    stores++;
                    if (isOwnIntField(cn, (FieldInsnNode) insn)) {
                        storesOwnInt = true;
                    }
                }
            }
            if (storesOwnInt && stores > config.getInitializerStoreThreshold()) {
                return method;
            }
        }
        return null;
    }

    private static boolean isOwnIntField(ClassNode cn, FieldInsnNode insn) {
        if (!cn.name.equals(insn.owner) || !"I".equals(insn.desc)) {
            return false;
        }
        for (FieldNode field : cn.fields) {
            if (field.name.equals(insn.name) && field.desc.equals(insn.desc) && (field.access & ACC_STATIC) == 0) {
                return true;
            }
        }
        return false;
    }

    private void scanInitializer(ClassNode cn, FieldKey singleton, MethodNode init, OpaqueFieldTable table) {
        List<AbstractInsnNode> real = new ArrayList<>();
        for (AbstractInsnNode insn = init.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (Insns.isReal(insn)) real.add(insn);
        }

        for (int i = 0; i < real.size(); i++) {
            if (real.get(i).getOpcode() != PUTFIELD) continue;
            FieldInsnNode store = (FieldInsnNode) real.get(i);
            if (!isOwnIntField(cn, store)) continue;

            boolean found = false;
            List<AbstractInsnNode> expression = new ArrayList<>();
            for (int j = Math.max(0, i - config.getBackwardSearchWindow()); j < i; j++) {
                AbstractInsnNode cur = real.get(j);
                if (cur.getOpcode() == GETSTATIC && singleton.matches((FieldInsnNode) cur)) {
                    found = true;
                    expression.clear();
                    continue;
                }
                if (found && Insns.isConstantArithmetic(cur)) {
                    expression.add(cur);
                }
            }
            if (!found) continue;

            FieldKey key = FieldKey.of(store);
            OptionalInt value = ConstantInterpreter.evaluate(expression);
            OpaqueField previous = table.get(key);
            OpaqueField field;
            if (previous == null) {
                field = new OpaqueField(key, value.isPresent() ? value.getAsInt() : null);
            } else if (previous.getValue().equals(value)) {
                continue;
            } else {
                // assigned twice with different results
                field = OpaqueField.unresolved(key);
            }
            table.put(field);
            diagnostics.detail("  opaque field {}", field);
        }
    }

    /** A field written anywhere outside the scanned initializers is not constant. */
    private void invalidateForeignStores(Collection<ClassNode> classes, OpaqueFieldTable table) {
        if (table.isEmpty()) return;
        for (ClassNode cn : classes) {
            boolean moduleType = config.isModuleType(cn.name);
            for (MethodNode method : cn.methods) {
                if (method.instructions == null) continue;
                if (moduleType && isScannedInitializer(cn, method)) continue;
                for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
                    if (insn.getOpcode() != PUTFIELD) continue;
                    FieldKey key = FieldKey.of((FieldInsnNode) insn);
                    OpaqueField field = table.get(key);
                    if (field != null && field.isResolved()) {
                        logger.debug("Opaque field {} is also written by {}.{}{}", key, cn.name, method.name, method.desc);
                        table.put(OpaqueField.unresolved(key));
                    }
                }
            }
        }
    }

    private boolean isScannedInitializer(ClassNode cn, MethodNode method) {
        return cn.fields.size() >= config.getMinModuleFields()
                && findSingleton(cn) != null
                && findInitializer(cn) == method;
    }
}
