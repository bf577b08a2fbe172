package by.radioegor146.unflatten.opaque;

import by.radioegor146.unflatten.DeobfuscatorConfig;
import by.radioegor146.unflatten.Diagnostics;
import by.radioegor146.unflatten.ObfuscatedSamples;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.*;

import static by.radioegor146.unflatten.ObfuscatedSamples.MODULE;
import static by.radioegor146.unflatten.ObfuscatedSamples.MODULE_DESC;
import static org.junit.jupiter.api.Assertions.*;

public class OpaqueFieldScannerTest implements Opcodes {

    private static OpaqueFieldTable scan(DeobfuscatorConfig config, ClassNode... classes) {
        return new OpaqueFieldScanner(config, new Diagnostics(config.getVerbosity())).scan(List.of(classes));
    }

    private static FieldKey field(int i) {
        return new FieldKey(MODULE, "f" + i, "I");
    }

    @Test
    public void testInitializerValuesAreResolved() {
        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), ObfuscatedSamples.module(), ObfuscatedSamples.target());

        assertEquals(ObfuscatedSamples.FIELD_COUNT, table.size());
        for (int i = 0; i < ObfuscatedSamples.FIELD_COUNT - 1; i++) {
            assertEquals(OptionalInt.of(ObfuscatedSamples.fieldValue(i)), table.get(field(i)).getValue(), "f" + i);
        }
        assertEquals(10 * ObfuscatedSamples.FIELD_COUNT, table.detectionScore());
    }

    @Test
    public void testFieldWrittenElsewhereIsUnresolved() {
        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), ObfuscatedSamples.module());

        OpaqueField reset = table.get(field(ObfuscatedSamples.FIELD_COUNT - 1));
        assertNotNull(reset);
        assertFalse(reset.isResolved());
        assertTrue(table.isOpaque(reset.getKey()));
        assertEquals(ObfuscatedSamples.FIELD_COUNT - 1, table.resolvedCount());
    }

    @Test
    public void testSingletonIsRegistered() {
        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), ObfuscatedSamples.module());
        assertTrue(table.isSingletonLoad(new FieldInsnNode(GETSTATIC, MODULE, "INSTANCE", MODULE_DESC)));
        assertFalse(table.isSingletonLoad(new FieldInsnNode(GETSTATIC, MODULE, "other", MODULE_DESC)));
    }

    @Test
    public void testTypesOutsideThePatternAreIgnored() {
        DeobfuscatorConfig config = new DeobfuscatorConfig.Builder().setModuleTypePattern("Holder").build();
        assertTrue(scan(config, ObfuscatedSamples.module()).isEmpty());
    }

    @Test
    public void testFewStoresMeanNoInitializer() {
        DeobfuscatorConfig config = new DeobfuscatorConfig.Builder().setInitializerStoreThreshold(50).build();
        assertTrue(scan(config, ObfuscatedSamples.module()).isEmpty());
    }

    @Test
    public void testDivisionByZeroLeavesFieldUnresolved() {
        ClassNode module = ObfuscatedSamples.module();
        MethodNode clinit = ObfuscatedSamples.method(module, "<clinit>");
        // f0 = 5 / 0
        for (AbstractInsnNode insn : clinit.instructions.toArray()) {
            if (insn.getOpcode() == IADD) {
                clinit.instructions.set(insn, new InsnNode(IDIV));
            } else if (insn.getOpcode() == ICONST_3) {
                clinit.instructions.set(insn, new InsnNode(ICONST_0));
            }
        }
        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), module);
        assertTrue(table.isOpaque(field(0)));
        assertFalse(table.get(field(0)).isResolved());
        assertTrue(table.get(field(1)).isResolved());
    }

    @Test
    public void testConflictingAssignmentsAreUnresolved() {
        ClassNode module = ObfuscatedSamples.module();
        InsnList il = ObfuscatedSamples.method(module, "<clinit>").instructions;
        InsnList again = new InsnList();
        again.add(new FieldInsnNode(GETSTATIC, MODULE, "INSTANCE", MODULE_DESC));
        again.add(new InsnNode(ICONST_4));
        again.add(new FieldInsnNode(PUTFIELD, MODULE, "f1", "I"));
        il.insertBefore(il.getLast(), again);

        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), module);
        assertFalse(table.get(field(1)).isResolved());
        assertTrue(table.get(field(0)).isResolved());
    }

    @Test
    public void testAllLoadFormsAreMatched() {
        ClassNode module = ObfuscatedSamples.module();
        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), module);
        OpaqueLoads loads = new OpaqueLoads(table, new MemberResolver(Map.of(MODULE, module)));

        List<AbstractInsnNode> direct = List.of(
                new FieldInsnNode(GETSTATIC, MODULE, "INSTANCE", MODULE_DESC),
                new FieldInsnNode(GETFIELD, MODULE, "f0", "I"));
        OpaqueLoads.Match match = loads.match(direct, 0);
        assertEquals(OpaqueLoads.Form.DIRECT, match.getForm());
        assertEquals(2, match.getLength());
        assertEquals(OptionalInt.of(8), match.getField().getValue());

        List<AbstractInsnNode> instance = List.of(
                new FieldInsnNode(GETSTATIC, MODULE, "INSTANCE", MODULE_DESC),
                new MethodInsnNode(INVOKEVIRTUAL, MODULE, "getF1", "()I", false));
        match = loads.match(instance, 0);
        assertEquals(OpaqueLoads.Form.INSTANCE_GETTER, match.getForm());
        assertEquals(OptionalInt.of(42), match.getField().getValue());

        List<AbstractInsnNode> statik = List.of(new MethodInsnNode(INVOKESTATIC, MODULE, "staticF2", "()I", false));
        match = loads.match(statik, 0);
        assertEquals(OpaqueLoads.Form.STATIC_GETTER, match.getForm());
        assertEquals(1, match.getLength());
        assertEquals(OptionalInt.of(-1), match.getField().getValue());

        List<AbstractInsnNode> unrelated = List.of(
                new FieldInsnNode(GETSTATIC, MODULE, "INSTANCE", MODULE_DESC),
                new MethodInsnNode(INVOKEVIRTUAL, MODULE, "reset", "()V", false));
        assertNull(loads.match(unrelated, 0));
    }

    @Test
    public void testReferenceReportCountsRemainingLoads() {
        ClassNode module = ObfuscatedSamples.module();
        ClassNode target = ObfuscatedSamples.target();
        Map<String, ClassNode> classes = new LinkedHashMap<>();
        classes.put(MODULE, module);
        classes.put(target.name, target);
        OpaqueFieldTable table = scan(DeobfuscatorConfig.defaults(), module, target);
        OpaqueLoads loads = new OpaqueLoads(table, new MemberResolver(classes));

        OpaqueReferenceReport report = OpaqueReferenceReport.collect(classes.values(), loads);
        Map<OpaqueLoads.Form, Integer> counts = report.countByForm();
        // Target.plain and Target.computeAsync
        assertEquals(1, counts.get(OpaqueLoads.Form.STATIC_GETTER));
        assertEquals(1, counts.get(OpaqueLoads.Form.INSTANCE_GETTER));
        // Target.plain plus the bodies of both getters
        assertEquals(3, counts.get(OpaqueLoads.Form.DIRECT));
    }
}
