package by.radioegor146.unflatten.analysis;

import by.radioegor146.unflatten.ObfuscatedSamples;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.opaque.*;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConstantPropagatorTest implements Opcodes {

    /** Local 1 is set to 1, then to 2 or 3 on two paths that join. */
    private static MethodNode diamond() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "(I)I", null, null);
        LabelNode left = new LabelNode();
        LabelNode right = new LabelNode();
        LabelNode join = new LabelNode();
        InsnList il = mn.instructions;
        il.add(new LabelNode());
        il.add(new InsnNode(ICONST_1));
        il.add(new VarInsnNode(ISTORE, 1));
        il.add(new VarInsnNode(ILOAD, 0));
        il.add(new JumpInsnNode(IFEQ, right));
        il.add(left);
        il.add(new InsnNode(ICONST_2));
        il.add(new VarInsnNode(ISTORE, 1));
        il.add(new JumpInsnNode(GOTO, join));
        il.add(right);
        il.add(new InsnNode(ICONST_3));
        il.add(new VarInsnNode(ISTORE, 1));
        il.add(join);
        il.add(new VarInsnNode(ILOAD, 1));
        il.add(new InsnNode(IRETURN));
        return mn;
    }

    /** Local 1 starts at 0 and is set to 5 on the back edge of a loop. */
    private static MethodNode loop() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "()I", null, null);
        LabelNode head = new LabelNode();
        LabelNode body = new LabelNode();
        LabelNode exit = new LabelNode();
        InsnList il = mn.instructions;
        il.add(new LabelNode());
        il.add(new InsnNode(ICONST_0));
        il.add(new VarInsnNode(ISTORE, 1));
        il.add(head);
        il.add(new VarInsnNode(ILOAD, 1));
        il.add(new JumpInsnNode(IFNE, exit));
        il.add(body);
        il.add(new InsnNode(ICONST_5));
        il.add(new VarInsnNode(ISTORE, 1));
        il.add(new JumpInsnNode(GOTO, head));
        il.add(exit);
        il.add(new VarInsnNode(ILOAD, 1));
        il.add(new InsnNode(IRETURN));
        return mn;
    }

    @Test
    public void testValuesFromBothPathsReachTheJoin() {
        BlockGraph graph = BlockGraph.build(diamond());
        PropagationResult result = new ConstantPropagator(null).propagate(graph);

        assertEquals(Set.of(1), result.entryOf(1).get(1));
        assertEquals(Set.of(1, 2), result.exitOf(1).get(1));
        assertEquals(Set.of(1, 2, 3), result.entryOf(3).get(1));
        assertEquals(4, result.visitedCount());
    }

    @Test
    public void testEntryBlockStartsEmpty() {
        BlockGraph graph = BlockGraph.build(diamond());
        PropagationResult result = new ConstantPropagator(null).propagate(graph);

        assertTrue(result.entryOf(0).isEmpty());
        assertFalse(result.entryOf(0).isTracked(1));
    }

    @Test
    public void testProcessedBlocksAreNotRevisited() {
        BlockGraph graph = BlockGraph.build(loop());
        PropagationResult result = new ConstantPropagator(null).propagate(graph);

        assertEquals(Set.of(0), result.entryOf(1).get(1));
        assertEquals(Set.of(0, 5), result.exitOf(2).get(1));
        assertEquals(Set.of(0), result.entryOf(3).get(1));
    }

    @Test
    public void testUnreachedHandlerIsSeededEmpty() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "()I", null, null);
        LabelNode start = new LabelNode();
        LabelNode end = new LabelNode();
        LabelNode handler = new LabelNode();
        mn.instructions.add(start);
        mn.instructions.add(new InsnNode(ICONST_4));
        mn.instructions.add(new VarInsnNode(ISTORE, 0));
        mn.instructions.add(new VarInsnNode(ILOAD, 0));
        mn.instructions.add(new InsnNode(IRETURN));
        mn.instructions.add(end);
        mn.instructions.add(handler);
        mn.instructions.add(new InsnNode(ICONST_1));
        mn.instructions.add(new VarInsnNode(ISTORE, 0));
        mn.instructions.add(new InsnNode(ACONST_NULL));
        mn.instructions.add(new InsnNode(ATHROW));
        mn.tryCatchBlocks.add(new TryCatchBlockNode(start, end, handler, null));

        BlockGraph graph = BlockGraph.build(mn);
        PropagationResult result = new ConstantPropagator(null).propagate(graph);
        int handlerBlock = graph.getRegions().get(0).getHandlerBlock();

        assertTrue(result.isVisited(handlerBlock));
        assertTrue(result.entryOf(handlerBlock).isEmpty());
        assertEquals(Set.of(1), result.exitOf(handlerBlock).get(0));
    }

    @Test
    public void testResolvedOpaqueLoadCountsAsConstant() {
        ClassNode module = ObfuscatedSamples.module();
        OpaqueFieldTable table = new OpaqueFieldTable();
        table.addSingleton(new FieldKey(module.name, "INSTANCE", ObfuscatedSamples.MODULE_DESC));
        table.put(new OpaqueField(new FieldKey(module.name, "f0", "I"), 8));
        OpaqueLoads loads = new OpaqueLoads(table, new MemberResolver(Map.of(module.name, module)));

        MethodNode mn = new MethodNode(ACC_STATIC, "m", "()I", null, null);
        mn.instructions.add(new FieldInsnNode(GETSTATIC, module.name, "INSTANCE", ObfuscatedSamples.MODULE_DESC));
        mn.instructions.add(new FieldInsnNode(GETFIELD, module.name, "f0", "I"));
        mn.instructions.add(new VarInsnNode(ISTORE, 1));
        mn.instructions.add(new VarInsnNode(ILOAD, 1));
        mn.instructions.add(new InsnNode(IRETURN));

        BlockGraph graph = BlockGraph.build(mn);
        assertEquals(Set.of(8), new ConstantPropagator(loads).propagate(graph).exitOf(0).get(1));
        assertFalse(new ConstantPropagator(null).propagate(graph).exitOf(0).isTracked(1));
    }

    @Test
    public void testCensusFindsStateVariableAndLoopHead() {
        MethodCensus diamond = MethodCensus.of(BlockGraph.build(diamond()), null);
        assertEquals(Set.of(1, 2, 3), diamond.getStateVariables().get(1));
        assertTrue(diamond.getLoopHeads().isEmpty());

        MethodCensus loop = MethodCensus.of(BlockGraph.build(loop()), null);
        assertTrue(loop.getStateVariables().isEmpty());
        assertEquals(Map.of(1, 1), loop.getLoopHeads());
        assertEquals(0, loop.getOpaqueBranches());
    }

    @Test
    public void testNonConstantStoreMakesSlotUnknown() {
        BlockGraph graph = BlockGraph.build(ObfuscatedSamples.checkAsync());
        PropagationResult result = new ConstantPropagator(null).propagate(graph);

        LocalConstants atCompare = result.entryOf(1);
        assertEquals(Set.of(5), atCompare.get(1));
        assertTrue(atCompare.isUnknown(1));
        assertFalse(atCompare.isTracked(1));
    }

    @Test
    public void testIncrementOnBackEdgeMakesSlotUnknownAtLoopHead() {
        BlockGraph graph = BlockGraph.build(ObfuscatedSamples.countAsync());
        PropagationResult result = new ConstantPropagator(null).propagate(graph);

        // the increment sits in a block processed after the loop head
        assertFalse(result.entryOf(1).isTracked(1));
        assertFalse(result.entryOf(2).isTracked(1));
        assertTrue(result.entryOf(2).isUnknown(2));
    }

    @Test
    public void testUnknownSurvivesMerge() {
        LocalConstants constant = new LocalConstants();
        constant.add(3, 7);
        LocalConstants clobbered = new LocalConstants();
        clobbered.markUnknown(3);

        assertTrue(constant.mergeFrom(clobbered));
        assertFalse(constant.isTracked(3));
        assertFalse(constant.mergeFrom(clobbered));

        LocalConstants copy = new LocalConstants(constant);
        copy.add(3, 8);
        assertTrue(copy.isUnknown(3));
        assertFalse(copy.isTracked(3));
    }

    @Test
    public void testWideStoreClobbersBothSlots() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "(J)V", null, null);
        mn.instructions.add(new InsnNode(ICONST_1));
        mn.instructions.add(new VarInsnNode(ISTORE, 3));
        mn.instructions.add(new VarInsnNode(LLOAD, 0));
        mn.instructions.add(new VarInsnNode(LSTORE, 2));
        mn.instructions.add(new InsnNode(RETURN));

        LocalConstants exit = new ConstantPropagator(null).propagate(BlockGraph.build(mn)).exitOf(0);
        assertTrue(exit.isUnknown(2));
        assertTrue(exit.isUnknown(3));
        assertFalse(exit.isTracked(3));
    }
}
