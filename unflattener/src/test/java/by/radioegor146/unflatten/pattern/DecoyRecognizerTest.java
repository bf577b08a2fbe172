package by.radioegor146.unflatten.pattern;

import by.radioegor146.unflatten.DeobfuscatorConfig;
import by.radioegor146.unflatten.ObfuscatedSamples;
import by.radioegor146.unflatten.analysis.ConstantPropagator;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DecoyRecognizerTest implements Opcodes {

    private static final DecoyRecognizer recognizer = new DecoyRecognizer(DeobfuscatorConfig.DEFAULT_SENTINEL);

    private static BlockGraph computeAsync() {
        MethodNode mn = ObfuscatedSamples.method(ObfuscatedSamples.target(), "computeAsync");
        return BlockGraph.build(mn);
    }

    private static List<Decoy> recognize(BlockGraph graph) {
        return recognizer.recognize(graph, new ConstantPropagator(null).propagate(graph));
    }

    @Test
    public void testFlattenedMethodDecoys() {
        List<Decoy> decoys = recognize(computeAsync());
        assertEquals(3, decoys.size(), decoys.toString());

        Decoy dispatch = decoys.get(0);
        assertEquals(DecoyKind.DISPATCH_SWITCH, dispatch.getKind());
        assertEquals(1, dispatch.getBlock());
        assertEquals(Map.of(0, 2, 2, 3), dispatch.getRoutes());
        assertTrue(dispatch.isRemovable());
        assertEquals(Block.NONE, dispatch.getSuccessor());

        Decoy compare = decoys.get(1);
        assertEquals(DecoyKind.CONSTANT_COMPARE_BRANCH, compare.getKind());
        assertEquals(3, compare.getBlock());
        assertEquals(5, compare.getSuccessor());

        Decoy sentinel = decoys.get(2);
        assertEquals(DecoyKind.SENTINEL_RETURN_COMPARE, sentinel.getKind());
        assertEquals(5, sentinel.getBlock());
        assertEquals(7, sentinel.getSuccessor());
    }

    @Test
    public void testCompareAgainstUnseenConstantIsKept() {
        BlockGraph graph = computeAsync();
        ((IntInsnNode) graph.get(3).realInstructions().get(1)).operand = 12;

        List<Decoy> decoys = recognize(graph);
        assertTrue(decoys.stream().noneMatch(d -> d.getBlock() == 3));
    }

    @Test
    public void testCompareOnUntrackedLocalIsKept() {
        BlockGraph graph = computeAsync();
        ((VarInsnNode) graph.get(3).realInstructions().get(0)).var = 0;

        List<Decoy> decoys = recognize(graph);
        assertTrue(decoys.stream().noneMatch(d -> d.getBlock() == 3));
    }

    @Test
    public void testSentinelIsConfigurable() {
        BlockGraph graph = computeAsync();
        List<Decoy> decoys = new DecoyRecognizer(1000).recognize(graph, new ConstantPropagator(null).propagate(graph));
        // 992 is still a tracked constant of local 2
        Decoy fifth = decoys.stream().filter(d -> d.getBlock() == 5).findFirst().orElseThrow();
        assertEquals(DecoyKind.CONSTANT_COMPARE_BRANCH, fifth.getKind());
    }

    @Test
    public void testDispatchWithUnroutedPredecessorIsNotRemovable() {
        BlockGraph graph = computeAsync();
        // case 1 stores a computed state instead of a constant
        List<AbstractInsnNode> insns = graph.get(2).getInstructions();
        AbstractInsnNode stateConstant = graph.get(2).realInstructions().get(5);
        insns.set(insns.indexOf(stateConstant), new VarInsnNode(ILOAD, 0));

        Decoy dispatch = recognize(graph).get(0);
        assertEquals(DecoyKind.DISPATCH_SWITCH, dispatch.getKind());
        assertEquals(Map.of(0, 2), dispatch.getRoutes());
        assertFalse(dispatch.isRemovable());
    }

    @Test
    public void testLastConstantStoreWins() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "()V", null, null);
        mn.instructions.add(new InsnNode(ICONST_1));
        mn.instructions.add(new VarInsnNode(ISTORE, 1));
        mn.instructions.add(new InsnNode(ICONST_4));
        mn.instructions.add(new VarInsnNode(ISTORE, 1));
        mn.instructions.add(new InsnNode(RETURN));
        Block block = BlockGraph.build(mn).entry();
        assertEquals(4, DecoyRecognizer.lastConstantStore(block, 1));
        assertNull(DecoyRecognizer.lastConstantStore(block, 2));

        mn.instructions.insertBefore(mn.instructions.getLast(), new IincInsnNode(1, 1));
        assertNull(DecoyRecognizer.lastConstantStore(BlockGraph.build(mn).entry(), 1));
    }

    @Test
    public void testLookupSwitchCaseTarget() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "(I)I", null, null);
        LabelNode a = new LabelNode();
        LabelNode b = new LabelNode();
        LabelNode dflt = new LabelNode();
        mn.instructions.add(new VarInsnNode(ILOAD, 0));
        mn.instructions.add(new LookupSwitchInsnNode(dflt, new int[]{10, 20}, new LabelNode[]{a, b}));
        for (LabelNode label : List.of(a, b, dflt)) {
            mn.instructions.add(label);
            mn.instructions.add(new InsnNode(ICONST_0));
            mn.instructions.add(new InsnNode(IRETURN));
        }
        BlockGraph graph = BlockGraph.build(mn);
        Block entry = graph.entry();
        AbstractInsnNode lookup = entry.lastReal();

        assertEquals(2, DecoyRecognizer.caseTarget(entry, lookup, 20));
        assertEquals(1, DecoyRecognizer.caseTarget(entry, lookup, 10));
        assertEquals(3, DecoyRecognizer.caseTarget(entry, lookup, 15));
    }

    @Test
    public void testInitializationNoopBlock() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "(I)I", null, null);
        LabelNode end = new LabelNode();
        mn.instructions.add(new VarInsnNode(ILOAD, 0));
        mn.instructions.add(new JumpInsnNode(IFEQ, end));
        mn.instructions.add(new InsnNode(ICONST_5));
        mn.instructions.add(new VarInsnNode(ISTORE, 4));
        mn.instructions.add(new InsnNode(NOP));
        mn.instructions.add(end);
        mn.instructions.add(new InsnNode(ICONST_0));
        mn.instructions.add(new InsnNode(IRETURN));

        List<Decoy> noops = recognizer.recognizeInitializationNoops(BlockGraph.build(mn));
        assertEquals(1, noops.size());
        assertEquals(DecoyKind.INITIALIZATION_NOOP, noops.get(0).getKind());
        assertEquals(1, noops.get(0).getBlock());
        assertEquals(2, noops.get(0).getSuccessor());
    }

    @Test
    public void testStoreToReadLocalIsNotANoop() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "(I)I", null, null);
        LabelNode end = new LabelNode();
        mn.instructions.add(new VarInsnNode(ILOAD, 0));
        mn.instructions.add(new JumpInsnNode(IFEQ, end));
        mn.instructions.add(new InsnNode(ICONST_5));
        mn.instructions.add(new VarInsnNode(ISTORE, 0));
        mn.instructions.add(end);
        mn.instructions.add(new InsnNode(ICONST_0));
        mn.instructions.add(new InsnNode(IRETURN));

        assertTrue(recognizer.recognizeInitializationNoops(BlockGraph.build(mn)).isEmpty());
    }

    @Test
    public void testDispatchDecoysCannotRedirect() {
        assertThrows(IllegalArgumentException.class, () -> Decoy.redirect(1, DecoyKind.DISPATCH_SWITCH, 2));
    }

    @Test
    public void testCompareOnLocalWithRuntimeValueIsKept() {
        assertTrue(recognize(BlockGraph.build(ObfuscatedSamples.checkAsync())).isEmpty());
        assertTrue(recognize(BlockGraph.build(ObfuscatedSamples.countAsync())).isEmpty());
    }

    @Test
    public void testSentinelCompareOnLocalWithRuntimeValueIsKept() {
        MethodNode mn = ObfuscatedSamples.checkAsync();
        for (AbstractInsnNode insn : mn.instructions.toArray()) {
            if (insn.getOpcode() == ICONST_5) {
                mn.instructions.set(insn, new IntInsnNode(SIPUSH, DeobfuscatorConfig.DEFAULT_SENTINEL));
            }
        }
        assertTrue(recognize(BlockGraph.build(mn)).isEmpty());
    }
}
