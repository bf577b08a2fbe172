package by.radioegor146.unflatten.analysis;

import by.radioegor146.unflatten.blocks.BlockGraph;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReachabilityAnalyzerTest implements Opcodes {

    /**
     * B0 jumps over B1 to B2, B1 is dead. B2 is covered by a handler at B3.
     */
    private static MethodNode deadBlockWithHandler() {
        MethodNode mn = new MethodNode(ACC_STATIC, "m", "()I", null, null);
        LabelNode start = new LabelNode();
        LabelNode dead = new LabelNode();
        LabelNode live = new LabelNode();
        LabelNode handler = new LabelNode();
        mn.instructions.add(start);
        mn.instructions.add(new JumpInsnNode(GOTO, live));
        mn.instructions.add(dead);
        mn.instructions.add(new InsnNode(ICONST_1));
        mn.instructions.add(new InsnNode(IRETURN));
        mn.instructions.add(live);
        mn.instructions.add(new InsnNode(ICONST_2));
        mn.instructions.add(new InsnNode(IRETURN));
        mn.instructions.add(handler);
        mn.instructions.add(new InsnNode(POP));
        mn.instructions.add(new InsnNode(ICONST_3));
        mn.instructions.add(new InsnNode(IRETURN));
        mn.tryCatchBlocks.add(new TryCatchBlockNode(live, handler, handler, null));
        return mn;
    }

    @Test
    public void testDeadBlockIsUnreachable() {
        BlockGraph graph = BlockGraph.build(deadBlockWithHandler());
        ReachabilityReport report = ReachabilityAnalyzer.analyze(graph);

        assertEquals(4, report.size());
        assertTrue(report.isReachable(0));
        assertFalse(report.isReachable(1));
        assertTrue(report.isReachable(2));
        assertEquals(List.of(1, 3), report.unreachableBlocks());
    }

    @Test
    public void testHandlersAreEnteredWhenCoveredBlockIsReachable() {
        BlockGraph graph = BlockGraph.build(deadBlockWithHandler());
        ReachabilityReport report = ReachabilityAnalyzer.analyze(graph, true);

        assertTrue(report.isReachable(3));
        assertEquals(List.of(1), report.unreachableBlocks());
        assertEquals(3, report.reachableCount());
    }

    @Test
    public void testBlocksWithoutObservableEffectAreEmpty() {
        BlockGraph graph = BlockGraph.build(deadBlockWithHandler());
        ReachabilityReport report = ReachabilityAnalyzer.analyze(graph);

        // B0 only held a GOTO, returns count as observable
        assertTrue(report.isEmpty(0));
        assertFalse(report.isEmpty(2));
        assertEquals(1, report.emptyCount());
    }
}
