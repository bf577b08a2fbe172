package by.radioegor146.unflatten.analysis;

import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.blocks.HandlerRegion;
import org.objectweb.asm.tree.AbstractInsnNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Breadth-first traversal from the entry block over fall-through and target edges.
 */
public final class ReachabilityAnalyzer {

    private ReachabilityAnalyzer() {
    }

    public static ReachabilityReport analyze(BlockGraph graph) {
        return analyze(graph, false);
    }

    /**
     * @param followHandlers also enter the handler of every region that covers a reached block
     */
    public static ReachabilityReport analyze(BlockGraph graph, boolean followHandlers) {
        boolean[] reachable = new boolean[graph.size()];
        boolean[] empty = new boolean[graph.size()];

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        reachable[0] = true;
        boolean grew = true;
        while (grew) {
            while (!queue.isEmpty()) {
                Block block = graph.get(queue.poll());
                for (int succ : block.successors()) {
                    if (!reachable[succ]) {
                        reachable[succ] = true;
                        queue.add(succ);
                    }
                }
            }
            grew = false;
            if (followHandlers) {
                for (HandlerRegion region : graph.getRegions()) {
                    int handler = region.getHandlerBlock();
                    if (reachable[handler]) continue;
                    for (int b = region.getStartBlock(); b < region.getEndBlock(); b++) {
                        if (reachable[b]) {
                            reachable[handler] = true;
                            queue.add(handler);
                            grew = true;
                            break;
                        }
                    }
                }
            }
        }

        for (int i = 0; i < graph.size(); i++) {
            empty[i] = true;
            for (AbstractInsnNode insn : graph.get(i).getInstructions()) {
                if (Insns.isReal(insn) && Insns.hasObservableEffect(insn)) {
                    empty[i] = false;
                    break;
                }
            }
        }
        return new ReachabilityReport(reachable, empty);
    }
}
