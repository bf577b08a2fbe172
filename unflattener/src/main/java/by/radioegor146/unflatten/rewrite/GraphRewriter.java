package by.radioegor146.unflatten.rewrite;

import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.pattern.Decoy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Removes recognized decoys from a block graph.
 * <p>
 * Edges into a compare or no-op decoy are moved to its real successor (chains of decoys are followed,
 * cycles of decoys are left alone) and the decoy is cleared. Predecessors of a dispatch decoy are routed
 * to their case block; the dispatch block is cleared once nothing reaches it. Empty blocks are merged
 * afterwards.
 */
public final class GraphRewriter {

    private static final Logger logger = LoggerFactory.getLogger(GraphRewriter.class);

    private final EmptyBlockMerger merger;

    public GraphRewriter(EmptyBlockMerger merger) {
        this.merger = merger;
    }

    /** @return number of cleared decoy blocks */
    public int rewrite(BlockGraph graph, List<Decoy> decoys) {
        Map<Integer, Integer> redirects = new LinkedHashMap<>();
        List<Decoy> dispatches = new ArrayList<>();
        for (Decoy decoy : decoys) {
            switch (decoy.getKind()) {
                case CONSTANT_COMPARE_BRANCH:
                case SENTINEL_RETURN_COMPARE:
                case INITIALIZATION_NOOP:
                    redirects.put(decoy.getBlock(), decoy.getSuccessor());
                    break;
                case DISPATCH_SWITCH:
                    dispatches.add(decoy);
                    break;
                default:
                    throw new IllegalStateException("Unsupported decoy kind " + decoy.getKind());
            }
        }

        int cleared = 0;
        Map<Integer, Integer> resolved = resolveChains(redirects);
        for (int decoy : resolved.keySet()) {
            graph.get(decoy).clear();
            cleared++;
        }
        // resolved targets are never cleared decoys themselves
        for (Map.Entry<Integer, Integer> entry : resolved.entrySet()) {
            graph.replaceEdges(entry.getKey(), entry.getValue());
        }

        for (Decoy dispatch : dispatches) {
            for (Map.Entry<Integer, Integer> route : dispatch.getRoutes().entrySet()) {
                if (resolved.containsKey(route.getKey())) continue;
                int target = resolved.getOrDefault(route.getValue(), route.getValue());
                graph.get(route.getKey()).replaceSuccessor(dispatch.getBlock(), target);
            }
            boolean unreached = graph.predecessors(dispatch.getBlock()).isEmpty();
            if (unreached != dispatch.isRemovable()) {
                logger.debug("Dispatch block B{} was recognized as removable={} but has {} predecessors left",
                        dispatch.getBlock(), dispatch.isRemovable(), graph.predecessors(dispatch.getBlock()).size());
            }
            if (unreached) {
                graph.get(dispatch.getBlock()).clear();
                cleared++;
            } else {
                logger.debug("Dispatch block B{} still has predecessors, kept", dispatch.getBlock());
            }
        }

        merger.merge(graph);
        return cleared;
    }

    /**
     * Maps every decoy to the first non-decoy block on its successor chain. Decoys on a cycle are dropped.
     */
    static Map<Integer, Integer> resolveChains(Map<Integer, Integer> redirects) {
        Map<Integer, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<Integer, Integer> entry : redirects.entrySet()) {
            Set<Integer> seen = new HashSet<>();
            seen.add(entry.getKey());
            int target = entry.getValue();
            while (redirects.containsKey(target) && seen.add(target)) {
                target = redirects.get(target);
            }
            if (!redirects.containsKey(target)) {
                out.put(entry.getKey(), target);
            } else {
                logger.debug("Decoy B{} is on a decoy cycle, kept", entry.getKey());
            }
        }
        return out;
    }
}
