package by.radioegor146.unflatten.optimize;

import by.radioegor146.unflatten.AnalysisContext;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public final class BlockOptimizerPipeline {

    private static final Logger logger = LoggerFactory.getLogger(BlockOptimizerPipeline.class);

    private final List<BlockOptimizer> optimizers;
    private final int maxPasses;

    public BlockOptimizerPipeline(List<BlockOptimizer> optimizers, int maxPasses) {
        this.optimizers = List.copyOf(optimizers);
        this.maxPasses = maxPasses;
    }

    /** Field inlining first, so branch folding sees the constants. */
    public static BlockOptimizerPipeline standard(int maxPasses) {
        return new BlockOptimizerPipeline(List.of(new FieldInliner(), new ConstantBranchFolder()), maxPasses);
    }

    /** @return whether any pass changed the graph */
    public boolean run(BlockGraph graph, AnalysisContext context) {
        boolean changedAny = false;
        for (int pass = 0; pass < maxPasses; pass++) {
            boolean changed = false;
            for (Block block : graph.getBlocks()) {
                for (BlockOptimizer optimizer : optimizers) {
                    changed |= optimizer.optimize(block, graph, context);
                }
            }
            if (!changed) {
                return changedAny;
            }
            changedAny = true;
        }
        logger.debug("Block optimizers still changing after {} passes", maxPasses);
        return changedAny;
    }
}
