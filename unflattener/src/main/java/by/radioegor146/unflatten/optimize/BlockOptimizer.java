package by.radioegor146.unflatten.optimize;

import by.radioegor146.unflatten.AnalysisContext;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;

/**
 * Local rewrite applied to one block at a time until no optimizer reports a change.
 */
public interface BlockOptimizer {

    /** @return whether the block or its edges changed */
    boolean optimize(Block block, BlockGraph graph, AnalysisContext context);
}
