package by.radioegor146.unflatten.rewrite;

import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes edges past empty blocks until nothing changes. The iteration cap only guards against cycles of
 * empty blocks; reaching it leaves the graph valid, just less simplified.
 */
public final class EmptyBlockMerger {

    private static final Logger logger = LoggerFactory.getLogger(EmptyBlockMerger.class);

    private final int iterationCap;

    public EmptyBlockMerger(int iterationCap) {
        this.iterationCap = iterationCap;
    }

    /** @return number of redirected edges */
    public int merge(BlockGraph graph) {
        int redirected = 0;
        for (int iteration = 0; iteration < iterationCap; iteration++) {
            int changed = 0;
            for (Block empty : graph.getBlocks()) {
                int index = empty.getIndex();
                int succ = empty.getFallThrough();
                if (index == 0 || !empty.isEmpty() || succ == Block.NONE || succ == index) {
                    continue;
                }
                for (Block block : graph.getBlocks()) {
                    if (block != empty) {
                        changed += block.replaceSuccessor(index, succ);
                    }
                }
            }
            redirected += changed;
            if (changed == 0) {
                return redirected;
            }
        }
        if (iterationCap > 0) {
            logger.info("Empty block merge stopped after {} iterations, graph left partially merged", iterationCap);
        }
        return redirected;
    }
}
