package by.radioegor146.unflatten.blocks;

import org.objectweb.asm.tree.TryCatchBlockNode;

/**
 * Exception handler region expressed in block indices. {@code endBlock} is exclusive.
 */
public final class HandlerRegion {

    private final int startBlock;
    private final int endBlock;
    private int handlerBlock;
    private final TryCatchBlockNode source;

    public HandlerRegion(int startBlock, int endBlock, int handlerBlock, TryCatchBlockNode source) {
        this.startBlock = startBlock;
        this.endBlock = endBlock;
        this.handlerBlock = handlerBlock;
        this.source = source;
    }

    public int getStartBlock() {
        return startBlock;
    }

    public int getEndBlock() {
        return endBlock;
    }

    public int getHandlerBlock() {
        return handlerBlock;
    }

    void setHandlerBlock(int handlerBlock) {
        this.handlerBlock = handlerBlock;
    }

    public String getType() {
        return source.type;
    }

    public boolean covers(int block) {
        return block >= startBlock && block < endBlock;
    }

    TryCatchBlockNode getSource() {
        return source;
    }
}
