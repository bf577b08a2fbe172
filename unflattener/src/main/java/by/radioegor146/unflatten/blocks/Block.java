package by.radioegor146.unflatten.blocks;

import by.radioegor146.unflatten.analysis.Insns;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.LabelNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line run of instructions with one fall-through edge and any number of explicit targets.
 * Edges are block indices inside the owning {@link BlockGraph}; {@link #NONE} marks a missing fall-through.
 */
public final class Block {

    public static final int NONE = -1;

    private final int index;
    private final LabelNode label;
    private final List<AbstractInsnNode> instructions = new ArrayList<>();
    private final List<Integer> targets = new ArrayList<>();
    private int fallThrough = NONE;

    Block(int index, LabelNode label) {
        this.index = index;
        this.label = label;
    }

    public int getIndex() {
        return index;
    }

    public LabelNode getLabel() {
        return label;
    }

    /** Live list: passes may add, remove and replace instructions in place. */
    public List<AbstractInsnNode> getInstructions() {
        return instructions;
    }

    public List<AbstractInsnNode> realInstructions() {
        return Insns.real(instructions);
    }

    public AbstractInsnNode lastReal() {
        for (int i = instructions.size() - 1; i >= 0; i--) {
            if (Insns.isReal(instructions.get(i))) {
                return instructions.get(i);
            }
        }
        return null;
    }

    public boolean hasRealInstructions() {
        return lastReal() != null;
    }

    public int getFallThrough() {
        return fallThrough;
    }

    public void setFallThrough(int fallThrough) {
        this.fallThrough = fallThrough;
    }

    public List<Integer> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    public void setTargets(List<Integer> newTargets) {
        targets.clear();
        targets.addAll(newTargets);
    }

    public List<Integer> successors() {
        List<Integer> out = new ArrayList<>(targets.size() + 1);
        if (fallThrough != NONE) {
            out.add(fallThrough);
        }
        out.addAll(targets);
        return out;
    }

    public boolean hasEdgeTo(int block) {
        return fallThrough == block || targets.contains(block);
    }

    /**
     * Replaces every edge to {@code from} with an edge to {@code to}.
     *
     * @return number of rewritten edges
     */
    public int replaceSuccessor(int from, int to) {
        int replaced = 0;
        if (fallThrough == from) {
            fallThrough = to;
            replaced++;
        }
        for (int i = 0; i < targets.size(); i++) {
            if (targets.get(i) == from) {
                targets.set(i, to);
                replaced++;
            }
        }
        return replaced;
    }

    /** Drops instructions and outgoing edges. The block stays in the graph as an empty orphan. */
    public void clear() {
        instructions.clear();
        targets.clear();
        fallThrough = NONE;
    }

    /** No real instruction and at most a fall-through edge. */
    public boolean isEmpty() {
        return !hasRealInstructions() && targets.isEmpty();
    }

    @Override
    public String toString() {
        return "B" + index + "{ft=" + fallThrough + ", targets=" + targets + ", insns=" + realInstructions().size() + "}";
    }
}
