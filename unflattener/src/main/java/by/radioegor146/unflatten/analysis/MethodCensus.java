package by.radioegor146.unflatten.analysis;

import by.radioegor146.unflatten.Diagnostics;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.opaque.OpaqueLoads;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;

import java.util.*;

/**
 * Read-only statistics of a block graph: branches on opaque fields, likely state variables and loop heads.
 */
public final class MethodCensus {

    static final int STATE_VARIABLE_MIN_CONSTANTS = 3;

    private final int opaqueBranches;
    private final Map<Integer, Set<Integer>> stateVariables;
    private final Map<Integer, Integer> loopHeads;

    private MethodCensus(int opaqueBranches, Map<Integer, Set<Integer>> stateVariables, Map<Integer, Integer> loopHeads) {
        this.opaqueBranches = opaqueBranches;
        this.stateVariables = stateVariables;
        this.loopHeads = loopHeads;
    }

    public static MethodCensus of(BlockGraph graph, OpaqueLoads opaqueLoads) {
        int opaqueBranches = 0;
        Map<Integer, Set<Integer>> assigned = new TreeMap<>();
        Map<Integer, Integer> loopHeads = new TreeMap<>();

        for (Block block : graph.getBlocks()) {
            List<AbstractInsnNode> real = block.realInstructions();
            for (int i = 0; i < real.size(); i++) {
                AbstractInsnNode insn = real.get(i);
                if (Insns.isConditionalJump(insn.getOpcode()) && i > 0
                        && real.get(i - 1).getOpcode() == Opcodes.GETFIELD && opaqueLoads != null
                        && opaqueLoads.opaqueField((FieldInsnNode) real.get(i - 1)) != null) {
                    opaqueBranches++;
                }
                Integer value = Insns.intConstant(insn);
                if (value != null && i + 1 < real.size()) {
                    int slot = Insns.storedIntLocal(real.get(i + 1));
                    if (slot >= 0) {
                        assigned.computeIfAbsent(slot, k -> new TreeSet<>()).add(value);
                    }
                }
            }
            for (int succ : block.successors()) {
                if (succ <= block.getIndex()) {
                    loopHeads.merge(succ, 1, Integer::sum);
                }
            }
        }

        Map<Integer, Set<Integer>> stateVariables = new TreeMap<>();
        for (Map.Entry<Integer, Set<Integer>> entry : assigned.entrySet()) {
            if (entry.getValue().size() >= STATE_VARIABLE_MIN_CONSTANTS) {
                stateVariables.put(entry.getKey(), entry.getValue());
            }
        }
        return new MethodCensus(opaqueBranches, stateVariables, loopHeads);
    }

    public int getOpaqueBranches() {
        return opaqueBranches;
    }

    /** Slot to the distinct constants stored into it, for slots with at least three. */
    public Map<Integer, Set<Integer>> getStateVariables() {
        return Collections.unmodifiableMap(stateVariables);
    }

    /** Block to the number of back edges entering it. */
    public Map<Integer, Integer> getLoopHeads() {
        return Collections.unmodifiableMap(loopHeads);
    }

    public void log(Diagnostics diagnostics, String method, boolean asyncStyle) {
        if (opaqueBranches > 0) {
            diagnostics.detail("{}: {} branches on opaque fields", method, opaqueBranches);
        }
        if (asyncStyle && !stateVariables.isEmpty()) {
            diagnostics.detail("{}: state variables {}", method, stateVariables);
        }
        if (!loopHeads.isEmpty()) {
            diagnostics.detail("{}: loop heads {}", method, loopHeads);
        }
    }
}
