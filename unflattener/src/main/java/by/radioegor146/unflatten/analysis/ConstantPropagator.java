package by.radioegor146.unflatten.analysis;

import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.blocks.HandlerRegion;
import by.radioegor146.unflatten.opaque.OpaqueLoads;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.VarInsnNode;

import java.util.*;

/**
 * Forward may-analysis of int constants stored to locals.
 * <p>
 * A constant load (or a resolved opaque field load) directly followed by {@code ISTORE k} adds the
 * constant to the set of {@code k}; earlier values are never killed. Any other store to {@code k} or
 * {@code IINC k} makes {@code k} unknown. A block's exit snapshot is merged into successors that have
 * not been processed yet. Processed blocks are never revisited, so the entry snapshot already marks
 * every slot that is written with a non-constant anywhere in the method. Handler blocks left over
 * after the main drain start from that snapshot too.
 */
public final class ConstantPropagator implements Opcodes {

    private final OpaqueLoads opaqueLoads;

    /** @param opaqueLoads resolves opaque field loads to constants, may be null */
    public ConstantPropagator(OpaqueLoads opaqueLoads) {
        this.opaqueLoads = opaqueLoads;
    }

    public PropagationResult propagate(BlockGraph graph) {
        Map<Integer, LocalConstants> entry = new HashMap<>();
        Map<Integer, LocalConstants> exit = new HashMap<>();
        Deque<Integer> worklist = new ArrayDeque<>();
        Set<Integer> queued = new HashSet<>();

        LocalConstants clobbered = clobberedSlots(graph);
        entry.put(0, new LocalConstants(clobbered));
        worklist.add(0);
        queued.add(0);
        drain(graph, entry, exit, worklist, queued);

        for (HandlerRegion region : graph.getRegions()) {
            int handler = region.getHandlerBlock();
            if (exit.containsKey(handler) || !queued.add(handler)) continue;
            entry.putIfAbsent(handler, new LocalConstants(clobbered));
            worklist.add(handler);
            drain(graph, entry, exit, worklist, queued);
        }
        return new PropagationResult(entry, exit);
    }

    /** Slots written with something other than a constant in any block, reached or not. */
    LocalConstants clobberedSlots(BlockGraph graph) {
        LocalConstants out = new LocalConstants();
        for (Block block : graph.getBlocks()) {
            for (int slot : transfer(block, new LocalConstants()).unknownSlots()) {
                out.markUnknown(slot);
            }
        }
        return out;
    }

    private void drain(BlockGraph graph, Map<Integer, LocalConstants> entry, Map<Integer, LocalConstants> exit,
                       Deque<Integer> worklist, Set<Integer> queued) {
        while (!worklist.isEmpty()) {
            int index = worklist.poll();
            queued.remove(index);
            if (exit.containsKey(index)) continue;

            LocalConstants out = transfer(graph.get(index), entry.get(index));
            exit.put(index, out);
            for (int succ : graph.get(index).successors()) {
                if (exit.containsKey(succ)) continue;
                entry.computeIfAbsent(succ, k -> new LocalConstants()).mergeFrom(out);
                if (queued.add(succ)) {
                    worklist.add(succ);
                }
            }
        }
    }

    LocalConstants transfer(Block block, LocalConstants in) {
        LocalConstants out = new LocalConstants(in);
        List<AbstractInsnNode> real = block.realInstructions();
        for (int i = 0; i < real.size(); i++) {
            Integer value = Insns.intConstant(real.get(i));
            int length = 1;
            if (value == null && opaqueLoads != null) {
                OpaqueLoads.Match match = opaqueLoads.match(real, i);
                if (match != null && match.getField().isResolved()) {
                    value = match.getField().getValue().getAsInt();
                    length = match.getLength();
                }
            }
            if (value != null && i + length < real.size()) {
                int slot = Insns.storedIntLocal(real.get(i + length));
                if (slot >= 0) {
                    out.add(slot, value);
                    i += length;
                    continue;
                }
            }
            clobber(real.get(i), out);
        }
        return out;
    }

    private static void clobber(AbstractInsnNode insn, LocalConstants out) {
        if (insn instanceof IincInsnNode iinc) {
            out.markUnknown(iinc.var);
        } else if (insn instanceof VarInsnNode var && var.getOpcode() >= ISTORE && var.getOpcode() <= ASTORE) {
            out.markUnknown(var.var);
            if (var.getOpcode() == LSTORE || var.getOpcode() == DSTORE) {
                out.markUnknown(var.var + 1);
            }
        }
    }
}
