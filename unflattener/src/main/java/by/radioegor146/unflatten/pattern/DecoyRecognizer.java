package by.radioegor146.unflatten.pattern;

import by.radioegor146.unflatten.analysis.Insns;
import by.radioegor146.unflatten.analysis.LocalConstants;
import by.radioegor146.unflatten.analysis.PropagationResult;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.*;

/**
 * Finds decoy blocks in a method that was propagated with {@link by.radioegor146.unflatten.analysis.ConstantPropagator}.
 * The entry block and handler blocks are never decoys.
 */
public final class DecoyRecognizer implements Opcodes {

    private final int sentinel;

    public DecoyRecognizer(int sentinel) {
        this.sentinel = sentinel;
    }

    /** Compare, sentinel and dispatch decoys, in block order. */
    public List<Decoy> recognize(BlockGraph graph, PropagationResult constants) {
        List<Decoy> out = new ArrayList<>();
        for (Block block : graph.getBlocks()) {
            int index = block.getIndex();
            if (index == 0 || graph.isHandlerBlock(index)) continue;
            List<AbstractInsnNode> real = block.realInstructions();

            Decoy decoy = null;
            if (real.size() == 3) {
                decoy = recognizeCompare(block, real, constants.entryOf(index));
            } else if (real.size() == 2) {
                decoy = recognizeDispatch(graph, block, real);
            }
            if (decoy != null) {
                out.add(decoy);
            }
        }
        return out;
    }

    private Decoy recognizeCompare(Block block, List<AbstractInsnNode> real, LocalConstants entry) {
        int slot = Insns.loadedIntLocal(real.get(0));
        Integer compared = Insns.intConstant(real.get(1));
        if (slot < 0 || compared == null || real.get(2).getOpcode() != IF_ICMPEQ) {
            return null;
        }
        if (entry == null || !entry.isTracked(slot)) {
            return null;
        }
        int taken = block.getTargets().get(0);
        if (taken == block.getIndex()) {
            return null;
        }
        if (compared == sentinel) {
            return Decoy.redirect(block.getIndex(), DecoyKind.SENTINEL_RETURN_COMPARE, taken);
        }
        if (entry.get(slot).contains(compared)) {
            return Decoy.redirect(block.getIndex(), DecoyKind.CONSTANT_COMPARE_BRANCH, taken);
        }
        return null;
    }

    private Decoy recognizeDispatch(BlockGraph graph, Block block, List<AbstractInsnNode> real) {
        int slot = Insns.loadedIntLocal(real.get(0));
        if (slot < 0 || !Insns.isSwitch(real.get(1))) {
            return null;
        }
        List<Block> predecessors = graph.predecessors(block.getIndex());
        Map<Integer, Integer> routes = new LinkedHashMap<>();
        for (Block pred : predecessors) {
            if (pred.getIndex() == block.getIndex()) continue;
            Integer state = lastConstantStore(pred, slot);
            if (state == null) continue;
            int target = caseTarget(block, real.get(1), state);
            if (target != block.getIndex()) {
                routes.put(pred.getIndex(), target);
            }
        }
        if (routes.isEmpty()) {
            return null;
        }
        boolean removable = routes.size() == predecessors.size();
        return Decoy.dispatch(block.getIndex(), routes, removable);
    }

    /**
     * @return the constant of the last {@code <const>; ISTORE slot} in the block, or null when the last
     * write to the slot is not a constant store or there is none
     */
    static Integer lastConstantStore(Block block, int slot) {
        Integer value = null;
        List<AbstractInsnNode> real = block.realInstructions();
        for (int i = 0; i < real.size(); i++) {
            AbstractInsnNode insn = real.get(i);
            if (Insns.storedIntLocal(insn) == slot) {
                value = i > 0 ? Insns.intConstant(real.get(i - 1)) : null;
            } else if (insn instanceof IincInsnNode iinc && iinc.var == slot) {
                value = null;
            } else if (insn instanceof VarInsnNode var && var.var == slot && var.getOpcode() >= ISTORE && var.getOpcode() <= ASTORE) {
                value = null;
            }
        }
        return value;
    }

    static int caseTarget(Block block, AbstractInsnNode dispatch, int value) {
        if (dispatch instanceof TableSwitchInsnNode table) {
            if (value >= table.min && value <= table.max) {
                return block.getTargets().get(value - table.min);
            }
        } else if (dispatch instanceof LookupSwitchInsnNode lookup) {
            int position = lookup.keys.indexOf(value);
            if (position >= 0) {
                return block.getTargets().get(position);
            }
        }
        return block.getFallThrough();
    }

    /**
     * Second round: blocks that only store constants into locals nobody reads. The real successor is
     * the fall-through.
     */
    public List<Decoy> recognizeInitializationNoops(BlockGraph graph) {
        Set<Integer> readSlots = readSlots(graph);
        List<Decoy> out = new ArrayList<>();
        for (Block block : graph.getBlocks()) {
            int index = block.getIndex();
            if (index == 0 || graph.isHandlerBlock(index)) continue;
            if (!block.getTargets().isEmpty() || block.getFallThrough() == Block.NONE || block.getFallThrough() == index) {
                continue;
            }
            List<AbstractInsnNode> real = block.realInstructions();
            if (!real.isEmpty() && onlyDeadStores(real, readSlots)) {
                out.add(Decoy.redirect(index, DecoyKind.INITIALIZATION_NOOP, block.getFallThrough()));
            }
        }
        return out;
    }

    private static boolean onlyDeadStores(List<AbstractInsnNode> real, Set<Integer> readSlots) {
        for (int i = 0; i < real.size(); i++) {
            AbstractInsnNode insn = real.get(i);
            if (insn.getOpcode() == NOP) continue;
            if (!Insns.isIntConstant(insn) || i + 1 >= real.size()) return false;
            int slot = Insns.storedIntLocal(real.get(i + 1));
            if (slot < 0 || readSlots.contains(slot)) return false;
            i++;
        }
        return true;
    }

    private static Set<Integer> readSlots(BlockGraph graph) {
        Set<Integer> out = new HashSet<>();
        for (Block block : graph.getBlocks()) {
            for (AbstractInsnNode insn : block.getInstructions()) {
                if (insn instanceof VarInsnNode var && Insns.isLocalRead(insn)) {
                    out.add(var.var);
                } else if (insn instanceof IincInsnNode iinc) {
                    out.add(iinc.var);
                }
            }
        }
        return out;
    }
}
