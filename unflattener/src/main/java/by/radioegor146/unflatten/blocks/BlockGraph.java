package by.radioegor146.unflatten.blocks;

import by.radioegor146.unflatten.analysis.Insns;
import by.radioegor146.unflatten.frame.AsmSanity;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.*;

/**
 * Block partition of a single method body.
 * <p>
 * Every {@link LabelNode} starts a block, as does the instruction after a jump, switch, return or throw.
 * A trailing {@code GOTO} is not kept as an instruction, it becomes the fall-through edge. Conditional
 * jumps keep their instruction with the taken block as the only target. Switches keep their instruction,
 * case blocks are the targets and the default block is the fall-through.
 * <p>
 * {@link #flattenInto(MethodNode)} rebuilds jump operands from the edges, so passes only need to edit
 * edges and instruction lists.
 */
public final class BlockGraph implements Opcodes {

    private final List<Block> blocks;
    private final List<HandlerRegion> regions;

    private BlockGraph(List<Block> blocks, List<HandlerRegion> regions) {
        this.blocks = blocks;
        this.regions = regions;
    }

    public static boolean canBuild(MethodNode method) {
        if ((method.access & (ACC_ABSTRACT | ACC_NATIVE)) != 0) return false;
        if (method.instructions == null || method.instructions.size() == 0) return false;
        for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            int op = insn.getOpcode();
            if (op == JSR || op == RET) {
                return false;
            }
        }
        return true;
    }

    public static BlockGraph build(MethodNode method) {
        if (!canBuild(method)) {
            throw new IllegalArgumentException("Method " + method.name + method.desc + " cannot be partitioned");
        }

        List<Block> blocks = new ArrayList<>();
        Map<LabelNode, Integer> byLabel = new IdentityHashMap<>();
        Block current = null;
        boolean startNew = true;

        for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (insn instanceof FrameNode) {
                continue;
            }
            if (insn instanceof LabelNode label) {
                current = new Block(blocks.size(), label);
                byLabel.put(label, current.getIndex());
                blocks.add(current);
                startNew = false;
                continue;
            }
            if (current == null || startNew) {
                current = new Block(blocks.size(), new LabelNode());
                blocks.add(current);
                startNew = false;
            }
            current.getInstructions().add(insn);
            if (endsBlock(insn)) {
                startNew = true;
            }
        }

        for (Block block : blocks) {
            int next = block.getIndex() + 1 < blocks.size() ? block.getIndex() + 1 : Block.NONE;
            AbstractInsnNode last = block.lastReal();
            if (last == null) {
                block.setFallThrough(next);
            } else if (last.getOpcode() == GOTO) {
                block.getInstructions().remove(last);
                block.setFallThrough(indexOf(byLabel, ((JumpInsnNode) last).label));
            } else if (last instanceof JumpInsnNode jump) {
                block.setTargets(List.of(indexOf(byLabel, jump.label)));
                block.setFallThrough(next);
            } else if (last instanceof TableSwitchInsnNode table) {
                block.setTargets(indicesOf(byLabel, table.labels));
                block.setFallThrough(indexOf(byLabel, table.dflt));
            } else if (last instanceof LookupSwitchInsnNode lookup) {
                block.setTargets(indicesOf(byLabel, lookup.labels));
                block.setFallThrough(indexOf(byLabel, lookup.dflt));
            } else if (!Insns.isReturnOrThrow(last.getOpcode())) {
                block.setFallThrough(next);
            }
        }

        List<HandlerRegion> regions = new ArrayList<>();
        if (method.tryCatchBlocks != null) {
            for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
                regions.add(new HandlerRegion(indexOf(byLabel, tcb.start), indexOf(byLabel, tcb.end),
                        indexOf(byLabel, tcb.handler), tcb));
            }
        }
        return new BlockGraph(blocks, regions);
    }

    private static boolean endsBlock(AbstractInsnNode insn) {
        return insn instanceof JumpInsnNode || Insns.isSwitch(insn) || Insns.isReturnOrThrow(insn.getOpcode());
    }

    private static int indexOf(Map<LabelNode, Integer> byLabel, LabelNode label) {
        Integer index = byLabel.get(label);
        if (index == null) {
            throw new IllegalStateException("Label outside of the instruction list");
        }
        return index;
    }

    private static List<Integer> indicesOf(Map<LabelNode, Integer> byLabel, List<LabelNode> labels) {
        List<Integer> out = new ArrayList<>(labels.size());
        for (LabelNode label : labels) {
            out.add(indexOf(byLabel, label));
        }
        return out;
    }

    public int size() {
        return blocks.size();
    }

    public Block get(int index) {
        return blocks.get(index);
    }

    public Block entry() {
        return blocks.get(0);
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public List<HandlerRegion> getRegions() {
        return Collections.unmodifiableList(regions);
    }

    public boolean isHandlerBlock(int index) {
        for (HandlerRegion region : regions) {
            if (region.getHandlerBlock() == index) {
                return true;
            }
        }
        return false;
    }

    /** Blocks with at least one edge to {@code index}, in block order. */
    public List<Block> predecessors(int index) {
        List<Block> out = new ArrayList<>();
        for (Block block : blocks) {
            if (block.hasEdgeTo(index)) {
                out.add(block);
            }
        }
        return out;
    }

    /**
     * Redirects every edge to {@code from} so that it points at {@code to}.
     *
     * @return number of rewritten edges
     */
    public int replaceEdges(int from, int to) {
        int replaced = 0;
        for (Block block : blocks) {
            replaced += block.replaceSuccessor(from, to);
        }
        return replaced;
    }

    /**
     * Follows fall-through edges of empty blocks. A cycle of empty blocks resolves to {@code index} itself.
     */
    public int resolve(int index) {
        Set<Integer> seen = new HashSet<>();
        int cur = index;
        while (seen.add(cur)) {
            Block block = blocks.get(cur);
            if (!block.isEmpty() || block.getFallThrough() == Block.NONE) {
                return cur;
            }
            cur = block.getFallThrough();
        }
        return index;
    }

    /**
     * Checks the structural invariants every pass must keep.
     *
     * @throws IllegalStateException on the first violation found
     */
    public void validate() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("Graph has no entry block");
        }
        for (Block block : blocks) {
            checkEdge(block, block.getFallThrough(), true);
            for (int target : block.getTargets()) {
                checkEdge(block, target, false);
            }
            AbstractInsnNode last = block.lastReal();
            int op = last == null ? -1 : last.getOpcode();
            if (last instanceof JumpInsnNode) {
                if (block.getTargets().size() != 1 || block.getFallThrough() == Block.NONE) {
                    throw new IllegalStateException(block + " ends in a conditional jump with mismatched edges");
                }
            } else if (last instanceof TableSwitchInsnNode table) {
                if (block.getTargets().size() != table.labels.size() || block.getFallThrough() == Block.NONE) {
                    throw new IllegalStateException(block + " ends in a switch with mismatched edges");
                }
            } else if (last instanceof LookupSwitchInsnNode lookup) {
                if (block.getTargets().size() != lookup.labels.size() || block.getFallThrough() == Block.NONE) {
                    throw new IllegalStateException(block + " ends in a switch with mismatched edges");
                }
            } else if (!block.getTargets().isEmpty()) {
                throw new IllegalStateException(block + " has targets but no branch instruction");
            } else if (last != null && Insns.isReturnOrThrow(op) && block.getFallThrough() != Block.NONE) {
                throw new IllegalStateException(block + " has a fall-through after " + op);
            }
        }
        for (HandlerRegion region : regions) {
            if (region.getStartBlock() > region.getEndBlock()
                    || region.getHandlerBlock() < 0 || region.getHandlerBlock() >= blocks.size()) {
                throw new IllegalStateException("Malformed handler region " + region.getStartBlock()
                        + ".." + region.getEndBlock() + " -> " + region.getHandlerBlock());
            }
        }
        for (int index : reachableWithHandlers()) {
            Block block = blocks.get(index);
            AbstractInsnNode last = block.lastReal();
            boolean terminated = last != null && (Insns.isReturnOrThrow(last.getOpcode()) || Insns.isSwitch(last));
            if (!terminated && block.getFallThrough() == Block.NONE) {
                throw new IllegalStateException(block + " is reachable but falls off the graph");
            }
        }
    }

    private void checkEdge(Block from, int to, boolean fallThrough) {
        if (fallThrough && to == Block.NONE) {
            return;
        }
        if (to < 0 || to >= blocks.size()) {
            throw new IllegalStateException(from + " has an edge outside the graph: " + to);
        }
    }

    private Set<Integer> reachableWithHandlers() {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(0);
        for (HandlerRegion region : regions) {
            queue.add(region.getHandlerBlock());
        }
        while (!queue.isEmpty()) {
            int index = queue.poll();
            if (!seen.add(index)) continue;
            queue.addAll(blocks.get(index).successors());
        }
        return seen;
    }

    /**
     * Writes the blocks back into {@code method} in index order. Jump and switch operands are rebuilt from
     * the edges, a {@code GOTO} is added where the fall-through successor is not laid out next, and the
     * handler boundary of every region is moved to the resolved successor of an emptied handler block.
     */
    public void flattenInto(MethodNode method) {
        method.instructions.clear();
        InsnList out = method.instructions;
        for (Block block : blocks) {
            out.add(block.getLabel());
            AbstractInsnNode last = block.lastReal();
            for (AbstractInsnNode insn : block.getInstructions()) {
                if (insn == last) {
                    retarget(insn, block);
                }
                out.add(insn);
            }
            if (needsGoto(block, last)) {
                out.add(new JumpInsnNode(GOTO, labelOf(resolve(block.getFallThrough()))));
            }
        }

        List<TryCatchBlockNode> tryCatches = new ArrayList<>(regions.size());
        for (HandlerRegion region : regions) {
            region.setHandlerBlock(resolve(region.getHandlerBlock()));
            TryCatchBlockNode tcb = region.getSource();
            tcb.start = labelOf(region.getStartBlock());
            tcb.end = labelOf(region.getEndBlock());
            tcb.handler = labelOf(region.getHandlerBlock());
            tryCatches.add(tcb);
        }
        method.tryCatchBlocks = tryCatches;
        AsmSanity.sanitizeTryCatches(method);
        AsmSanity.sanitizeLocalVariables(method);
    }

    private boolean needsGoto(Block block, AbstractInsnNode last) {
        int ft = block.getFallThrough();
        if (ft == Block.NONE) return false;
        if (last != null && (Insns.isSwitch(last) || Insns.isReturnOrThrow(last.getOpcode()))) return false;
        int next = block.getIndex() + 1;
        return ft != next && resolve(ft) != next;
    }

    private void retarget(AbstractInsnNode insn, Block block) {
        if (insn instanceof JumpInsnNode jump) {
            jump.label = labelOf(resolve(block.getTargets().get(0)));
        } else if (insn instanceof TableSwitchInsnNode table) {
            table.dflt = labelOf(resolve(block.getFallThrough()));
            for (int i = 0; i < table.labels.size(); i++) {
                table.labels.set(i, labelOf(resolve(block.getTargets().get(i))));
            }
        } else if (insn instanceof LookupSwitchInsnNode lookup) {
            lookup.dflt = labelOf(resolve(block.getFallThrough()));
            for (int i = 0; i < lookup.labels.size(); i++) {
                lookup.labels.set(i, labelOf(resolve(block.getTargets().get(i))));
            }
        }
    }

    private LabelNode labelOf(int index) {
        return blocks.get(index).getLabel();
    }
}
