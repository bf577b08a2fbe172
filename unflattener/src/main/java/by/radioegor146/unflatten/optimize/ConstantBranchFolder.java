package by.radioegor146.unflatten.optimize;

import by.radioegor146.unflatten.AnalysisContext;
import by.radioegor146.unflatten.analysis.Insns;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import org.objectweb.asm.tree.AbstractInsnNode;

import java.util.List;

/**
 * Folds {@code <const>; IFxx} and {@code <const>; <const>; IF_ICMPxx} at the end of a block into an
 * unconditional edge. Only the constants and the jump are removed.
 */
public final class ConstantBranchFolder implements BlockOptimizer {

    @Override
    public boolean optimize(Block block, BlockGraph graph, AnalysisContext context) {
        List<AbstractInsnNode> real = block.realInstructions();
        int n = real.size();
        if (n < 2 || block.getTargets().size() != 1) {
            return false;
        }
        AbstractInsnNode jump = real.get(n - 1);
        int op = jump.getOpcode();

        boolean taken;
        List<AbstractInsnNode> folded;
        if (Insns.isIntZeroJump(op)) {
            Integer value = Insns.intConstant(real.get(n - 2));
            if (value == null) return false;
            taken = Insns.evaluateIntJump(op, value, 0);
            folded = real.subList(n - 2, n);
        } else if (Insns.isIntCompareJump(op) && n >= 3) {
            Integer left = Insns.intConstant(real.get(n - 3));
            Integer right = Insns.intConstant(real.get(n - 2));
            if (left == null || right == null) return false;
            taken = Insns.evaluateIntJump(op, left, right);
            folded = real.subList(n - 3, n);
        } else {
            return false;
        }

        int target = block.getTargets().get(0);
        block.getInstructions().removeAll(folded);
        if (taken) {
            block.setFallThrough(target);
        }
        block.setTargets(List.of());
        context.getDiagnostics().detail("  folded constant branch in B{}: {}", block.getIndex(),
                taken ? "taken to B" + target : "falls through");
        return true;
    }
}
