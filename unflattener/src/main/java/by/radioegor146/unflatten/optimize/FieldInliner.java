package by.radioegor146.unflatten.optimize;

import by.radioegor146.unflatten.AnalysisContext;
import by.radioegor146.unflatten.analysis.Insns;
import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.opaque.OpaqueLoads;
import org.objectweb.asm.tree.AbstractInsnNode;

import java.util.List;

/**
 * Replaces loads of resolved opaque fields with the constant they hold.
 */
public final class FieldInliner implements BlockOptimizer {

    @Override
    public boolean optimize(Block block, BlockGraph graph, AnalysisContext context) {
        OpaqueLoads loads = context.getOpaqueLoads();
        if (loads.getTable().isEmpty()) {
            return false;
        }
        List<AbstractInsnNode> insns = block.getInstructions();
        int replaced = 0;
        boolean again = true;
        while (again) {
            again = false;
            List<AbstractInsnNode> real = block.realInstructions();
            for (int i = 0; i < real.size(); i++) {
                OpaqueLoads.Match match = loads.match(real, i);
                if (match == null || !match.getField().isResolved()) continue;

                int at = indexOf(insns, real.get(i));
                for (int k = 0; k < match.getLength(); k++) {
                    insns.remove(real.get(i + k));
                }
                insns.add(at, Insns.iconst(match.getField().getValue().getAsInt()));
                context.getDiagnostics().detail("  inlined {} as {} in B{}", match.getField().getKey(),
                        match.getField().getValue().getAsInt(), block.getIndex());
                replaced++;
                again = true;
                break;
            }
        }
        context.addReplacedLoads(replaced);
        return replaced > 0;
    }

    private static int indexOf(List<AbstractInsnNode> insns, AbstractInsnNode insn) {
        for (int i = 0; i < insns.size(); i++) {
            if (insns.get(i) == insn) return i;
        }
        throw new IllegalStateException("Instruction not in block");
    }
}
