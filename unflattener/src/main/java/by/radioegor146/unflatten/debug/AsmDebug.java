package by.radioegor146.unflatten.debug;

import by.radioegor146.unflatten.blocks.Block;
import by.radioegor146.unflatten.blocks.BlockGraph;
import by.radioegor146.unflatten.blocks.HandlerRegion;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.util.Textifier;
import org.objectweb.asm.util.TraceMethodVisitor;

import java.io.PrintWriter;
import java.io.StringWriter;

/** Textual dumps for the full diagnostic level. */
public final class AsmDebug {
    private AsmDebug() {}

    /** Disassembly with instruction indices, matching the indices in analyzer errors. */
    public static String disassembleWithIndex(MethodNode mn) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        InsnList insns = mn.instructions;
        int i = 0;
        for (AbstractInsnNode in = insns.getFirst(); in != null; in = in.getNext(), i++) {
            pw.printf("%5d: %s%n", i, insnToString(in));
        }
        pw.flush();
        return sw.toString();
    }

    public static String dumpGraph(BlockGraph graph) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        for (Block block : graph.getBlocks()) {
            pw.printf("B%d ft=%s targets=%s%n", block.getIndex(),
                    block.getFallThrough() == Block.NONE ? "-" : "B" + block.getFallThrough(), block.getTargets());
            for (AbstractInsnNode in : block.getInstructions()) {
                pw.printf("    %s%n", insnToString(in));
            }
        }
        for (HandlerRegion region : graph.getRegions()) {
            pw.printf("try B%d..B%d -> B%d %s%n", region.getStartBlock(), region.getEndBlock(),
                    region.getHandlerBlock(), region.getType() == null ? "any" : region.getType());
        }
        pw.flush();
        return sw.toString();
    }

    private static String insnToString(AbstractInsnNode in) {
        Textifier t = new Textifier();
        TraceMethodVisitor tmv = new TraceMethodVisitor(t);
        in.accept(tmv);
        StringWriter line = new StringWriter();
        t.print(new PrintWriter(line));
        return line.toString().trim().replace("\n", " ");
    }
}
