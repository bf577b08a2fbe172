package by.radioegor146.unflatten.frame;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.BasicVerifier;

import java.util.*;

public final class AsmSanity {
    private AsmSanity() {}

    /** Call before {@link MethodNode#accept} so that cached ASM labels are not shared between copies. */
    public static void resetAllLabels(MethodNode mn) {
        mn.instructions.resetLabels();
    }

    /** Deep copy of the method, labels included. */
    public static MethodNode copyOf(MethodNode mn) {
        String[] exceptions = mn.exceptions == null ? null : mn.exceptions.toArray(new String[0]);
        MethodNode copy = new MethodNode(Opcodes.ASM9, mn.access, mn.name, mn.desc, mn.signature, exceptions);
        resetAllLabels(mn);
        mn.accept(copy);
        resetAllLabels(mn);
        copy.maxStack = mn.maxStack;
        copy.maxLocals = mn.maxLocals;
        return copy;
    }

    /** Moves the body of {@code source} into {@code target}. */
    public static void install(MethodNode target, MethodNode source) {
        target.instructions = source.instructions;
        target.tryCatchBlocks = source.tryCatchBlocks;
        target.localVariables = source.localVariables;
        target.visibleLocalVariableAnnotations = source.visibleLocalVariableAnnotations;
        target.invisibleLocalVariableAnnotations = source.invisibleLocalVariableAnnotations;
        target.maxStack = Math.max(target.maxStack, source.maxStack);
        target.maxLocals = Math.max(target.maxLocals, source.maxLocals);
    }

    /**
     * Runs the ASM basic verifier over the method.
     *
     * @throws AnalyzerException when the body does not verify
     */
    public static void verify(String owner, MethodNode mn) throws AnalyzerException {
        new Analyzer<BasicValue>(new BasicVerifier()).analyze(owner, mn);
    }

    /**
     * Drops handler regions that no longer cover a real instruction, the JVM rejects empty ranges.
     */
    public static void sanitizeTryCatches(MethodNode mn) {
        if (mn.tryCatchBlocks == null || mn.tryCatchBlocks.isEmpty()) return;
        Map<LabelNode, Integer> pos = realPositions(mn);

        List<TryCatchBlockNode> keep = new ArrayList<>(mn.tryCatchBlocks.size());
        for (TryCatchBlockNode t : mn.tryCatchBlocks) {
            if (t == null || t.start == null || t.end == null || t.handler == null) continue;
            Integer s = pos.get(t.start), e = pos.get(t.end), h = pos.get(t.handler);
            if (s == null || e == null || h == null) continue;
            if (s >= e) continue;
            keep.add(t);
        }
        mn.tryCatchBlocks = keep;
    }

    /** Drops zero-length and duplicate local variable ranges, sorted by start. */
    public static void sanitizeLocalVariables(MethodNode mn) {
        if (mn.localVariables == null || mn.localVariables.isEmpty()) return;
        Map<LabelNode, Integer> pos = realPositions(mn);

        List<LocalVariableNode> keep = new ArrayList<>(mn.localVariables.size());
        Set<String> seen = new HashSet<>();
        for (LocalVariableNode lv : mn.localVariables) {
            if (lv == null || lv.start == null || lv.end == null) continue;
            Integer s = pos.get(lv.start), e = pos.get(lv.end);
            if (s == null || e == null) continue;
            if (s >= e) continue;
            // the JVM considers (index, start, end) duplicates regardless of name
            if (!seen.add(lv.index + ":" + s + ":" + e)) continue;
            keep.add(lv);
        }
        keep.sort(Comparator.comparing((LocalVariableNode lv) -> pos.get(lv.start))
                .thenComparing(lv -> pos.get(lv.end)));
        mn.localVariables = keep;
    }

    /** Label to the number of real instructions before it. */
    private static Map<LabelNode, Integer> realPositions(MethodNode mn) {
        Map<LabelNode, Integer> pos = new IdentityHashMap<>();
        int real = 0;
        for (AbstractInsnNode p = mn.instructions.getFirst(); p != null; p = p.getNext()) {
            if (p instanceof LabelNode label) {
                pos.put(label, real);
            } else if (p.getOpcode() >= 0) {
                real++;
            }
        }
        return pos;
    }
}
