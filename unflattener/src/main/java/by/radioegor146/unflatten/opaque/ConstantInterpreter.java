package by.radioegor146.unflatten.opaque;

import by.radioegor146.unflatten.analysis.Insns;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Small int stack machine for initializer expressions. Bitwise not arrives as {@code ICONST_M1; IXOR}.
 * Opcodes outside the constant arithmetic set are skipped.
 */
public final class ConstantInterpreter implements Opcodes {

    private ConstantInterpreter() {
    }

    /**
     * @return the single value left on the stack, or empty on underflow, division by zero or
     * when zero or several values remain
     */
    public static OptionalInt evaluate(List<AbstractInsnNode> insns) {
        Deque<Integer> stack = new ArrayDeque<>();
        for (AbstractInsnNode insn : insns) {
            Integer constant = Insns.intConstant(insn);
            if (constant != null) {
                stack.push(constant);
                continue;
            }
            int op = insn.getOpcode();
            if (op == INEG) {
                if (stack.isEmpty()) return OptionalInt.empty();
                stack.push(-stack.pop());
                continue;
            }
            if (!Insns.isIntBinaryOperator(op)) {
                continue;
            }
            if (stack.size() < 2) return OptionalInt.empty();
            int right = stack.pop();
            int left = stack.pop();
            switch (op) {
                case IADD: stack.push(left + right); break;
                case ISUB: stack.push(left - right); break;
                case IMUL: stack.push(left * right); break;
                case IDIV:
                    if (right == 0) return OptionalInt.empty();
                    stack.push(left / right);
                    break;
                case IAND: stack.push(left & right); break;
                case IOR: stack.push(left | right); break;
                case IXOR: stack.push(left ^ right); break;
                case ISHL: stack.push(left << (right & 0x1F)); break;
                case ISHR: stack.push(left >> (right & 0x1F)); break;
                case IUSHR: stack.push(left >>> (right & 0x1F)); break;
                default:
                    throw new IllegalStateException("Unhandled operator " + op);
            }
        }
        return stack.size() == 1 ? OptionalInt.of(stack.pop()) : OptionalInt.empty();
    }
}
