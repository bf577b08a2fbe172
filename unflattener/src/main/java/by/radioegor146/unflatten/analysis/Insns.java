package by.radioegor146.unflatten.analysis;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Opcode classification helpers shared by the analysis passes.
 */
public final class Insns implements Opcodes {

    private Insns() {
    }

    public static boolean isReal(AbstractInsnNode insn) {
        return insn != null && insn.getOpcode() >= 0;
    }

    public static List<AbstractInsnNode> real(List<AbstractInsnNode> insns) {
        List<AbstractInsnNode> out = new ArrayList<>(insns.size());
        for (AbstractInsnNode insn : insns) {
            if (isReal(insn)) {
                out.add(insn);
            }
        }
        return out;
    }

    /**
     * @return the pushed int constant, or null when the instruction is not an int constant load
     */
    public static Integer intConstant(AbstractInsnNode insn) {
        if (insn == null) {
            return null;
        }
        int op = insn.getOpcode();
        if (op >= ICONST_M1 && op <= ICONST_5) {
            return op - ICONST_0;
        }
        if (op == BIPUSH || op == SIPUSH) {
            return ((IntInsnNode) insn).operand;
        }
        if (insn instanceof LdcInsnNode ldc && ldc.cst instanceof Integer value) {
            return value;
        }
        return null;
    }

    public static boolean isIntConstant(AbstractInsnNode insn) {
        return intConstant(insn) != null;
    }

    public static AbstractInsnNode iconst(int v) {
        if (v >= -1 && v <= 5) return new InsnNode(ICONST_0 + v);
        if (v >= Byte.MIN_VALUE && v <= Byte.MAX_VALUE) return new IntInsnNode(BIPUSH, v);
        if (v >= Short.MIN_VALUE && v <= Short.MAX_VALUE) return new IntInsnNode(SIPUSH, v);
        return new LdcInsnNode(v);
    }

    /** @return the slot read by an ILOAD, or -1 */
    public static int loadedIntLocal(AbstractInsnNode insn) {
        return insn != null && insn.getOpcode() == ILOAD ? ((VarInsnNode) insn).var : -1;
    }

    /** @return the slot written by an ISTORE, or -1 */
    public static int storedIntLocal(AbstractInsnNode insn) {
        return insn != null && insn.getOpcode() == ISTORE ? ((VarInsnNode) insn).var : -1;
    }

    public static boolean isLocalRead(AbstractInsnNode insn) {
        int op = insn.getOpcode();
        return (op >= ILOAD && op <= ALOAD) || op == RET;
    }

    public static boolean isConditionalJump(int op) {
        return (op >= IFEQ && op <= IF_ACMPNE) || op == IFNULL || op == IFNONNULL;
    }

    public static boolean isIntCompareJump(int op) {
        return op >= IF_ICMPEQ && op <= IF_ICMPLE;
    }

    public static boolean isIntZeroJump(int op) {
        return op >= IFEQ && op <= IFLE;
    }

    public static boolean isSwitch(AbstractInsnNode insn) {
        return insn instanceof TableSwitchInsnNode || insn instanceof LookupSwitchInsnNode;
    }

    public static boolean isReturnOrThrow(int op) {
        return (op >= IRETURN && op <= RETURN) || op == ATHROW;
    }

    public static boolean isInvoke(int op) {
        return op >= INVOKEVIRTUAL && op <= INVOKEDYNAMIC;
    }

    public static boolean isIntBinaryOperator(int op) {
        switch (op) {
            case IADD:
            case ISUB:
            case IMUL:
            case IDIV:
            case IAND:
            case IOR:
            case IXOR:
            case ISHL:
            case ISHR:
            case IUSHR:
                return true;
            default:
                return false;
        }
    }

    /** Constant loads and the integer operators the constant interpreter folds. */
    public static boolean isConstantArithmetic(AbstractInsnNode insn) {
        int op = insn.getOpcode();
        return isIntConstant(insn) || isIntBinaryOperator(op) || op == INEG;
    }

    /**
     * Observable effect in the reachability sense: field stores, calls, returns, throws and allocations.
     */
    public static boolean hasObservableEffect(AbstractInsnNode insn) {
        int op = insn.getOpcode();
        return op == PUTFIELD || op == PUTSTATIC || isInvoke(op) || isReturnOrThrow(op) || op == NEW;
    }

    /** Evaluates a one- or two-operand int branch; the operand order is the stack order. */
    public static boolean evaluateIntJump(int op, int left, int right) {
        switch (op) {
            case IFEQ:
            case IF_ICMPEQ:
                return left == right;
            case IFNE:
            case IF_ICMPNE:
                return left != right;
            case IFLT:
            case IF_ICMPLT:
                return left < right;
            case IFGE:
            case IF_ICMPGE:
                return left >= right;
            case IFGT:
            case IF_ICMPGT:
                return left > right;
            case IFLE:
            case IF_ICMPLE:
                return left <= right;
            default:
                throw new IllegalArgumentException("Not an int branch opcode: " + op);
        }
    }
}
