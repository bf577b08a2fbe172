package by.radioegor146.unflatten.pattern;

import by.radioegor146.unflatten.DeobfuscatorConfig;
import by.radioegor146.unflatten.opaque.MemberResolver;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a method looks like an async state machine. Decoy recognition is limited to these
 * methods, ordinary small switches are left alone.
 * <p>
 * The signature and name conventions are checked first. The body then counts when it reads or writes
 * the state field of a class extending one of the state machine base types, or calls one of the
 * indicator methods.
 */
public final class AsyncMethodDetector implements Opcodes {

    private final DeobfuscatorConfig config;
    private final MemberResolver resolver;

    public AsyncMethodDetector(DeobfuscatorConfig config) {
        this(config, null);
    }

    /** @param resolver classes of the module, used to find state machine classes; may be null */
    public AsyncMethodDetector(DeobfuscatorConfig config, MemberResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    public boolean isAsyncStyle(MethodNode method) {
        return hasAsyncSignature(method) || hasAsyncBody(method);
    }

    boolean hasAsyncSignature(MethodNode method) {
        Type returnType = Type.getReturnType(method.desc);
        if (returnType.getSort() == Type.OBJECT && config.getAsyncWrapperTypes().contains(returnType.getInternalName())) {
            return true;
        }
        if (config.getContinuationMethodNames().contains(method.name)) {
            return true;
        }
        Type[] args = Type.getArgumentTypes(method.desc);
        if (args.length > 0 && args[args.length - 1].getSort() == Type.OBJECT
                && args[args.length - 1].getInternalName().equals(config.getContinuationType())) {
            return true;
        }
        String suffix = config.getAsyncSuffix();
        return suffix != null && !suffix.isEmpty() && method.name.endsWith(suffix);
    }

    boolean hasAsyncBody(MethodNode method) {
        for (AbstractInsnNode insn = method.instructions.getFirst(); insn != null; insn = insn.getNext()) {
            if (insn instanceof MethodInsnNode call
                    && config.getAsyncIndicatorCalls().contains(call.owner + "." + call.name)) {
                return true;
            }
            if (insn instanceof FieldInsnNode field && isStateFieldAccess(field)) {
                return true;
            }
        }
        return false;
    }

    private boolean isStateFieldAccess(FieldInsnNode field) {
        if (field.getOpcode() != GETFIELD && field.getOpcode() != PUTFIELD) return false;
        if (!"I".equals(field.desc) || !config.getStateFieldNames().contains(field.name)) return false;
        return extendsStateMachineBase(field.owner);
    }

    private boolean extendsStateMachineBase(String owner) {
        if (resolver == null) return false;
        Set<String> visited = new HashSet<>();
        for (ClassNode cn = resolver.getClass(owner); cn != null && visited.add(cn.name); cn = resolver.getClass(cn.superName)) {
            if (config.getStateMachineBaseTypes().contains(cn.superName)) {
                return true;
            }
        }
        return false;
    }
}
