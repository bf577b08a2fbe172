package by.radioegor146.unflatten.opaque;

import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.*;

/**
 * Resolves field and method references against the classes of the processed jar.
 * <p>
 * Lookup walks the superclass chain of the referenced owner first. A reference whose owner is not part
 * of the jar is matched by name and descriptor across all classes, which is how obfuscated jars with
 * stale owners still resolve. An ambiguous name match counts as unresolved.
 */
public final class MemberResolver {

    private final Map<String, ClassNode> classes;

    public MemberResolver(Map<String, ClassNode> classes) {
        this.classes = classes;
    }

    public Collection<ClassNode> getClasses() {
        return Collections.unmodifiableCollection(classes.values());
    }

    public ClassNode getClass(String internalName) {
        return classes.get(internalName);
    }

    /** @return the declaring field, or null */
    public FieldKey resolveField(String owner, String name, String desc) {
        Set<String> visited = new HashSet<>();
        for (ClassNode cn = classes.get(owner); cn != null && visited.add(cn.name); cn = classes.get(cn.superName)) {
            for (FieldNode field : cn.fields) {
                if (field.name.equals(name) && field.desc.equals(desc)) {
                    return new FieldKey(cn.name, name, desc);
                }
            }
        }
        if (classes.containsKey(owner)) {
            return null;
        }
        FieldKey found = null;
        for (ClassNode cn : classes.values()) {
            for (FieldNode field : cn.fields) {
                if (field.name.equals(name) && field.desc.equals(desc)) {
                    if (found != null) {
                        return null;
                    }
                    found = new FieldKey(cn.name, name, desc);
                }
            }
        }
        return found;
    }

    /** @return the method with a body that the reference denotes, or null */
    public MethodNode resolveMethod(String owner, String name, String desc) {
        Set<String> visited = new HashSet<>();
        for (ClassNode cn = classes.get(owner); cn != null && visited.add(cn.name); cn = classes.get(cn.superName)) {
            MethodNode method = findMethod(cn, name, desc);
            if (method != null) {
                return method;
            }
        }
        if (classes.containsKey(owner)) {
            return null;
        }
        MethodNode found = null;
        for (ClassNode cn : classes.values()) {
            MethodNode method = findMethod(cn, name, desc);
            if (method != null) {
                if (found != null) {
                    return null;
                }
                found = method;
            }
        }
        return found;
    }

    private static MethodNode findMethod(ClassNode cn, String name, String desc) {
        for (MethodNode method : cn.methods) {
            if (method.name.equals(name) && method.desc.equals(desc)) {
                return method;
            }
        }
        return null;
    }
}
