package by.radioegor146.unflatten.frame;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Class hierarchy lookups for the class writer, served without loading any class. */
public interface ClassProvider {

    String OBJECT = "java/lang/Object";

    /** @return the class file bytes for {@code internalName}, or null when unknown */
    byte[] getClassBytes(String internalName);

    /** Reads from the system class path only. */
    static ClassProvider ofClasspathFallback() {
        return new ClassProvider() {
            private final Map<String, Optional<byte[]>> cache = new ConcurrentHashMap<>();

            @Override
            public byte[] getClassBytes(String internalName) {
                return cache.computeIfAbsent(internalName, k -> Optional.ofNullable(readSystemClass(k))).orElse(null);
            }
        };
    }

    static byte[] readSystemClass(String internalName) {
        try (InputStream in = ClassLoader.getSystemResourceAsStream(internalName + ".class")) {
            return in == null ? null : in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    default ClassNode readClassNode(String internalName) {
        byte[] bytes = getClassBytes(internalName);
        if (bytes == null) return null;
        ClassNode cn = new ClassNode();
        new ClassReader(bytes).accept(cn, ClassReader.SKIP_CODE);
        return cn;
    }

    default String getSuperName(String internalName) {
        if (OBJECT.equals(internalName)) return null;
        ClassNode cn = readClassNode(internalName);
        return cn != null ? cn.superName : OBJECT;
    }

    default String[] getInterfaces(String internalName) {
        ClassNode cn = readClassNode(internalName);
        return cn != null ? cn.interfaces.toArray(new String[0]) : new String[0];
    }

    default boolean isInterface(String internalName) {
        ClassNode cn = readClassNode(internalName);
        return cn != null && (cn.access & org.objectweb.asm.Opcodes.ACC_INTERFACE) != 0;
    }

    /** Whether {@code a} is {@code b} or one of its supertypes. */
    default boolean isAssignableFrom(String a, String b) {
        if (a.equals(b) || OBJECT.equals(a)) return true;
        Set<String> visited = new HashSet<>();
        String cur = b;
        while (cur != null && visited.add(cur)) {
            if (a.equals(cur)) return true;
            for (String itf : getInterfaces(cur)) {
                if (isAssignableFrom(a, itf)) return true;
            }
            cur = getSuperName(cur);
        }
        return false;
    }

    default String commonSuper(String t1, String t2) {
        if (t1.equals(t2)) return t1;
        if (isInterface(t1) || isInterface(t2)) {
            if (isAssignableFrom(t1, t2)) return t1;
            if (isAssignableFrom(t2, t1)) return t2;
            return OBJECT;
        }
        if (isAssignableFrom(t1, t2)) return t1;
        if (isAssignableFrom(t2, t1)) return t2;
        String s = t1;
        Set<String> visited = new HashSet<>();
        while (s != null && visited.add(s) && !isAssignableFrom(s, t2)) {
            s = getSuperName(s);
        }
        return s != null ? s : OBJECT;
    }
}
