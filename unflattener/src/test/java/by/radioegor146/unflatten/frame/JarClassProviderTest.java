package by.radioegor146.unflatten.frame;

import by.radioegor146.unflatten.Util;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class JarClassProviderTest implements Opcodes {

    @TempDir
    Path temp;

    private static byte[] emptyClass(String name, String superName, int access, String... interfaces) {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(V1_8, access, name, null, superName, interfaces);
        cw.visitEnd();
        return cw.toByteArray();
    }

    private Path libraryJar() throws IOException {
        Path jar = temp.resolve("lib.jar");
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            Util.writeEntry(out, "lib/Base.class", emptyClass("lib/Base", "java/lang/Object", ACC_PUBLIC | ACC_SUPER));
            Util.writeEntry(out, "lib/Named.class",
                    emptyClass("lib/Named", "java/lang/Object", ACC_PUBLIC | ACC_INTERFACE | ACC_ABSTRACT));
        }
        return jar;
    }

    private static Map<String, byte[]> moduleClasses() {
        return Map.of(
                "app/Left", emptyClass("app/Left", "lib/Base", ACC_PUBLIC | ACC_SUPER, "lib/Named"),
                "app/Right", emptyClass("app/Right", "lib/Base", ACC_PUBLIC | ACC_SUPER));
    }

    @Test
    public void testHierarchyAcrossModuleAndLibrary() throws IOException {
        try (JarClassProvider provider = JarClassProvider.open(moduleClasses(), List.of(libraryJar()))) {
            assertEquals("lib/Base", provider.commonSuper("app/Left", "app/Right"));
            assertEquals("lib/Base", provider.getSuperName("app/Left"));
            assertTrue(provider.isInterface("lib/Named"));
            assertTrue(provider.isAssignableFrom("lib/Named", "app/Left"));
            assertFalse(provider.isAssignableFrom("lib/Named", "app/Right"));
            assertNotNull(provider.getClassBytes("java/lang/String"));
        }
    }

    @Test
    public void testLookupsAreCachedIncludingMisses() throws IOException {
        JarClassProvider provider = JarClassProvider.open(moduleClasses(), List.of(libraryJar()));
        byte[] base = provider.getClassBytes("lib/Base");
        assertNotNull(base);
        assertSame(base, provider.getClassBytes("lib/Base"));
        assertNull(provider.getClassBytes("lib/Missing"));

        // a second lookup never touches the closed library jar
        provider.close();
        assertSame(base, provider.getClassBytes("lib/Base"));
        assertNull(provider.getClassBytes("lib/Missing"));
    }

    @Test
    public void testMissingLibraryFailsToOpen() {
        assertThrows(IOException.class, () -> JarClassProvider.open(Map.of(), List.of(temp.resolve("absent.jar"))));
    }
}
