package by.radioegor146.unflatten;

import by.radioegor146.unflatten.frame.ClassProvider;
import by.radioegor146.unflatten.frame.ComputingFrameClassWriter;
import by.radioegor146.unflatten.frame.JarClassProvider;
import by.radioegor146.unflatten.opaque.MemberResolver;
import by.radioegor146.unflatten.opaque.OpaqueFieldScanner;
import by.radioegor146.unflatten.opaque.OpaqueFieldTable;
import by.radioegor146.unflatten.opaque.OpaqueLoads;
import by.radioegor146.unflatten.opaque.OpaqueReferenceReport;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Reads a jar, removes opaque predicates and flattened control flow from its methods and writes the
 * result to the output directory under the same file name.
 */
public class JarDeobfuscator {

    private static final Logger logger = LoggerFactory.getLogger(JarDeobfuscator.class);

    private AnalysisContext lastContext;

    public Path process(DeobfuscatorConfig config) throws IOException {
        Path inputJarPath = Objects.requireNonNull(config.getInputJarPath(), "inputJarPath");
        Path outputDir = Objects.requireNonNull(config.getOutputDir(), "outputDir");

        Map<String, byte[]> classBytes = new HashMap<>();
        Map<String, ClassNode> classes = new LinkedHashMap<>();
        try (JarFile jar = new JarFile(inputJarPath.toFile())) {
            for (JarEntry entry : Collections.list(jar.entries())) {
                if (!entry.getName().endsWith(".class")) continue;
                byte[] src;
                try (InputStream in = jar.getInputStream(entry)) {
                    src = in.readAllBytes();
                }
                ClassNode cn = new ClassNode(Opcodes.ASM9);
                new ClassReader(src).accept(cn, 0);
                classBytes.put(cn.name, src);
                classes.put(entry.getName(), cn);
            }
        }
        logger.info("Loaded {} classes from {}", classes.size(), inputJarPath);

        Set<String> changedEntries = deobfuscate(config, classes);

        Path outJar = outputDir.resolve(inputJarPath.getFileName().toString());
        Files.createDirectories(outputDir);
        try (JarClassProvider provider = JarClassProvider.open(classBytes, config.getInputLibs());
             JarFile jar = new JarFile(inputJarPath.toFile());
             ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(outJar))) {
            if (jar.getManifest() != null) {
                out.putNextEntry(new ZipEntry(JarFile.MANIFEST_NAME));
                jar.getManifest().write(out);
                out.closeEntry();
            }
            for (JarEntry entry : Collections.list(jar.entries())) {
                String name = entry.getName();
                if (name.equals(JarFile.MANIFEST_NAME)) continue;
                if (!name.endsWith(".class")) {
                    Util.writeEntry(jar, out, entry);
                    continue;
                }
                ClassNode cn = classes.get(name);
                byte[] original = classBytes.get(cn.name);
                byte[] result = changedEntries.contains(name) ? write(cn, provider, original) : original;
                Util.writeEntry(out, name, result);
            }
        }
        logger.info("Written {}", outJar);
        return outJar;
    }

    /**
     * Scans the module and processes every method the filter lets through.
     *
     * @param classes jar entry name to class
     * @return entry names of the classes that changed
     */
    public Set<String> deobfuscate(DeobfuscatorConfig config, Map<String, ClassNode> classes) {
        Diagnostics diagnostics = new Diagnostics(config.getVerbosity());
        Map<String, ClassNode> byName = new LinkedHashMap<>();
        for (ClassNode cn : classes.values()) {
            byName.put(cn.name, cn);
        }
        MemberResolver resolver = new MemberResolver(byName);
        OpaqueFieldTable table = new OpaqueFieldScanner(config, diagnostics).scan(byName.values());
        OpaqueLoads loads = new OpaqueLoads(table, resolver);
        AnalysisContext context = new AnalysisContext(config, diagnostics, loads);
        MethodDeobfuscator methods = new MethodDeobfuscator(context);
        ClassMethodFilter filter = ClassMethodFilter.of(config);

        Set<String> changed = new LinkedHashSet<>();
        for (Map.Entry<String, ClassNode> entry : classes.entrySet()) {
            ClassNode cn = entry.getValue();
            if (!filter.shouldProcess(cn)) continue;
            int simplified = 0;
            for (MethodNode mn : cn.methods) {
                if (!filter.shouldProcess(cn, mn)) continue;
                if (methods.deobfuscate(cn.name, mn)) {
                    simplified++;
                }
            }
            if (simplified > 0) {
                changed.add(entry.getKey());
                logger.debug("Simplified {} methods in {}", simplified, cn.name);
            }
        }

        OpaqueReferenceReport.collect(byName.values(), loads).log(diagnostics, context.getReplacedLoads());
        diagnostics.summary("Methods simplified: {}, failed: {}, decoy blocks removed: {}",
                context.getMethodsSimplified(), context.getMethodsFailed(), context.getDecoysRemoved());
        lastContext = context;
        return changed;
    }

    /** Context of the most recent run, for reporting. */
    public AnalysisContext getLastContext() {
        return lastContext;
    }

    private static byte[] write(ClassNode cn, ClassProvider provider, byte[] original) {
        try {
            ComputingFrameClassWriter cw = new ComputingFrameClassWriter(provider);
            cn.accept(cw);
            return cw.toByteArray();
        } catch (RuntimeException e) {
            logger.error("Failed to write class {}, keeping original bytes: {}", cn.name, e.getMessage());
            return original;
        }
    }
}
