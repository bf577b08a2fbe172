package by.radioegor146.unflatten.frame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.jar.JarFile;
import java.util.zip.ZipEntry;

/**
 * Serves classes of the processed jar first, then the library jars, then the system class path.
 * Library jars stay open until {@link #close()}; every lookup, found or not, is cached.
 */
public final class JarClassProvider implements ClassProvider, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(JarClassProvider.class);

    private final Map<String, byte[]> moduleClasses;
    private final List<JarFile> libraries;
    private final Map<String, Optional<byte[]>> cache = new ConcurrentHashMap<>();

    private JarClassProvider(Map<String, byte[]> moduleClasses, List<JarFile> libraries) {
        this.moduleClasses = moduleClasses;
        this.libraries = libraries;
    }

    public static JarClassProvider open(Map<String, byte[]> moduleClasses, List<Path> libraries) throws IOException {
        List<JarFile> jars = new ArrayList<>(libraries.size());
        try {
            for (Path library : libraries) {
                jars.add(new JarFile(library.toFile()));
            }
        } catch (IOException e) {
            for (JarFile jar : jars) {
                try {
                    jar.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw e;
        }
        logger.debug("Opened {} library jars", jars.size());
        return new JarClassProvider(moduleClasses, jars);
    }

    @Override
    public byte[] getClassBytes(String internalName) {
        byte[] own = moduleClasses.get(internalName);
        if (own != null) {
            return own;
        }
        return cache.computeIfAbsent(internalName, k -> Optional.ofNullable(lookup(k))).orElse(null);
    }

    private byte[] lookup(String internalName) {
        String resource = internalName + ".class";
        for (JarFile jar : libraries) {
            ZipEntry entry = jar.getEntry(resource);
            if (entry == null) continue;
            try (InputStream in = jar.getInputStream(entry)) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + resource + " from " + jar.getName(), e);
            }
        }
        return ClassProvider.readSystemClass(internalName);
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (JarFile jar : libraries) {
            try {
                jar.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
