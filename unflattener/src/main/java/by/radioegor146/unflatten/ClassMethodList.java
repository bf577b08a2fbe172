package by.radioegor146.unflatten;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Black or white list entries, one per line: {@code pkg/Class}, {@code pkg/Class#method},
 * {@code pkg/Class#method!desc}, or a prefix ending in {@code *}. Blank lines and {@code #} comments are
 * ignored.
 */
public class ClassMethodList {

    private final List<String> entries;

    private ClassMethodList(List<String> entries) {
        this.entries = entries;
    }

    public static ClassMethodList parse(List<String> lines) {
        List<String> entries = new ArrayList<>();
        if (lines != null) {
            for (String line : lines) {
                String entry = line.trim();
                if (entry.isEmpty() || entry.startsWith("#")) continue;
                entries.add(entry.replace('.', '/'));
            }
        }
        return new ClassMethodList(entries);
    }

    public static String nameOf(String className, String methodName, String methodDesc) {
        return className + "#" + methodName + "!" + methodDesc;
    }

    public List<String> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @param name a class name or a name built by {@link #nameOf}
     */
    public boolean contains(String name) {
        for (String entry : entries) {
            if (matches(entry, name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(String entry, String name) {
        if (entry.endsWith("*")) {
            return name.startsWith(entry.substring(0, entry.length() - 1));
        }
        if (entry.equals(name)) {
            return true;
        }
        int hash = name.indexOf('#');
        if (hash < 0) {
            return false;
        }
        if (entry.equals(name.substring(0, hash))) {
            return true;
        }
        int bang = name.indexOf('!', hash);
        return bang >= 0 && entry.equals(name.substring(0, bang));
    }
}
