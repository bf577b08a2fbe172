package by.radioegor146.unflatten;

import java.io.IOException;
import java.io.InputStream;
import java.util.jar.JarFile;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class Util {

    private Util() {
    }

    public static void writeEntry(ZipOutputStream out, String name, byte[] data) throws IOException {
        ZipEntry entry = new ZipEntry(name);
        out.putNextEntry(entry);
        out.write(data, 0, data.length);
        out.closeEntry();
    }

    public static void writeEntry(JarFile jar, ZipOutputStream out, ZipEntry entry) throws IOException {
        try (InputStream in = jar.getInputStream(entry)) {
            writeEntry(out, entry.getName(), in.readAllBytes());
        }
    }
}
