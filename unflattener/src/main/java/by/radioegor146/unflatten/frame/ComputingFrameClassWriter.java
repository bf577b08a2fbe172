package by.radioegor146.unflatten.frame;

import org.objectweb.asm.ClassWriter;

/** Resolves common super classes through a {@link ClassProvider} instead of {@code Class.forName}. */
public class ComputingFrameClassWriter extends ClassWriter {
    private final ClassProvider provider;

    public ComputingFrameClassWriter(ClassProvider provider) {
        super(COMPUTE_FRAMES | COMPUTE_MAXS);
        this.provider = provider;
    }

    @Override
    protected String getCommonSuperClass(String type1, String type2) {
        return provider.commonSuper(type1, type2);
    }
}
