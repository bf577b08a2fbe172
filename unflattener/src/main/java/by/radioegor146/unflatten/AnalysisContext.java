package by.radioegor146.unflatten;

import by.radioegor146.unflatten.opaque.OpaqueFieldTable;
import by.radioegor146.unflatten.opaque.OpaqueLoads;

/**
 * State shared by all methods of one module: configuration, the opaque field table and run counters.
 * Single-threaded; the table is not modified after the scan.
 */
public final class AnalysisContext {

    private final DeobfuscatorConfig config;
    private final Diagnostics diagnostics;
    private final OpaqueLoads opaqueLoads;

    private int replacedLoads;
    private int decoysRemoved;
    private int methodsSimplified;
    private int methodsFailed;

    public AnalysisContext(DeobfuscatorConfig config, Diagnostics diagnostics, OpaqueLoads opaqueLoads) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.opaqueLoads = opaqueLoads;
    }

    public DeobfuscatorConfig getConfig() {
        return config;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public OpaqueLoads getOpaqueLoads() {
        return opaqueLoads;
    }

    public OpaqueFieldTable getOpaqueFields() {
        return opaqueLoads.getTable();
    }

    public void addReplacedLoads(int count) {
        replacedLoads += count;
    }

    public int getReplacedLoads() {
        return replacedLoads;
    }

    public void addDecoysRemoved(int count) {
        decoysRemoved += count;
    }

    public int getDecoysRemoved() {
        return decoysRemoved;
    }

    public void methodSimplified() {
        methodsSimplified++;
    }

    public int getMethodsSimplified() {
        return methodsSimplified;
    }

    public void methodFailed() {
        methodsFailed++;
    }

    public int getMethodsFailed() {
        return methodsFailed;
    }
}
