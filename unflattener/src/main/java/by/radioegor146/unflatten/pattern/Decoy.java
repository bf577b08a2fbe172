package by.radioegor146.unflatten.pattern;

import by.radioegor146.unflatten.blocks.Block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A block recognized as synthetic control flow. Compare and no-op decoys carry the successor execution
 * really takes. Dispatch decoys carry one route per predecessor instead, and are only removable when
 * every predecessor was routed.
 */
public final class Decoy {

    private final int block;
    private final DecoyKind kind;
    private final int successor;
    private final Map<Integer, Integer> routes;
    private final boolean removable;

    private Decoy(int block, DecoyKind kind, int successor, Map<Integer, Integer> routes, boolean removable) {
        this.block = block;
        this.kind = kind;
        this.successor = successor;
        this.routes = routes;
        this.removable = removable;
    }

    public static Decoy redirect(int block, DecoyKind kind, int successor) {
        if (kind == DecoyKind.DISPATCH_SWITCH) {
            throw new IllegalArgumentException("Dispatch decoys are routed per predecessor");
        }
        return new Decoy(block, kind, successor, Collections.emptyMap(), true);
    }

    public static Decoy dispatch(int block, Map<Integer, Integer> routes, boolean removable) {
        return new Decoy(block, DecoyKind.DISPATCH_SWITCH, Block.NONE,
                Collections.unmodifiableMap(new LinkedHashMap<>(routes)), removable);
    }

    public int getBlock() {
        return block;
    }

    public DecoyKind getKind() {
        return kind;
    }

    /** @return the real successor, {@link Block#NONE} for dispatch decoys */
    public int getSuccessor() {
        return successor;
    }

    /** Predecessor block to the case block it really reaches. */
    public Map<Integer, Integer> getRoutes() {
        return routes;
    }

    public boolean isRemovable() {
        return removable;
    }

    @Override
    public String toString() {
        if (kind == DecoyKind.DISPATCH_SWITCH) {
            return kind + " B" + block + " routes=" + routes + (removable ? "" : " (kept)");
        }
        return kind + " B" + block + " -> B" + successor;
    }
}
