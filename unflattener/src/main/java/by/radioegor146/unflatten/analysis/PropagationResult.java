package by.radioegor146.unflatten.analysis;

import java.util.Map;

/**
 * Entry and exit snapshots per block. Blocks the propagator never visited have no snapshot.
 */
public final class PropagationResult {

    private final Map<Integer, LocalConstants> entry;
    private final Map<Integer, LocalConstants> exit;

    PropagationResult(Map<Integer, LocalConstants> entry, Map<Integer, LocalConstants> exit) {
        this.entry = entry;
        this.exit = exit;
    }

    /** @return the snapshot on entry, or null when the block was not visited */
    public LocalConstants entryOf(int block) {
        return entry.get(block);
    }

    public LocalConstants exitOf(int block) {
        return exit.get(block);
    }

    public boolean isVisited(int block) {
        return exit.containsKey(block);
    }

    public int visitedCount() {
        return exit.size();
    }
}
