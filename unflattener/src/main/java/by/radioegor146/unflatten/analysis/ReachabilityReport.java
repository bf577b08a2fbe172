package by.radioegor146.unflatten.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-block reachability and emptiness. A block is empty when none of its instructions has an
 * observable effect (see {@link Insns#hasObservableEffect}).
 */
public final class ReachabilityReport {

    private final boolean[] reachable;
    private final boolean[] empty;

    ReachabilityReport(boolean[] reachable, boolean[] empty) {
        this.reachable = reachable;
        this.empty = empty;
    }

    public int size() {
        return reachable.length;
    }

    public boolean isReachable(int block) {
        return reachable[block];
    }

    public boolean isEmpty(int block) {
        return empty[block];
    }

    public List<Integer> unreachableBlocks() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < reachable.length; i++) {
            if (!reachable[i]) out.add(i);
        }
        return out;
    }

    public int reachableCount() {
        int count = 0;
        for (boolean r : reachable) {
            if (r) count++;
        }
        return count;
    }

    public int emptyCount() {
        int count = 0;
        for (boolean e : empty) {
            if (e) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return "reachable " + reachableCount() + "/" + size() + ", empty " + emptyCount();
    }
}
