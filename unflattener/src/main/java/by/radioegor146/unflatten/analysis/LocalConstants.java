package by.radioegor146.unflatten.analysis;

import java.util.*;

/**
 * Local slot to the int constants it may hold. A slot that is absent is not tracked. A slot that also
 * receives a value other than a constant is unknown, stays unknown through merges and is never tracked.
 */
public final class LocalConstants {

    private final Map<Integer, Set<Integer>> slots = new TreeMap<>();
    private final Set<Integer> unknown = new TreeSet<>();

    public LocalConstants() {
    }

    public LocalConstants(LocalConstants other) {
        for (Map.Entry<Integer, Set<Integer>> entry : other.slots.entrySet()) {
            slots.put(entry.getKey(), new TreeSet<>(entry.getValue()));
        }
        unknown.addAll(other.unknown);
    }

    public void add(int slot, int value) {
        slots.computeIfAbsent(slot, k -> new TreeSet<>()).add(value);
    }

    public void markUnknown(int slot) {
        unknown.add(slot);
    }

    public boolean isUnknown(int slot) {
        return unknown.contains(slot);
    }

    public Set<Integer> unknownSlots() {
        return Collections.unmodifiableSet(unknown);
    }

    /** @return whether anything was added */
    public boolean mergeFrom(LocalConstants other) {
        boolean changed = unknown.addAll(other.unknown);
        for (Map.Entry<Integer, Set<Integer>> entry : other.slots.entrySet()) {
            changed |= slots.computeIfAbsent(entry.getKey(), k -> new TreeSet<>()).addAll(entry.getValue());
        }
        return changed;
    }

    public boolean isTracked(int slot) {
        return slots.containsKey(slot) && !unknown.contains(slot);
    }

    public Set<Integer> get(int slot) {
        Set<Integer> values = slots.get(slot);
        return values == null ? Collections.emptySet() : Collections.unmodifiableSet(values);
    }

    public boolean isEmpty() {
        return slots.isEmpty() && unknown.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LocalConstants && slots.equals(((LocalConstants) o).slots)
                && unknown.equals(((LocalConstants) o).unknown);
    }

    @Override
    public int hashCode() {
        return 31 * slots.hashCode() + unknown.hashCode();
    }

    @Override
    public String toString() {
        return unknown.isEmpty() ? slots.toString() : slots + " unknown=" + unknown;
    }
}
