package io.codemap.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Hierarchical name of a module.
 * <p>
 * Elixir modules are a list of alias segments ({@code Test.Support.Math}).
 * Erlang modules are a single segment that keeps its leading colon
 * ({@code :lists}). {@link #UNKNOWN} marks a receiver that is only known at runtime.
 *
 * @param segments Name segments, outermost first
 */
public record ModuleIdentifier(List<String> segments) implements Comparable<ModuleIdentifier> {

    /**
     * Placeholder for calls whose receiver is computed at runtime.
     */
    public static final ModuleIdentifier UNKNOWN = new ModuleIdentifier(List.of("?"));

    public ModuleIdentifier {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Module identifier needs at least one segment");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("Blank segment in module identifier: " + segments);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Parse a dotted name such as {@code "Test.Support.Math"} or {@code ":lists"}.
     */
    public static ModuleIdentifier of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Module name must not be blank");
        }
        String trimmed = name.trim();
        if (trimmed.startsWith(":")) {
            return new ModuleIdentifier(List.of(trimmed));
        }
        if (trimmed.startsWith("Elixir.")) {
            trimmed = trimmed.substring("Elixir.".length());
        }
        return new ModuleIdentifier(List.of(trimmed.split("\\.")));
    }

    public static ModuleIdentifier of(List<String> segments) {
        return new ModuleIdentifier(segments);
    }

    /**
     * Returns a new identifier with the given segments appended.
     */
    public ModuleIdentifier concat(List<String> more) {
        List<String> joined = new ArrayList<>(segments);
        joined.addAll(more);
        return new ModuleIdentifier(joined);
    }

    public String lastSegment() {
        return segments.get(segments.size() - 1);
    }

    public boolean isUnknown() {
        return this.equals(UNKNOWN);
    }

    @Override
    public int compareTo(ModuleIdentifier other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
