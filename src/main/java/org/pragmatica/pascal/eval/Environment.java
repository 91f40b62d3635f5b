package org.pragmatica.pascal.eval;

import org.pragmatica.pascal.value.Numeric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Variable store of the {@link Evaluator}. Names match case-insensitively. The spelling
 * used in the first assignment is kept for display. Entries are never removed.
 */
public final class Environment {
    private final Map<String, Slot> slots = new LinkedHashMap<>();

    private record Slot(String displayName, Numeric value) {}

    /**
     * Insert or update. An existing slot keeps its original spelling.
     */
    void assign(String name, Numeric value) {
        slots.merge(key(name),
                    new Slot(name, value),
                    (existing, fresh) -> new Slot(existing.displayName(), fresh.value()));
    }

    public Optional<Numeric> lookup(String name) {
        return Optional.ofNullable(slots.get(key(name)))
                       .map(Slot::value);
    }

    public boolean contains(String name) {
        return slots.containsKey(key(name));
    }

    public int size() {
        return slots.size();
    }

    /**
     * Read-only snapshot keyed by display name, in first-assignment order.
     */
    public Map<String, Numeric> asMap() {
        var view = new LinkedHashMap<String, Numeric>();
        slots.values()
             .forEach(slot -> view.put(slot.displayName(), slot.value()));
        return Collections.unmodifiableMap(view);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }

    static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
