package com.questrail.herald.domain.train;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persisted train state: named station shortcuts. Watches are deliberately
 * not persisted.
 *
 * @param shortcuts lower-cased shortcut name to station code
 */
public record TrainState(Map<String, String> shortcuts)
{
    public TrainState {
        shortcuts = shortcuts == null ? Map.of() : Map.copyOf(shortcuts);
    }

    public static TrainState empty() {
        return new TrainState(Map.of());
    }

    public Optional<String> shortcut(String name) {
        return Optional.ofNullable(shortcuts.get(key(name)));
    }

    public TrainState withShortcut(String name, String crs) {
        Map<String, String> next = new TreeMap<>(shortcuts);
        next.put(key(name), crs);
        return new TrainState(next);
    }

    public TrainState withoutShortcut(String name) {
        Map<String, String> next = new TreeMap<>(shortcuts);
        next.remove(key(name));
        return new TrainState(next);
    }

    static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
