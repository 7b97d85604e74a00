package com.libragraph.salvage.core.xref;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * FormID to entry map in which the first registration wins. Later entries for the same
 * FormID are kept aside as duplicates. Iteration follows registration order.
 */
public final class FormIdIndex<T> {

    private final Map<Integer, T> entries = new LinkedHashMap<>();
    private final List<T> duplicates = new ArrayList<>();

    public static <T> FormIdIndex<T> of(List<T> items, ToIntFunction<T> formId) {
        FormIdIndex<T> index = new FormIdIndex<>();
        for (T item : items) {
            index.register(formId.applyAsInt(item), item);
        }
        return index;
    }

    /**
     * @return false when the FormID was already registered; the entry is then kept as a duplicate
     */
    public boolean register(int formId, T entry) {
        if (entries.putIfAbsent(formId, entry) != null) {
            duplicates.add(entry);
            return false;
        }
        return true;
    }

    public Optional<T> get(int formId) {
        return Optional.ofNullable(entries.get(formId));
    }

    public boolean contains(int formId) {
        return entries.containsKey(formId);
    }

    public int size() {
        return entries.size();
    }

    public Map<Integer, T> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public List<T> duplicates() {
        return Collections.unmodifiableList(duplicates);
    }
}
