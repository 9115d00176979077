package com.webspec.executor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Values stored and lists extracted by steps of one scenario.
 *
 * <p>Owned by exactly one scenario execution: a fresh store is created for
 * every scenario and it is never shared between scenarios or worker threads.
 */
public class ValueStore {

    private final Map<String, String>       values    = new HashMap<>();
    private final Map<String, List<String>> extracted = new HashMap<>();

    public void put(String key, String value) {
        values.put(key, value);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public void putList(String key, List<String> items) {
        extracted.put(key, new ArrayList<>(items));
    }

    public List<String> getList(String key) {
        List<String> items = extracted.get(key);
        return items != null ? Collections.unmodifiableList(items) : List.of();
    }

    public boolean hasList(String key) {
        return extracted.containsKey(key);
    }

    public int size() {
        return values.size() + extracted.size();
    }
}
