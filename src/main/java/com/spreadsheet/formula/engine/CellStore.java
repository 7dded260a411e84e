package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.ComputedResult;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Raw authored content per cell, plus the memoized results computed from it.
 * Keys are canonical addresses ("Sheet1!A1").
 */
public class CellStore {

    // Insertion order is kept so exports list cells in the order they were authored
    private final Map<String, String> rawContents = new LinkedHashMap<>();
    private final Map<String, ComputedResult> cache = new HashMap<>();

    public void setContent(String address, String rawValue) {
        rawContents.put(address, rawValue);
    }

    public Optional<String> getRawContent(String address) {
        return Optional.ofNullable(rawContents.get(address));
    }

    /**
     * Removes the authored content; returns what was there, if anything.
     */
    public Optional<String> clearContent(String address) {
        return Optional.ofNullable(rawContents.remove(address));
    }

    public Optional<ComputedResult> getCachedResult(String address) {
        return Optional.ofNullable(cache.get(address));
    }

    public void putCachedResult(String address, ComputedResult result) {
        cache.put(address, result);
    }

    public void evict(String address) {
        cache.remove(address);
    }

    public void evictAll(Collection<String> addresses) {
        for (String address : addresses) {
            cache.remove(address);
        }
    }

    public void evictAll() {
        cache.clear();
    }

    public boolean isCached(String address) {
        return cache.containsKey(address);
    }

    /**
     * Snapshot of every authored cell.
     */
    public Map<String, String> rawContents() {
        return new LinkedHashMap<>(rawContents);
    }

    public void clear() {
        rawContents.clear();
        cache.clear();
    }
}
