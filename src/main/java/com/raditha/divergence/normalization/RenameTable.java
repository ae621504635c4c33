package com.raditha.divergence.normalization;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token to canonical name table for one normalization call.
 * Names are handed out as {@code <prefix>0, <prefix>1, ...} in first-seen order.
 */
final class RenameTable {

    private final String prefix;
    private final Map<String, String> names = new LinkedHashMap<>();

    RenameTable(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Canonical name for {@code token}, assigning the next one on first sight.
     */
    String rename(String token) {
        return names.computeIfAbsent(token, t -> prefix + names.size());
    }

    /**
     * @return the canonical name, or null if the token was never assigned one
     */
    String lookup(String token) {
        return names.get(token);
    }

    int size() {
        return names.size();
    }
}
