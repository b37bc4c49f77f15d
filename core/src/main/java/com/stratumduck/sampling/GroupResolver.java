package com.stratumduck.sampling;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes the stratification key list.
 *
 * <p>Keys are resolved to their catalog spelling and duplicates are removed
 * while keeping first-occurrence order. An empty result means the whole
 * relation is one implicit stratum.
 */
public final class GroupResolver {

    private GroupResolver() {}

    /**
     * Resolves grouping keys against a validated schema.
     *
     * @param keys the requested keys, possibly null or empty
     * @param schema the source schema the keys were validated against
     * @return the ordered, canonical, distinct keys
     */
    public static List<String> resolve(List<String> keys, SourceSchema schema) {
        List<String> resolved = new ArrayList<>();
        if (keys == null) {
            return resolved;
        }
        for (String key : keys) {
            String canonical = schema.resolve(key);
            if (!resolved.contains(canonical)) {
                resolved.add(canonical);
            }
        }
        return List.copyOf(resolved);
    }
}
