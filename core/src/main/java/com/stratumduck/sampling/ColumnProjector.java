package com.stratumduck.sampling;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which columns the output relation carries.
 *
 * <p>With no explicit targets (null, empty, or the single wildcard
 * {@code "*"}) every source column that is not a grouping key is projected.
 * Explicit targets are used as given, in catalog spelling. In both cases the
 * grouping keys follow, except those already projected, so the output never
 * has two columns with the same name.
 */
public final class ColumnProjector {

    public static final String WILDCARD = "*";

    private ColumnProjector() {}

    /**
     * Returns whether the target list asks for the default projection.
     */
    public static boolean isDefaultProjection(List<String> targets) {
        return targets == null
            || targets.isEmpty()
            || (targets.size() == 1 && WILDCARD.equals(targets.get(0).trim()));
    }

    /**
     * Computes the output columns.
     *
     * @param targets the requested target columns
     * @param keys the resolved grouping keys
     * @param schema the validated source schema
     * @return the ordered output columns
     */
    public static List<String> project(List<String> targets, List<String> keys, SourceSchema schema) {
        List<String> columns = new ArrayList<>();
        if (isDefaultProjection(targets)) {
            for (String column : schema.columns()) {
                if (!keys.contains(column)) {
                    columns.add(column);
                }
            }
        } else {
            for (String target : targets) {
                String canonical = schema.resolve(target);
                if (!columns.contains(canonical)) {
                    columns.add(canonical);
                }
            }
        }
        for (String key : keys) {
            if (!columns.contains(key)) {
                columns.add(key);
            }
        }
        return List.copyOf(columns);
    }
}
