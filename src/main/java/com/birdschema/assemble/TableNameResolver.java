package com.birdschema.assemble;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps manifest table names onto live table names: exact match first, then a
 * case-insensitive match. No fuzzy matching.
 */
public class TableNameResolver {
    private final Set<String> liveNames;
    private final Map<String, List<String>> liveByLowerName;

    public TableNameResolver(Collection<String> liveTables) {
        this.liveNames = new HashSet<>(liveTables);
        this.liveByLowerName = new LinkedHashMap<>();
        for (String table : liveTables) {
            liveByLowerName.computeIfAbsent(lower(table), k -> new ArrayList<>()).add(table);
        }
    }

    /**
     * @throws AmbiguousTableNameException if there is no exact match and
     *         several live tables match ignoring case
     */
    public TableResolution resolve(String requested) {
        if (liveNames.contains(requested)) {
            return new TableResolution(requested, requested, TableResolution.Kind.EXACT);
        }

        List<String> candidates = liveByLowerName.get(lower(requested));
        if (candidates == null) {
            return new TableResolution(requested, null, TableResolution.Kind.UNRESOLVED);
        }
        if (candidates.size() > 1) {
            throw new AmbiguousTableNameException(requested, candidates);
        }
        return new TableResolution(requested, candidates.get(0), TableResolution.Kind.CASE_INSENSITIVE);
    }

    private static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
