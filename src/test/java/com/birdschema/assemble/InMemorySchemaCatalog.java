package com.birdschema.assemble;

import com.birdschema.introspect.CatalogColumn;
import com.birdschema.introspect.SchemaCatalog;
import com.birdschema.model.ForeignKeyRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Catalog over hand-built tables, for exercising the assembly without a database.
 */
class InMemorySchemaCatalog implements SchemaCatalog {
    private final Map<String, Table> tables = new TreeMap<>();
    final List<String> sampledColumns = new ArrayList<>();

    Table table(String name) {
        return tables.computeIfAbsent(name, Table::new);
    }

    @Override
    public List<String> listTables() {
        return new ArrayList<>(tables.keySet());
    }

    @Override
    public Set<String> primaryKeyColumns(String table) {
        return new LinkedHashSet<>(require(table).primaryKey);
    }

    @Override
    public Map<String, List<ForeignKeyRef>> foreignKeysByColumn(String table) {
        Map<String, List<ForeignKeyRef>> result = new LinkedHashMap<>();
        require(table).foreignKeys.forEach((column, refs) -> result.put(column, new ArrayList<>(refs)));
        return result;
    }

    @Override
    public List<CatalogColumn> columns(String table) {
        List<CatalogColumn> result = new ArrayList<>();
        int position = 1;
        for (Column column : require(table).columns.values()) {
            result.add(new CatalogColumn(column.name, column.type, position++));
        }
        return result;
    }

    @Override
    public List<String> sampleValues(String table, String column, int limit) {
        sampledColumns.add(table + "." + column);
        return require(table).columns.get(column).values.stream()
                .filter(Objects::nonNull)
                .limit(limit)
                .map(String::valueOf)
                .toList();
    }

    private Table require(String table) {
        Table t = tables.get(table);
        if (t == null) {
            throw new IllegalArgumentException("Unknown table " + table);
        }
        return t;
    }

    static class Table {
        final String name;
        final Map<String, Column> columns = new LinkedHashMap<>();
        final Set<String> primaryKey = new LinkedHashSet<>();
        final Map<String, List<ForeignKeyRef>> foreignKeys = new LinkedHashMap<>();

        Table(String name) {
            this.name = name;
        }

        Table column(String name, String type, Object... values) {
            columns.put(name, new Column(name, type, Arrays.asList(values)));
            return this;
        }

        Table primaryKey(String... columnNames) {
            primaryKey.addAll(List.of(columnNames));
            return this;
        }

        Table foreignKey(String column, String targetTable, String targetColumn) {
            foreignKeys.computeIfAbsent(column, k -> new ArrayList<>())
                    .add(new ForeignKeyRef(targetTable, targetColumn));
            return this;
        }
    }

    record Column(String name, String type, List<Object> values) {}
}
