package com.mini.csvtools.sort;

import com.mini.csvtools.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 排序键
 * 要么是一个或多个（列名, 升/降序），要么是随机顺序标记（带显式种子）
 */
public final class SortKey {

    /**
     * 排序列
     */
    public static final class Column {
        private final String name;
        private final boolean ascending;

        private Column(String name, boolean ascending) {
            this.name = Objects.requireNonNull(name, "Sort column cannot be null");
            this.ascending = ascending;
        }

        public static Column asc(String name) {
            return new Column(name, true);
        }

        public static Column desc(String name) {
            return new Column(name, false);
        }

        public String getName() {
            return name;
        }

        public boolean isAscending() {
            return ascending;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Column column = (Column) o;
            return ascending == column.ascending && name.equals(column.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, ascending);
        }

        @Override
        public String toString() {
            return name + (ascending ? " ASC" : " DESC");
        }
    }

    private final List<Column> columns;
    private final boolean random;
    private final long seed;

    private SortKey(List<Column> columns, boolean random, long seed) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.random = random;
        this.seed = seed;
    }

    public static SortKey of(List<Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("Sort key needs at least one column");
        }
        return new SortKey(columns, false, 0L);
    }

    public static SortKey of(Column... columns) {
        List<Column> list = new ArrayList<>();
        Collections.addAll(list, columns);
        return of(list);
    }

    public static SortKey ascending(String... names) {
        List<Column> list = new ArrayList<>();
        for (String name : names) {
            list.add(Column.asc(name));
        }
        return of(list);
    }

    public static SortKey descending(String... names) {
        List<Column> list = new ArrayList<>();
        for (String name : names) {
            list.add(Column.desc(name));
        }
        return of(list);
    }

    /**
     * 随机顺序，种子决定一次运行内生成的随机全序
     */
    public static SortKey random(long seed) {
        return new SortKey(Collections.emptyList(), true, seed);
    }

    /**
     * 解析 "col1,col2:desc,col3:asc" 形式的排序键
     */
    public static SortKey parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new ConfigurationException("Sort key is empty");
        }
        List<Column> list = new ArrayList<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            int colon = item.lastIndexOf(':');
            String name = colon < 0 ? item : item.substring(0, colon).trim();
            String direction = colon < 0 ? "asc" : item.substring(colon + 1).trim().toLowerCase();
            if (name.isEmpty()) {
                throw new ConfigurationException("Empty column name in sort key: " + text);
            }
            if (direction.equals("asc")) {
                list.add(Column.asc(name));
            } else if (direction.equals("desc")) {
                list.add(Column.desc(name));
            } else {
                throw new ConfigurationException("Unknown sort direction '" + direction + "' in: " + text);
            }
        }
        return of(list);
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    public boolean isRandom() {
        return random;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SortKey sortKey = (SortKey) o;
        return random == sortKey.random && seed == sortKey.seed && columns.equals(sortKey.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, random, seed);
    }

    @Override
    public String toString() {
        return random ? "SortKey{random, seed=" + seed + '}' : "SortKey" + columns;
    }
}
