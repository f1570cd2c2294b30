package com.tablette.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * An ordered axis label for a {@link ResultTable}. Each entry is a tuple holding one value
 * per {@link Level}. A flat index is simply the depth-1 case, so callers walk flat and
 * multi-level indexes through the same operations.
 * <p>
 * Instances are immutable; every transforming method returns a new index.
 */
public final class HierarchicalIndex {
    private final List<Level> levels;
    private final List<List<Object>> entries;

    private HierarchicalIndex(List<Level> levels, List<List<Object>> entries) {
        this.levels = levels;
        this.entries = entries;
    }

    public static HierarchicalIndex of(List<Level> levels, List<List<Object>> entries) {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("An index needs at least one level");
        }
        List<List<Object>> copied = new ArrayList<>(entries.size());
        for (List<Object> entry : entries) {
            if (entry.size() != levels.size()) {
                throw new IllegalArgumentException(
                        "Index entry " + entry + " does not match " + levels.size() + " levels");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(entry)));
        }
        return new HierarchicalIndex(List.copyOf(levels), Collections.unmodifiableList(copied));
    }

    public static HierarchicalIndex flat(Level level, List<?> values) {
        List<List<Object>> entries = new ArrayList<>(values.size());
        for (Object value : values) {
            entries.add(Collections.singletonList(value));
        }
        return of(List.of(level), entries);
    }

    /**
     * The default index: one unnamed level holding the positions {@code 0..size-1}.
     */
    public static HierarchicalIndex range(int size) {
        return flat(Level.unnamed(), IntStream.range(0, size).boxed().collect(Collectors.toList()));
    }

    public List<Level> levels() {
        return levels;
    }

    public Level level(int position) {
        return levels.get(position);
    }

    public int depth() {
        return levels.size();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isMultiLevel() {
        return levels.size() > 1;
    }

    /**
     * True when the index carries no dimension information at all (a single unnamed level).
     */
    public boolean isDefault() {
        return levels.size() == 1 && !levels.get(0).isNamed();
    }

    public List<List<Object>> entries() {
        return entries;
    }

    public List<Object> entry(int position) {
        return entries.get(position);
    }

    public int indexOf(String levelName) {
        for (int i = 0; i < levels.size(); i++) {
            if (levelName != null && levelName.equals(levels.get(i).name())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Distinct values of one level in order of first appearance.
     */
    public List<Object> levelValues(int level) {
        LinkedHashSet<Object> values = new LinkedHashSet<>();
        for (List<Object> entry : entries) {
            values.add(entry.get(level));
        }
        return new ArrayList<>(values);
    }

    public HierarchicalIndex mapLevel(int level, UnaryOperator<Object> mapper) {
        if (entries.isEmpty()) {
            return this;
        }
        List<List<Object>> mapped = new ArrayList<>(entries.size());
        for (List<Object> entry : entries) {
            List<Object> copy = new ArrayList<>(entry);
            copy.set(level, mapper.apply(entry.get(level)));
            mapped.add(copy);
        }
        return of(levels, mapped);
    }

    /**
     * Replaces null and NaN entry values.
     */
    public HierarchicalIndex fillMissing(Object replacement) {
        List<List<Object>> filled = new ArrayList<>(entries.size());
        for (List<Object> entry : entries) {
            List<Object> copy = new ArrayList<>(entry);
            copy.replaceAll(value -> ResultTable.isMissing(value) ? replacement : value);
            filled.add(copy);
        }
        return of(levels, filled);
    }

    public HierarchicalIndex withLevel(int position, Level level) {
        List<Level> renamed = new ArrayList<>(levels);
        renamed.set(position, level);
        return of(renamed, entries);
    }

    public HierarchicalIndex dropLevel(int position) {
        if (levels.size() == 1) {
            throw new IllegalArgumentException("Cannot drop the only level of an index");
        }
        List<Level> kept = new ArrayList<>(levels);
        kept.remove(position);
        List<List<Object>> trimmed = new ArrayList<>(entries.size());
        for (List<Object> entry : entries) {
            List<Object> copy = new ArrayList<>(entry);
            copy.remove(position);
            trimmed.add(copy);
        }
        return of(kept, trimmed);
    }

    public HierarchicalIndex select(List<Integer> positions) {
        List<List<Object>> selected = new ArrayList<>(positions.size());
        for (int position : positions) {
            selected.add(entries.get(position));
        }
        return of(levels, selected);
    }

    /**
     * Groups entries by the value of the outermost level, keeping first-appearance order.
     * For a multi-level index every group carries the remaining levels of its entries; for
     * a flat index each group is a leaf.
     */
    public List<Group> groupByOuterLevel() {
        Map<Object, List<Integer>> positionsByValue = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            positionsByValue.computeIfAbsent(entries.get(i).get(0), k -> new ArrayList<>()).add(i);
        }

        List<Group> groups = new ArrayList<>(positionsByValue.size());
        positionsByValue.forEach((value, positions) -> {
            HierarchicalIndex rest = isMultiLevel() ? select(positions).dropLevel(0) : null;
            groups.add(new Group(value, List.copyOf(positions), rest));
        });
        return groups;
    }

    public record Group(Object value, List<Integer> positions, HierarchicalIndex rest) {
        public boolean isLeaf() {
            return rest == null;
        }
    }

    @Override
    public String toString() {
        return "HierarchicalIndex{levels=" + levels + ", entries=" + entries + "}";
    }
}
