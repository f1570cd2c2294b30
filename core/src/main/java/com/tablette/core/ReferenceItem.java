package com.tablette.core;

/**
 * A metric as it appears under a reference: its own key and label, the base metric's
 * formatting. A null reference yields the metric itself.
 */
public record ReferenceItem(String key, String label, String prefix, String suffix, Integer precision) implements Item {

    public static ReferenceItem of(Item item, Reference reference) {
        if (reference == null) {
            return new ReferenceItem(item.key(), item.label(), item.prefix(), item.suffix(), item.precision());
        }
        return new ReferenceItem(reference.keyFor(item), reference.labelFor(item),
                item.prefix(), item.suffix(), item.precision());
    }
}
