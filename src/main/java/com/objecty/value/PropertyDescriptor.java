package com.objecty.value;

/**
 * How one named slot can be read and written, as found at one level of an
 * aggregate's chain. Level 0 is the instance itself, level 1 its own
 * {@link Definition}, level 2 that definition's parent, and so on.
 */
public final class PropertyDescriptor {

    /** Reads an accessor slot. */
    public interface Getter {
        Value get(Aggregate self);
    }

    /** Writes an accessor slot. */
    public interface Setter {
        void set(Aggregate self, Value value);
    }

    public enum Kind { DATA, ACCESSOR }

    private final String name;
    private final Kind kind;
    private final boolean writable;
    private final Value shared;
    private final Getter getter;
    private final Setter setter;
    private final int level;

    private PropertyDescriptor(String name, Kind kind, boolean writable, Value shared,
                               Getter getter, Setter setter, int level) {
        this.name = name;
        this.kind = kind;
        this.writable = writable;
        this.shared = shared;
        this.getter = getter;
        this.setter = setter;
        this.level = level;
    }

    static PropertyDescriptor data(String name, Value shared, boolean writable, int level) {
        return new PropertyDescriptor(name, Kind.DATA, writable, shared, null, null, level);
    }

    /** Descriptor of a slot stored on the instance itself (level 0). */
    public static PropertyDescriptor instanceSlot(String name, boolean writable) {
        return new PropertyDescriptor(name, Kind.DATA, writable, null, null, null, 0);
    }

    static PropertyDescriptor accessor(String name, Getter getter, Setter setter, int level) {
        if (getter == null && setter == null) {
            throw new IllegalArgumentException("Accessor '" + name + "' needs a getter or a setter");
        }
        return new PropertyDescriptor(name, Kind.ACCESSOR, false, null, getter, setter, level);
    }

    /** Same descriptor, reported at a different chain level. */
    public PropertyDescriptor atLevel(int newLevel) {
        if (newLevel == level) return this;
        return new PropertyDescriptor(name, kind, writable, shared, getter, setter, newLevel);
    }

    public String name() { return name; }
    public Kind kind() { return kind; }
    public int level() { return level; }

    /** Directly writable data slot. Accessors are never directly writable. */
    public boolean isWritable() { return writable; }

    public boolean hasGetter() { return getter != null; }
    public boolean hasSetter() { return setter != null; }
    public boolean isAccessor() { return kind == Kind.ACCESSOR; }

    /** Assignment through this descriptor has an effect: writable data or a setter. */
    public boolean acceptsAssignment() { return writable || setter != null; }

    public Getter getter() { return getter; }
    public Setter setter() { return setter; }

    /** Value shared by every instance for definition-level data; null for instance slots and accessors. */
    public Value sharedValue() { return shared; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PropertyDescriptor{").append(name)
                .append(", ").append(kind)
                .append(", level=").append(level);
        if (kind == Kind.DATA) sb.append(", writable=").append(writable);
        else sb.append(", get=").append(getter != null).append(", set=").append(setter != null);
        return sb.append('}').toString();
    }
}
