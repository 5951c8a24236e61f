package com.objecty.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.objecty.reflect.Reflector;

/**
 * Keyed collection of named slots.
 *
 * Instance slots live in an ordered map. An aggregate may also point at a
 * {@link Definition}, whose chain contributes shared fields, methods and
 * accessors. Reads fall through from the instance to the chain; writes follow
 * the first descriptor found (see {@link #set(String, Value)}).
 *
 * Not thread-safe. Subclasses may implement {@link CustomClone} or
 * {@link CustomProjection}, and should override {@link #emptyCopy()} when they
 * carry state of their own.
 */
public class Aggregate {

    private final Definition definition;
    private final LinkedHashMap<String, Value> slots = new LinkedHashMap<>();
    private final Set<String> readOnly = new HashSet<>();

    public Aggregate() {
        this(null);
    }

    public Aggregate(Definition definition) {
        this.definition = definition;
    }

    /** Most-derived chain level, or null for a bare aggregate. */
    public Definition definition() {
        return definition;
    }

    /** Same-kind empty instance: same definition, no instance slots. */
    public Aggregate emptyCopy() {
        return new Aggregate(definition);
    }

    /** Definitions from most-derived to the last one before the terminal root. */
    public List<Definition> chain() {
        return definition == null ? Collections.<Definition>emptyList() : definition.lineage();
    }

    // -------------------------
    // Reads
    // -------------------------

    /**
     * Reads a slot: the instance value if present, otherwise the first chain level
     * declaring it (a getter is invoked, shared data returned as is).
     * Returns Java null when nothing declares the slot, or when the first
     * declaration is a setter-only accessor.
     */
    public Value get(String name) {
        Value own = slots.get(name);
        if (own != null) return own;

        for (Definition d : chain()) {
            PropertyDescriptor desc = d.member(name);
            if (desc == null) continue;
            if (desc.isAccessor()) {
                return desc.hasGetter() ? desc.getter().get(this) : null;
            }
            return desc.sharedValue();
        }
        return null;
    }

    /** Declared anywhere: instance slot or chain member. */
    public boolean has(String name) {
        if (slots.containsKey(name)) return true;
        for (Definition d : chain()) {
            if (d.member(name) != null) return true;
        }
        return false;
    }

    public boolean hasOwn(String name) {
        return slots.containsKey(name);
    }

    /** Natural enumeration: instance slot names in insertion order. */
    public List<String> keys() {
        return new ArrayList<>(slots.keySet());
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    /** Read-only view of the instance slots. */
    public Map<String, Value> slots() {
        return Collections.unmodifiableMap(slots);
    }

    public boolean isOwnReadOnly(String name) {
        return readOnly.contains(name);
    }

    // -------------------------
    // Writes
    // -------------------------

    /**
     * Assigns a slot. The first descriptor found along the chain decides:
     * a setter is invoked, writable data is stored on the instance, read-only data
     * and getter-only accessors are left untouched. An undeclared slot is created.
     *
     * @return false when the assignment had no effect
     */
    public boolean set(String name, Value value) {
        Value v = (value == null) ? Value.nil() : value;
        PropertyDescriptor desc = Reflector.findDescriptor(this, name);

        if (desc == null) {
            slots.put(name, v);
            return true;
        }
        if (desc.hasSetter()) {
            desc.setter().set(this, v);
            return true;
        }
        if (!desc.isWritable()) return false;

        slots.put(name, v);
        return true;
    }

    /** Stores an instance slot directly, bypassing setters and read-only flags. */
    public Aggregate put(String name, Value value) {
        slots.put(name, value == null ? Value.nil() : value);
        return this;
    }

    /** Declares an instance slot that plain assignment will not overwrite. */
    public Aggregate putReadOnly(String name, Value value) {
        put(name, value);
        readOnly.add(name);
        return this;
    }

    public Value remove(String name) {
        readOnly.remove(name);
        return slots.remove(name);
    }

    // Convenience for building trees in host code and tests.

    public Aggregate put(String name, double number) { return put(name, Value.number(number)); }
    public Aggregate put(String name, boolean flag) { return put(name, Value.bool(flag)); }
    public Aggregate put(String name, String text) { return put(name, Value.string(text)); }
    public Aggregate put(String name, Aggregate child) { return put(name, Value.object(child)); }

    /** Wraps this aggregate as an OBJECT value. */
    public Value toValue() {
        return Value.object(this);
    }

    @Override
    public String toString() {
        String body = slots.toString();
        return definition == null ? body : definition.name() + body;
    }
}
