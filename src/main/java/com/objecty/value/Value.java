package com.objecty.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged value carried by every slot of an {@link Aggregate}.
 *
 * NULL, NUMBER, BOOL, STRING and FUNC are scalars, ARRAY is an ordered sequence
 * and OBJECT is a keyed aggregate. The tag is fixed when the value is built.
 *
 * A slot that does not exist at all reads as Java {@code null}; an explicit null
 * is {@link #nil()}. The algorithms keep that distinction.
 */
public final class Value {
    public enum Type { NULL, NUMBER, BOOL, STRING, FUNC, ARRAY, OBJECT }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) {
        if (s == null) return NIL;
        return new Value(Type.STRING, s);
    }
    public static Value func(Invocable fn) {
        if (fn == null) return NIL;
        return new Value(Type.FUNC, fn);
    }
    public static Value array(List<Value> a) {
        if (a == null) return NIL;
        return new Value(Type.ARRAY, a);
    }
    public static Value array() { return new Value(Type.ARRAY, new ArrayList<Value>()); }
    public static Value object(Aggregate o) {
        if (o == null) return NIL;
        return new Value(Type.OBJECT, o);
    }
    public static Value object() { return new Value(Type.OBJECT, new Aggregate()); }

    /** Array value over the given elements, in a fresh mutable list. */
    public static Value arrayOf(Value... elements) {
        List<Value> out = new ArrayList<>(elements.length);
        for (Value e : elements) out.add(e == null ? NIL : e);
        return new Value(Type.ARRAY, out);
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }
    public boolean isArray() { return type == Type.ARRAY; }
    public boolean isObject() { return type == Type.OBJECT; }

    /** ARRAY or OBJECT: anything the recursive algorithms descend into. */
    public boolean isContainer() { return type == Type.ARRAY || type == Type.OBJECT; }

    public boolean isScalar() { return !isContainer(); }

    public double asNumber() {
        if (type != Type.NUMBER) throw new RuntimeException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new RuntimeException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new RuntimeException("Expected string, got " + type);
        return (String) value;
    }

    public Invocable asFunc() {
        if (type != Type.FUNC) throw new RuntimeException("Expected function, got " + type);
        return (Invocable) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new RuntimeException("Expected array, got " + type);
        return (List<Value>) value;
    }

    public Aggregate asObject() {
        if (type != Type.OBJECT) throw new RuntimeException("Expected object, got " + type);
        return (Aggregate) value;
    }

    /** Absent, null, false, 0, NaN and the empty string. */
    public static boolean isFalsy(Value v) {
        if (v == null) return true;
        switch (v.type) {
            case NULL:
                return true;
            case BOOL:
                return !v.asBool();
            case NUMBER: {
                double d = v.asNumber();
                return d == 0.0 || Double.isNaN(d);
            }
            case STRING:
                return v.asString().isEmpty();
            default:
                return false;
        }
    }

    /**
     * Identity/value equality used by merge, mergeArrays and changes.
     * Scalars compare by value (NaN matches NaN, 0 matches -0), functions and
     * containers by identity of the underlying object. Two absent values match.
     */
    public static boolean same(Value a, Value b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a.type != b.type) return false;

        switch (a.type) {
            case NULL:
                return true;
            case NUMBER: {
                double x = a.asNumber();
                double y = b.asNumber();
                return x == y || (Double.isNaN(x) && Double.isNaN(y));
            }
            case BOOL:
            case STRING:
                return a.value.equals(b.value);
            default:
                return a.value == b.value;
        }
    }

    /**
     * Structural equality: arrays element-wise, objects over their instance slots.
     * Definitions are not compared. Not safe for cyclic graphs.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;

        switch (type) {
            case NULL:
                return true;
            case NUMBER:
                return same(this, other);
            case ARRAY:
                return asArray().equals(other.asArray());
            case OBJECT:
                return asObject().slots().equals(other.asObject().slots());
            default:
                return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NULL:
                return 0;
            case ARRAY:
                return asArray().hashCode();
            case OBJECT:
                return asObject().slots().hashCode();
            case NUMBER: {
                double d = asNumber();
                return d == 0.0 ? 0 : Double.hashCode(d);
            }
            default:
                return Objects.hash(type, value);
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER: {
                double d = asNumber();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                    return Long.toString((long) d);
                }
                return Double.toString(d);
            }
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case FUNC:
                return "function";
            case ARRAY:
                return asArray().toString();
            case OBJECT: {
                Map<String, Value> m = asObject().slots();
                return m.toString();
            }
            default:
                return "null";
        }
    }
}
