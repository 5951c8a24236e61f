package com.objecty.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.objecty.Objecty;
import com.objecty.value.Aggregate;
import com.objecty.value.Value;

/**
 * Conversions between {@link Value} graphs and the outside world: plain Java
 * (Map/List/String/Number/Boolean/null) and Jackson trees or JSON text.
 *
 * Functions have no plain form: they are dropped from objects and become null
 * inside arrays. Only instance slots of an aggregate are written.
 */
public final class ValueCodec {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;
    private static final DepthGuard defaultGuard = new DepthGuard("ValueCodec", Objecty.DEFAULT_MAX_DEPTH);

    private ValueCodec() {}

    // ---------------- plain Java ----------------

    public static Object toPlainJava(Value v) {
        return toPlainJava(v, 1, defaultGuard);
    }

    private static Object toPlainJava(Value v, int depth, DepthGuard guard) {
        if (v == null) return null;

        switch (v.getType()) {
            case NUMBER: return v.asNumber();
            case BOOL:   return v.asBool();
            case STRING: return v.asString();

            case ARRAY: {
                guard.check(depth);
                List<Value> src = v.asArray();
                List<Object> out = new ArrayList<>(src.size());
                for (Value item : src) {
                    out.add(item != null && item.getType() == Value.Type.FUNC ? null : toPlainJava(item, depth + 1, guard));
                }
                return out;
            }

            case OBJECT: {
                guard.check(depth);
                LinkedHashMap<String, Object> out = new LinkedHashMap<>();
                for (Map.Entry<String, Value> e : v.asObject().slots().entrySet()) {
                    if (e.getValue().getType() == Value.Type.FUNC) continue;
                    out.put(e.getKey(), toPlainJava(e.getValue(), depth + 1, guard));
                }
                return out;
            }

            default:
                // NULL, FUNC
                return null;
        }
    }

    public static Value fromPlainJava(Object o) {
        return fromPlainJava(o, 1, defaultGuard);
    }

    private static Value fromPlainJava(Object o, int depth, DepthGuard guard) {
        if (o == null) return Value.nil();
        if (o instanceof Value) return (Value) o;
        if (o instanceof Aggregate) return Value.object((Aggregate) o);
        if (o instanceof String) return Value.string((String) o);
        if (o instanceof Boolean) return Value.bool((Boolean) o);
        if (o instanceof Number) return Value.number(((Number) o).doubleValue());

        if (o instanceof List<?>) {
            guard.check(depth);
            List<?> src = (List<?>) o;
            List<Value> out = new ArrayList<>(src.size());
            for (Object e : src) out.add(fromPlainJava(e, depth + 1, guard));
            return Value.array(out);
        }

        if (o instanceof Map<?, ?>) {
            guard.check(depth);
            Aggregate out = new Aggregate();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) o).entrySet()) {
                Object k = e.getKey();
                if (!(k instanceof String)) {
                    throw new IllegalArgumentException(
                            "ValueCodec: map key must be String, got: " +
                                    (k == null ? "null" : k.getClass().getName())
                    );
                }
                out.put((String) k, fromPlainJava(e.getValue(), depth + 1, guard));
            }
            return Value.object(out);
        }

        throw new IllegalArgumentException("ValueCodec: unsupported type " + o.getClass().getName());
    }

    // ---------------- Jackson ----------------

    public static JsonNode toJsonNode(Value v) {
        return toJsonNode(v, 1, defaultGuard);
    }

    /** Same as {@link #toJsonNode(Value)} with a caller-chosen nesting limit. */
    public static JsonNode toJsonNode(Value v, int maxDepth) {
        return toJsonNode(v, 1, new DepthGuard("ValueCodec", maxDepth));
    }

    private static JsonNode toJsonNode(Value v, int depth, DepthGuard guard) {
        if (v == null) return nodes.nullNode();

        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                if (d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15) {
                    return nodes.numberNode((long) d);
                }
                return nodes.numberNode(d);
            }
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case STRING:
                return nodes.textNode(v.asString());

            case ARRAY: {
                guard.check(depth);
                ArrayNode out = nodes.arrayNode();
                for (Value item : v.asArray()) {
                    if (item == null || item.getType() == Value.Type.FUNC) out.addNull();
                    else out.add(toJsonNode(item, depth + 1, guard));
                }
                return out;
            }

            case OBJECT: {
                guard.check(depth);
                ObjectNode out = nodes.objectNode();
                for (Map.Entry<String, Value> e : v.asObject().slots().entrySet()) {
                    if (e.getValue().getType() == Value.Type.FUNC) continue;
                    out.set(e.getKey(), toJsonNode(e.getValue(), depth + 1, guard));
                }
                return out;
            }

            default:
                return nodes.nullNode();
        }
    }

    public static Value fromJsonNode(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.nil();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isNumber()) return Value.number(n.doubleValue());
        if (n.isTextual()) return Value.string(n.textValue());

        if (n.isArray()) {
            List<Value> out = new ArrayList<>(n.size());
            for (JsonNode item : n) out.add(fromJsonNode(item));
            return Value.array(out);
        }

        if (n.isObject()) {
            Aggregate out = new Aggregate();
            Iterator<Map.Entry<String, JsonNode>> it = n.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.put(e.getKey(), fromJsonNode(e.getValue()));
            }
            return Value.object(out);
        }

        throw new IllegalArgumentException("ValueCodec: unsupported JSON node " + n.getNodeType());
    }

    // ---------------- text ----------------

    public static String stringify(Value v) {
        return write(toJsonNode(v));
    }

    public static String stringify(Value v, int maxDepth) {
        return write(toJsonNode(v, maxDepth));
    }

    private static String write(JsonNode node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    public static Value parse(String json) {
        if (json == null) throw new IllegalArgumentException("ValueCodec: json is null");
        try {
            return fromJsonNode(om.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("ValueCodec: invalid JSON", e);
        }
    }

    /** Parses a JSON object into an aggregate. */
    public static Aggregate parseObject(String json) {
        Value v = parse(json);
        if (!v.isObject()) throw new IllegalArgumentException("ValueCodec: expected a JSON object, got " + v.getType());
        return v.asObject();
    }
}
