import com.fasterxml.jackson.databind.JsonNode;
import com.objecty.util.ValueCodec;
import com.objecty.value.Aggregate;
import com.objecty.value.Value;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueCodecTest {

    @Test
    public void parse_buildsTaggedValues() {
        Value v = ValueCodec.parse("{\"n\":1,\"s\":\"x\",\"b\":true,\"z\":null,\"l\":[1,[2]],\"o\":{\"k\":2.5}}");

        Aggregate o = v.asObject();
        assertEquals(List.of("n", "s", "b", "z", "l", "o"), o.keys());
        assertEquals(1.0, o.get("n").asNumber());
        assertEquals("x", o.get("s").asString());
        assertTrue(o.get("b").asBool());
        assertTrue(o.get("z").isNull());
        assertEquals(Value.Type.ARRAY, o.get("l").asArray().get(1).getType());
        assertEquals(2.5, o.get("o").asObject().get("k").asNumber());
    }

    @Test
    public void stringify_dropsFunctionsFromObjects_nullsThemInArrays() {
        Aggregate a = new Aggregate().put("keep", 1);
        a.put("fn", Value.func((self, args) -> Value.nil()));
        a.put("list", Value.arrayOf(Value.func((self, args) -> Value.nil()), Value.number(2)));

        assertEquals("{\"keep\":1,\"list\":[null,2]}", ValueCodec.stringify(a.toValue()));
    }

    @Test
    public void parse_invalidJson_throwsIllegalArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ValueCodec.parse("{nope"));
        assertNotNull(e.getCause());
        assertThrows(IllegalArgumentException.class, () -> ValueCodec.parseObject("[1,2]"));
    }

    @Test
    public void plainJava_roundTripKeepsShape() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("k", 3);
        Map<String, Object> src = new LinkedHashMap<>();
        src.put("a", "x");
        src.put("b", Arrays.asList(1, null, true));
        src.put("c", inner);

        Value v = ValueCodec.fromPlainJava(src);
        Object back = ValueCodec.toPlainJava(v);

        Map<String, Object> expectedInner = new LinkedHashMap<>();
        expectedInner.put("k", 3.0);
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("a", "x");
        expected.put("b", Arrays.asList(1.0, null, true));
        expected.put("c", expectedInner);
        assertEquals(expected, back);
    }

    @Test
    public void fromPlainJava_rejectsNonStringKeysAndUnknownTypes() {
        Map<Object, Object> bad = new HashMap<>();
        bad.put(1, "x");
        assertThrows(IllegalArgumentException.class, () -> ValueCodec.fromPlainJava(bad));
        assertThrows(IllegalArgumentException.class, () -> ValueCodec.fromPlainJava(new Object()));
    }

    @Test
    public void toJsonNode_writesIntegralNumbersAsIntegers() {
        JsonNode n = ValueCodec.toJsonNode(Shapes.json("{'i':3,'d':0.25}"));
        assertTrue(n.get("i").isIntegralNumber());
        assertEquals(3, n.get("i").asInt());
        assertTrue(n.get("d").isDouble());
    }

    @Test
    public void stringify_cyclicGraph_failsWithRecursionLimit() {
        Aggregate a = new Aggregate();
        a.put("self", a);
        assertThrows(com.objecty.util.RecursionLimitException.class, () -> ValueCodec.stringify(a.toValue()));
    }
}
