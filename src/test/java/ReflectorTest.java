import com.objecty.reflect.Reflector;
import com.objecty.value.Aggregate;
import com.objecty.value.Definition;
import com.objecty.value.PropertyDescriptor;
import com.objecty.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ReflectorTest {

    @Test
    public void enumerate_withDataAndGetters_listsInstanceThenChain() {
        Aggregate sample = Shapes.sample();

        assertEquals(
                List.of("parentPrivate", "childPrivate", "selfPrivate", "childPublic", "version", "parentPublic"),
                Reflector.enumerate(sample, true, true));
    }

    @Test
    public void enumerate_withoutData_listsOnlyGetters() {
        Aggregate sample = Shapes.sample();
        assertEquals(List.of("childPublic", "parentPublic"), Reflector.enumerate(sample, false, true));
    }

    @Test
    public void enumerate_withoutGetters_listsOnlyData() {
        Aggregate sample = Shapes.sample();
        assertEquals(
                List.of("parentPrivate", "childPrivate", "selfPrivate", "version"),
                Reflector.enumerate(sample, true, false));
    }

    @Test
    public void enumerate_neverListsCallables() {
        Aggregate sample = Shapes.sample();
        sample.put("callback", Value.func((self, args) -> Value.nil()));

        List<String> props = Reflector.enumerate(sample);
        assertFalse(props.contains("describe"));
        assertFalse(props.contains("callback"));
    }

    @Test
    public void enumerate_bareAggregate_isItsKeys() {
        Aggregate a = Shapes.obj("{'a':1,'b':{'c':2}}");
        assertEquals(List.of("a", "b"), Reflector.enumerate(a));
        assertTrue(Reflector.enumerate(a, false, true).isEmpty());
        assertTrue(Reflector.enumerate(null, true, true).isEmpty());
    }

    @Test
    public void derivedOverride_masksBaseAccessor() {
        Definition base = new Definition("Base").getter("name", self -> Value.string("base"));
        Definition derived = new Definition("Derived", base).getter("name", self -> Value.string("derived"));
        Aggregate obj = new Aggregate(derived);

        assertEquals(List.of("name"), Reflector.enumerate(obj, false, true));
        assertEquals("derived", obj.get("name").asString());

        PropertyDescriptor desc = Reflector.findDescriptor(obj, "name");
        assertNotNull(desc);
        assertEquals(1, desc.level());
    }

    @Test
    public void derivedDataOverride_hidesBaseAccessorFromGetterOnlyListing() {
        Definition base = new Definition("Base").getter("name", self -> Value.string("base"));
        Definition derived = new Definition("Derived", base).field("name", Value.string("plain"), true);
        Aggregate obj = new Aggregate(derived);

        assertTrue(Reflector.enumerate(obj, false, true).isEmpty());
        assertEquals(List.of("name"), Reflector.enumerate(obj, true, true));
        assertEquals("plain", obj.get("name").asString());
    }

    @Test
    public void findDescriptor_reportsLevelAndKind() {
        Aggregate sample = Shapes.sample();

        PropertyDescriptor own = Reflector.findDescriptor(sample, "childPrivate");
        assertEquals(0, own.level());
        assertTrue(own.isWritable());

        PropertyDescriptor childGetter = Reflector.findDescriptor(sample, "childPublic");
        assertEquals(1, childGetter.level());
        assertTrue(childGetter.hasGetter());
        assertFalse(childGetter.hasSetter());
        assertFalse(childGetter.acceptsAssignment());

        PropertyDescriptor parentAccessor = Reflector.findDescriptor(sample, "parentPublic");
        assertEquals(2, parentAccessor.level());
        assertTrue(parentAccessor.hasSetter());
        assertTrue(parentAccessor.acceptsAssignment());

        assertNull(Reflector.findDescriptor(sample, "nope"));
        assertNull(Reflector.findDescriptor(new Aggregate(), "nope"));
    }

    @Test
    public void unwritableSet_collectsReadOnlyAndGetterOnlySlots() {
        Aggregate sample = Shapes.sample();
        sample.putReadOnly("id", Value.number(7));

        assertEquals(Set.of("id", "childPublic", "version"), Reflector.unwritableSet(sample));
        assertTrue(Reflector.unwritableSet(new Aggregate()).isEmpty());
    }

    @Test
    public void instanceSlot_masksChainMember() {
        Aggregate sample = Shapes.sample();
        // a writable instance slot shadows the getter-only member
        sample.put("childPublic", "shadow");

        assertFalse(Reflector.unwritableSet(sample).contains("childPublic"));
        assertEquals("shadow", sample.get("childPublic").asString());
        assertEquals(0, Reflector.findDescriptor(sample, "childPublic").level());
    }

    @Test
    public void set_followsFirstDescriptor() {
        Aggregate sample = Shapes.sample();

        assertTrue(sample.set("parentPublic", Value.string("via setter")));
        assertEquals("via setter", sample.get("_parentPublic").asString());
        assertEquals("via setter", sample.get("parentPublic").asString());
        assertFalse(sample.hasOwn("parentPublic"));

        assertFalse(sample.set("childPublic", Value.string("x")));
        assertEquals("childPublic", sample.get("childPublic").asString());

        assertFalse(sample.set("version", Value.number(3)));
        assertEquals(2.0, sample.get("version").asNumber());

        sample.putReadOnly("id", Value.number(1));
        assertFalse(sample.set("id", Value.number(2)));
        assertEquals(1.0, sample.get("id").asNumber());

        assertTrue(sample.set("fresh", Value.bool(true)));
        assertTrue(sample.hasOwn("fresh"));
    }

    @Test
    public void writableSharedField_isShadowedOnInstance() {
        Definition d = new Definition("Config").field("retries", Value.number(3), true);
        Aggregate a = new Aggregate(d);
        Aggregate b = new Aggregate(d);

        assertTrue(a.set("retries", Value.number(5)));
        assertEquals(5.0, a.get("retries").asNumber());
        assertEquals(3.0, b.get("retries").asNumber(), "shared value untouched");
    }
}
