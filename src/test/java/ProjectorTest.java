import com.objecty.util.Projector;
import com.objecty.value.Aggregate;
import com.objecty.value.CustomProjection;
import com.objecty.value.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectorTest {

    /** Money amount stored in cents, projected as a decimal number. */
    static final class Money extends Aggregate implements CustomProjection {
        Money(long cents) {
            put("cents", cents);
        }

        @Override
        public Value toPlain() {
            return Value.number(get("cents").asNumber() / 100.0);
        }
    }

    @Test
    public void project_instance_listsWritableChainProperties() {
        Aggregate sample = Shapes.sample();
        sample.set("parentPublic", Value.string("p"));

        Aggregate r = Projector.project(sample);

        assertNull(r.definition());
        assertEquals(List.of("parentPublic"), r.keys());
        assertEquals("p", r.get("parentPublic").asString());
    }

    @Test
    public void project_writableOnlyFalse_addsReadOnlyProperties() {
        Aggregate sample = Shapes.sample();
        sample.set("parentPublic", Value.string("p"));

        Aggregate r = Projector.project(sample, null, null, false);

        assertEquals(List.of("childPublic", "version", "parentPublic"), r.keys());
    }

    @Test
    public void project_includesComeFirst_excludesDrop() {
        Aggregate sample = Shapes.sample();
        sample.set("parentPublic", Value.string("p"));

        Aggregate r = Projector.project(sample, Set.of("parentPublic"), List.of("childPrivate", "missing"), true);

        assertEquals(List.of("childPrivate"), r.keys());
    }

    @Test
    public void project_skipsAbsentAccessorValues() {
        Aggregate sample = Shapes.sample();
        Aggregate r = Projector.project(sample);
        assertFalse(r.hasOwn("parentPublic"), "getter returned nothing");
    }

    @Test
    public void project_bareAggregate_usesItsOwnSlots() {
        Aggregate a = Shapes.obj("{'a':1,'nested':{'b':[1,2]}}");
        a.putReadOnly("id", Value.number(3));
        a.put("fn", Value.func((self, args) -> Value.nil()));

        Aggregate r = Projector.project(a);

        assertEquals(List.of("a", "nested"), r.keys());
        assertSame(a.get("nested").asObject(), r.get("nested").asObject(), "nested values are not re-filtered");
        assertEquals(List.of("a", "nested", "id"), Projector.project(a, null, null, false).keys());
    }

    @Test
    public void project_usesCustomProjectionOfTopLevelValues() {
        Aggregate a = new Aggregate().put("price", new Money(1250));
        Aggregate nested = new Aggregate().put("inner", new Money(5));
        a.put("nested", nested);

        Aggregate r = Projector.project(a);

        assertEquals(12.5, r.get("price").asNumber());
        assertTrue(r.get("nested").asObject().get("inner").asObject() instanceof Money);
    }

    @Test
    public void toJson_writesProjectedForm() {
        Aggregate sample = Shapes.sample();
        sample.set("parentPublic", Value.string("p"));

        assertEquals("{\"parentPublic\":\"p\"}", Projector.toJson(sample));
        assertEquals("{\"childPrivate\":\"childPrivate\",\"parentPublic\":\"p\"}",
                Projector.toJson(sample, null, List.of("childPrivate"), true));

        Aggregate bare = Shapes.obj("{'a':1,'b':[1.5,'x',true,null],'c':{'d':null}}");
        assertEquals("{\"a\":1,\"b\":[1.5,\"x\",true,null],\"c\":{\"d\":null}}", Projector.toJson(bare));
    }

    @Test
    public void project_null_isEmpty() {
        assertTrue(Projector.project(null).isEmpty());
    }
}
