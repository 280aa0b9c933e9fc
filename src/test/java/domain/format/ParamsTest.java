package domain.format;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParamsTest {

    @Test
    void should_return_fallback_when_no_params() {
        Params p = Params.none();
        assertTrue(p.isEmpty());
        assertEquals(":id", p.get("id", ":id"));
    }

    @Test
    void should_resolve_named_key() {
        Params p = new Params(Map.of("id", "42"), null, false);
        assertEquals("42", p.get("id", ":id"));
        assertEquals(":other", p.get("other", ":other"));
    }

    @Test
    void should_consume_list_in_order_for_empty_key() {
        Params p = new Params(null, Arrays.asList("a", "b"), false);
        assertEquals("a", p.get("", "?"));
        assertEquals("b", p.get(null, "?"));
        assertEquals("?", p.get("", "?"));
    }

    @Test
    void should_index_list_from_zero_or_one() {
        Params zero = new Params(null, Arrays.asList("x", "y"), false);
        Params one = new Params(null, Arrays.asList("x", "y"), true);

        assertEquals("y", zero.get("1", "?1"));
        assertEquals("x", one.get("1", "?1"));
        assertEquals("?0", one.get("0", "?0"));
        assertEquals("?9", zero.get("9", "?9"));
    }

    @Test
    void should_prefer_named_value_over_index() {
        Params p = new Params(Map.of("1", "named"), Collections.singletonList("listed"), false);
        assertEquals("named", p.get("1", "?1"));
    }
}
