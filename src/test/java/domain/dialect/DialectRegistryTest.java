package domain.dialect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialectRegistryTest {

    @Test
    void should_register_every_language() {
        List<Dialect> all = DialectRegistry.all();
        assertEquals(Language.values().length, all.size());
        for (Language l : Language.values()) {
            assertEquals(l, DialectRegistry.get(l).getLanguage());
        }
    }

    @Test
    void should_fall_back_to_standard_sql_for_null() {
        assertEquals(Language.STANDARD_SQL, DialectRegistry.get(null).getLanguage());
    }

    @Test
    void should_resolve_tags_strictly() {
        assertEquals(Language.PL_SQL, Language.fromTag("PL/SQL"));
        assertEquals(Language.POSTGRESQL, Language.fromTag(" postgresql "));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Language.fromTag("oracle"));
        assertTrue(e.getMessage().contains("n1ql"));
    }
}
