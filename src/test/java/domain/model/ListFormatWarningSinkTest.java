package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListFormatWarningSinkTest {

    @Test
    void should_drop_duplicate_warnings() {
        List<FormatWarning> out = new ArrayList<>();
        FormatWarningSink sink = new ListFormatWarningSink(out);

        sink.warn(FormatWarning.of(WarningCode.SQL_TEXT_EMPTY, "q1", "empty"));
        sink.warn(FormatWarning.of(WarningCode.SQL_TEXT_EMPTY, "q1", "empty"));
        sink.warn(FormatWarning.of(WarningCode.SQL_TEXT_EMPTY, "q2", "empty"));
        sink.warn(new FormatWarning(WarningCode.SQL_TEXT_EMPTY, "q1", "empty", "row 3"));
        sink.warn(null);

        assertEquals(3, out.size());
        assertEquals("q2", out.get(1).getSqlId());
        assertEquals("row 3", out.get(2).getDetail());
    }

    @Test
    void should_default_missing_fields() {
        FormatWarning w = new FormatWarning(null, null, null, null);

        assertEquals(WarningCode.FORMAT_ERROR, w.getCode());
        assertEquals("", w.getSqlId());
        assertEquals("", w.getDetail());
    }

    @Test
    void should_ignore_everything_in_null_sink() {
        assertDoesNotThrow(() -> FormatWarningSink.none().warn(FormatWarning.of(WarningCode.SLOW_SQL, "q", "slow")));
    }
}
