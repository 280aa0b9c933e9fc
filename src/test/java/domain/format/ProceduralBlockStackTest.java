package domain.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProceduralBlockStackTest {

    @Test
    void should_pop_innermost_opener() {
        ProceduralBlockStack stack = new ProceduralBlockStack();
        stack.push("BEGIN");
        stack.push("IF");

        assertEquals(2, stack.size());
        assertEquals("IF", stack.pop());
        assertEquals("BEGIN", stack.pop());
        assertTrue(stack.isEmpty());
    }

    @Test
    void should_return_empty_string_when_nothing_open() {
        assertEquals("", new ProceduralBlockStack().pop());
    }

    @Test
    void should_classify_openers() {
        assertTrue(ProceduralBlockStack.isProceduralOpener("CASE"));
        assertFalse(ProceduralBlockStack.isStatementOpener("CASE"));
        assertTrue(ProceduralBlockStack.isStatementOpener("LOOP"));
        assertFalse(ProceduralBlockStack.isProceduralOpener("END"));
    }
}
