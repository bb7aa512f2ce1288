package top.dhc.netsql.backend.server;

import org.junit.jupiter.api.Test;

import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

import static org.junit.jupiter.api.Assertions.*;

final class LiteralSelectExecutorTest {

    private final LiteralSelectExecutor executor = new LiteralSelectExecutor();

    private String failure(String query) {
        return assertThrows(QueryException.class, () -> executor.execute(query)).getMessage();
    }

    @Test
    void selectSingleInteger() throws Exception {
        ResultSet expected = ResultSet.builder().column("1", SqlType.INT).row(1).build();

        assertEquals(expected, executor.execute("SELECT 1"));
        assertEquals(expected, executor.execute("select 1;"));
    }

    @Test
    void selectMixedLiteralsWithAliases() throws Exception {
        ResultSet expected = ResultSet.builder()
            .column("-5", SqlType.INT)
            .column("name", SqlType.charOf(3))
            .column("TRUE", SqlType.BOOL)
            .column("'x'", SqlType.charOf(1))
            .row(-5, "abc", true, "x")
            .build();

        assertEquals(expected, executor.execute("SELECT - 5, 'abc' AS name, TRUE, 'x'"));
    }

    @Test
    void emptyStringBecomesSingleCharColumn() throws Exception {
        ResultSet rs = executor.execute("SELECT '' AS e");

        assertEquals(SqlType.charOf(1), rs.getColumns().get(0).getType());
        assertArrayEquals(new byte[]{0}, rs.getRows().get(0));
    }

    @Test
    void rejectsEverythingElse() {
        assertEquals("empty query", failure(""));
        assertEquals("empty query", failure("   "));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("BAD SQL"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT 1 2"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT 1 AS"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT name"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT 1,"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT 'open"));
        assertEquals(LiteralSelectExecutor.SYNTAX_ERROR, failure("SELECT 1 # comment"));
    }

    @Test
    void knownStatementsAreUnsupported() {
        assertEquals("unsupported statement: INSERT", failure("insert into t values (1)"));
        assertEquals("unsupported statement: CREATE", failure("CREATE TABLE t id int32"));
    }

    @Test
    void integerOverflowIsReported() {
        assertEquals("integer out of range: 99999999999", failure("SELECT 99999999999"));
    }
}
