package top.dhc.netsql.client;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;

import top.dhc.netsql.transport.message.Column;
import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

import static org.junit.jupiter.api.Assertions.*;

final class ResultSetProcessorTest {

    private final ResultSetProcessor processor = new ResultSetProcessor();

    @Test
    void decodesEveryColumnType() {
        ResultSet rs = ResultSet.builder()
            .column("id", SqlType.INT)
            .column("name", SqlType.charOf(12))
            .column("admin", SqlType.BOOL)
            .row(Integer.MIN_VALUE, "数据库", true)
            .row(42, "bob", false)
            .build();

        DataSet ds = processor.process(rs);

        assertEquals(2, ds.rowCount());
        assertEquals(Arrays.asList(Integer.MIN_VALUE, "数据库", true), ds.getRow(0));
        assertEquals(42, ds.get(1, "id"));
        assertEquals("bob", ds.get(1, "name"));
        assertEquals(false, ds.get(1, "admin"));
        assertEquals(2, ds.columnIndex("admin"));
        assertThrows(IllegalArgumentException.class, () -> ds.get(0, "missing"));
    }

    @Test
    void anyNonZeroByteIsTrue() {
        ResultSet rs = new ResultSet(
            Collections.singletonList(new Column("flag", SqlType.BOOL)),
            Collections.singletonList(new byte[]{7}));

        assertEquals(true, processor.process(rs).get(0, 0));
    }

    @Test
    void onlyTrailingPaddingIsStripped() {
        byte[] raw = Bytes.concat(Ints.toByteArray(5), new byte[]{'a', 0, 'b', 0, 0});
        ResultSet rs = new ResultSet(
            Arrays.asList(new Column("n", SqlType.INT), new Column("s", SqlType.charOf(5))),
            Collections.singletonList(raw));

        assertEquals("a\0b", processor.process(rs).get(0, "s"));
    }

    @Test
    void emptyResultFormatsHeaderOnly() {
        ResultSet rs = new ResultSet(
            Collections.singletonList(new Column("x", SqlType.INT)),
            Collections.emptyList());

        DataSet ds = processor.process(rs);

        assertEquals(0, ds.rowCount());
        assertEquals("x\n-\n(0 rows)", ds.format());
    }

    @Test
    void formatAlignsColumns() {
        DataSet ds = processor.process(ResultSet.builder()
            .column("id", SqlType.INT)
            .column("name", SqlType.charOf(8))
            .row(1, "alice")
            .row(1000, "bo")
            .build());

        String expected = "id   | name \n"
            + "-----+------\n"
            + "1    | alice\n"
            + "1000 | bo   \n"
            + "(2 rows)";
        assertEquals(expected, ds.format());
    }

    @Test
    void stringCellsUseUtf8() {
        ResultSet rs = new ResultSet(
            Collections.singletonList(new Column("s", SqlType.charOf(3))),
            Collections.singletonList("é\0".getBytes(StandardCharsets.UTF_8)));

        assertEquals("é", processor.process(rs).get(0, 0));
    }
}
