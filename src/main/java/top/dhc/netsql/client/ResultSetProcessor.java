package top.dhc.netsql.client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.primitives.Ints;

import top.dhc.netsql.transport.message.Column;
import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

/**
 * 结果集处理器
 *
 * 把服务器返回的原始行切分成单元格，并按列类型解码：
 * INT 读 4 字节大端整数，BOOL 非 0 即 true，CHAR 去掉末尾的 0 填充后按 UTF-8 解码。
 */
public class ResultSetProcessor {

    public DataSet process(ResultSet rs) {
        List<List<Object>> rows = new ArrayList<>(rs.rowCount());
        for(byte[] raw : rs.getRows()) {
            List<Object> row = new ArrayList<>(rs.getColumns().size());
            int offset = 0;
            for(Column column : rs.getColumns()) {
                int size = column.getType().getSize();
                row.add(decodeCell(column.getType(), Arrays.copyOfRange(raw, offset, offset + size)));
                offset += size;
            }
            rows.add(row);
        }
        return new DataSet(rs.getColumns(), rows);
    }

    protected Object decodeCell(SqlType type, byte[] cell) {
        switch(type.getKind()) {
            case INT:
                return Ints.fromByteArray(cell);
            case BOOL:
                return cell[0] != 0;
            case CHAR:
                int end = cell.length;
                while(end > 0 && cell[end - 1] == 0) {
                    end--;
                }
                return new String(cell, 0, end, StandardCharsets.UTF_8);
            default:
                throw new IllegalArgumentException("Unsupported type: " + type);
        }
    }
}
