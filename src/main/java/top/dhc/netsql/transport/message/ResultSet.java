package top.dhc.netsql.transport.message;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;

/**
 * 结果集（ResultSet）
 *
 * 查询执行后返回的原始行数据。每一行是按列顺序拼接的单元格字节，
 * 每个单元格占用其列类型的固定长度，因此行长度等于所有列长度之和。
 * 客户端收到后交给 ResultSetProcessor 转换为 DataSet。
 */
public final class ResultSet implements Payload {
    private final List<Column> columns;
    private final List<byte[]> rows;
    private final int rowSize;

    /**
     * @throws IllegalArgumentException 如果某一行的长度与列定义不符
     */
    public ResultSet(List<Column> columns, List<byte[]> rows) {
        this.columns = ImmutableList.copyOf(columns);
        int size = 0;
        for(Column c : this.columns) {
            size += c.getType().getSize();
        }
        this.rowSize = size;
        ImmutableList.Builder<byte[]> builder = ImmutableList.builder();
        for(byte[] row : rows) {
            Preconditions.checkArgument(row.length == rowSize,
                "row length %s does not match column layout of %s bytes", row.length, rowSize);
            builder.add(row.clone());
        }
        this.rows = builder.build();
    }

    public List<Column> getColumns() {
        return columns;
    }

    /**
     * 返回原始行，调用方不应修改返回的数组
     */
    public List<byte[]> getRows() {
        return rows;
    }

    public int getRowSize() {
        return rowSize;
    }

    public int rowCount() {
        return rows.size();
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.RESULT_SET;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof ResultSet)) {
            return false;
        }
        ResultSet other = (ResultSet) o;
        if(!columns.equals(other.columns) || rows.size() != other.rows.size()) {
            return false;
        }
        for(int i = 0; i < rows.size(); i++) {
            if(!Arrays.equals(rows.get(i), other.rows.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = columns.hashCode();
        for(byte[] row : rows) {
            h = 31 * h + Arrays.hashCode(row);
        }
        return h;
    }

    @Override
    public String toString() {
        return "ResultSet{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 按列类型把 Java 值编码成行字节，供查询执行方构造结果集
     */
    public static final class Builder {
        private final List<Column> columns = new ArrayList<>();
        private final List<byte[]> rows = new ArrayList<>();

        public Builder column(String name, SqlType type) {
            Preconditions.checkState(rows.isEmpty(), "columns must be declared before rows");
            columns.add(new Column(name, type));
            return this;
        }

        /**
         * 追加一行，值的个数和类型必须与列定义一致：
         * INT 对应 Integer，BOOL 对应 Boolean，CHAR 对应 String
         */
        public Builder row(Object... values) {
            Preconditions.checkArgument(values.length == columns.size(),
                "expected %s values but got %s", columns.size(), values.length);
            byte[][] cells = new byte[values.length][];
            for(int i = 0; i < values.length; i++) {
                cells[i] = encodeCell(columns.get(i), values[i]);
            }
            rows.add(Bytes.concat(cells));
            return this;
        }

        public ResultSet build() {
            return new ResultSet(columns, rows);
        }

        private static byte[] encodeCell(Column column, Object value) {
            SqlType type = column.getType();
            switch(type.getKind()) {
                case INT:
                    Preconditions.checkArgument(value instanceof Integer, "column %s expects an integer", column.getName());
                    return Ints.toByteArray((Integer) value);
                case BOOL:
                    Preconditions.checkArgument(value instanceof Boolean, "column %s expects a boolean", column.getName());
                    return new byte[]{(byte) ((Boolean) value ? 1 : 0)};
                case CHAR:
                    Preconditions.checkArgument(value instanceof String, "column %s expects a string", column.getName());
                    byte[] raw = ((String) value).getBytes(StandardCharsets.UTF_8);
                    Preconditions.checkArgument(raw.length <= type.getSize(),
                        "value of %s bytes does not fit %s", raw.length, type);
                    return Arrays.copyOf(raw, type.getSize());
                default:
                    throw new IllegalArgumentException("Unsupported type: " + type);
            }
        }
    }
}
