package top.dhc.netsql.client;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import top.dhc.netsql.transport.message.Column;

/**
 * 数据集（DataSet）
 *
 * 客户端对 ResultSet 处理后的结果：按行、按列保存已经解码的值，
 * INT 列为 Integer，BOOL 列为 Boolean，CHAR 列为 String。
 */
public final class DataSet {
    private final List<Column> columns;
    private final List<List<Object>> rows;

    public DataSet(List<Column> columns, List<List<Object>> rows) {
        this.columns = ImmutableList.copyOf(columns);
        ImmutableList.Builder<List<Object>> builder = ImmutableList.builder();
        for(List<Object> row : rows) {
            Preconditions.checkArgument(row.size() == this.columns.size(),
                "row has %s values but there are %s columns", row.size(), this.columns.size());
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<Object> getRow(int row) {
        return rows.get(row);
    }

    public Object get(int row, int column) {
        return rows.get(row).get(column);
    }

    public Object get(int row, String column) {
        return get(row, columnIndex(column));
    }

    /**
     * @return 列的位置
     * @throws IllegalArgumentException 如果没有这一列
     */
    public int columnIndex(String name) {
        for(int i = 0; i < columns.size(); i++) {
            if(columns.get(i).getName().equals(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("No such column: " + name);
    }

    /**
     * 格式化成文本表格，用于命令行显示
     */
    public String format() {
        int[] widths = new int[columns.size()];
        for(int i = 0; i < columns.size(); i++) {
            widths[i] = columns.get(i).getName().length();
            for(List<Object> row : rows) {
                widths[i] = Math.max(widths[i], String.valueOf(row.get(i)).length());
            }
        }
        StringBuilder sb = new StringBuilder();
        for(int i = 0; i < columns.size(); i++) {
            sb.append(i == 0 ? "" : " | ").append(Strings.padEnd(columns.get(i).getName(), widths[i], ' '));
        }
        sb.append('\n');
        for(int i = 0; i < columns.size(); i++) {
            sb.append(i == 0 ? "" : "-+-").append(Strings.repeat("-", widths[i]));
        }
        for(List<Object> row : rows) {
            sb.append('\n');
            for(int i = 0; i < columns.size(); i++) {
                sb.append(i == 0 ? "" : " | ").append(Strings.padEnd(String.valueOf(row.get(i)), widths[i], ' '));
            }
        }
        sb.append('\n').append('(').append(rows.size()).append(rows.size() == 1 ? " row)" : " rows)");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "DataSet{columns=" + columns + ", rows=" + rows + "}";
    }
}
