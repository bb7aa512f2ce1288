package top.dhc.netsql.transport.message;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * 列类型（SqlType）
 *
 * 每种类型在行数据中占用固定字节数：
 * - INT：4 字节，有符号大端
 * - BOOL：1 字节，0 为 false，其余为 true
 * - CHAR(n)：n 字节 UTF-8，不足部分用 0 填充
 */
public final class SqlType {

    public enum Kind {
        INT(0),
        BOOL(1),
        CHAR(2);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        public static Kind fromCode(int code) {
            for(Kind k : values()) {
                if(k.code == code) {
                    return k;
                }
            }
            return null;
        }
    }

    public static final SqlType INT = new SqlType(Kind.INT, 4);
    public static final SqlType BOOL = new SqlType(Kind.BOOL, 1);

    public static final int MAX_CHAR_LENGTH = 0xFF;

    private final Kind kind;
    private final int size;

    private SqlType(Kind kind, int size) {
        this.kind = kind;
        this.size = size;
    }

    public static SqlType charOf(int length) {
        Preconditions.checkArgument(length >= 1 && length <= MAX_CHAR_LENGTH,
            "char length must be within [1, %s]: %s", MAX_CHAR_LENGTH, length);
        return new SqlType(Kind.CHAR, length);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 该类型的一个值在行中占用的字节数
     */
    public int getSize() {
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof SqlType)) {
            return false;
        }
        SqlType other = (SqlType) o;
        return kind == other.kind && size == other.size;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, size);
    }

    @Override
    public String toString() {
        return kind == Kind.CHAR ? "CHAR(" + size + ")" : kind.toString();
    }
}
