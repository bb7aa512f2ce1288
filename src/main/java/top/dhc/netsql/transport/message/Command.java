package top.dhc.netsql.transport.message;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * 命令（Command）
 *
 * 每个 COMMAND 标记后面跟一个命令，命令只有三种：
 * - Ping：探测连接，服务器回复 OK
 * - Quit：结束会话，服务器回复 OK 后关闭连接
 * - Query(text)：执行一条查询语句，服务器回复 RESPONSE 或 ERROR
 */
public final class Command implements Payload {

    public enum Type {
        PING(0),
        QUIT(1),
        QUERY(2);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        public static Type fromCode(int code) {
            for(Type t : values()) {
                if(t.code == code) {
                    return t;
                }
            }
            return null;
        }
    }

    public static final Command PING = new Command(Type.PING, null);
    public static final Command QUIT = new Command(Type.QUIT, null);

    private final Type type;
    private final String query;

    private Command(Type type, String query) {
        this.type = type;
        this.query = query;
    }

    public static Command query(String text) {
        return new Command(Type.QUERY, Preconditions.checkNotNull(text, "query"));
    }

    public Type getType() {
        return type;
    }

    /**
     * @return 查询语句，只有 QUERY 命令才有
     * @throws IllegalStateException 如果不是 QUERY 命令
     */
    public String getQuery() {
        Preconditions.checkState(type == Type.QUERY, "%s carries no query", type);
        return query;
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.COMMAND;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Command)) {
            return false;
        }
        Command other = (Command) o;
        return type == other.type && Objects.equals(query, other.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, query);
    }

    @Override
    public String toString() {
        return type == Type.QUERY ? "Query(" + query + ")" : type.toString();
    }
}
