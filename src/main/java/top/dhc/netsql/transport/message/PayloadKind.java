package top.dhc.netsql.transport.message;

import top.dhc.netsql.transport.SizeLimit;

/**
 * 负载类型（PayloadKind）
 *
 * 每个 PacketType 后面跟随的负载种类，以及该种负载默认使用的大小限制。
 * 控制类负载（问候、登录、命令）有固定上限，结果集和错误信息不限大小。
 */
public enum PayloadKind {
    /** 没有负载，例如 Ok、AccGranted、AccDenied */
    NONE(null, SizeLimit.CONTROL),
    GREETING(Greeting.class, SizeLimit.CONTROL),
    LOGIN(Login.class, SizeLimit.CONTROL),
    COMMAND(Command.class, SizeLimit.CONTROL),
    ERROR(ClientErrMsg.class, SizeLimit.INFINITE),
    RESULT_SET(ResultSet.class, SizeLimit.INFINITE);

    private final Class<? extends Payload> type;
    private final SizeLimit limit;

    PayloadKind(Class<? extends Payload> type, SizeLimit limit) {
        this.type = type;
        this.limit = limit;
    }

    /**
     * 负载对应的 Java 类型，NONE 返回 null
     */
    public Class<? extends Payload> getType() {
        return type;
    }

    public SizeLimit getLimit() {
        return limit;
    }

    public boolean hasPayload() {
        return this != NONE;
    }

    /**
     * 根据负载类查找负载类型
     *
     * @throws IllegalArgumentException 如果该类不是已知的负载
     */
    public static PayloadKind of(Class<? extends Payload> type) {
        for(PayloadKind kind : values()) {
            if(kind.type == type) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Not a payload type: " + type);
    }
}
