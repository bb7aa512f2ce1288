package top.dhc.netsql.transport.message;

/**
 * 数据包类型（PacketType）
 *
 * 连接上每一次交换都以一个类型标记开头，标记决定后面是否有负载以及负载的种类：
 * <pre>
 *   [tag (1 byte)][payload?]
 * </pre>
 *
 * 类型值会写入协议包中，不能随意修改；标记到负载的映射在构造时给出，
 * 因此对每一个标记都是确定的。
 */
public enum PacketType {
    GREET(0, PayloadKind.GREETING),
    LOGIN(1, PayloadKind.LOGIN),
    COMMAND(2, PayloadKind.COMMAND),
    OK(3, PayloadKind.NONE),
    ERROR(4, PayloadKind.ERROR),
    RESPONSE(5, PayloadKind.RESULT_SET),
    ACC_GRANTED(6, PayloadKind.NONE),
    ACC_DENIED(7, PayloadKind.NONE);

    private static final PacketType[] BY_CODE = new PacketType[values().length];

    static {
        for(PacketType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;
    private final PayloadKind payload;

    PacketType(int code, PayloadKind payload) {
        this.code = code;
        this.payload = payload;
    }

    public int getCode() {
        return code;
    }

    /**
     * 该标记后面跟随的负载种类
     */
    public PayloadKind getPayload() {
        return payload;
    }

    /**
     * @return 对应的类型，未知的类型值返回 null
     */
    public static PacketType fromCode(int code) {
        if(code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }
}
