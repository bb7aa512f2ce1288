package top.dhc.netsql.transport.message;

/**
 * 可以跟在 PacketType 后面发送的负载
 */
public interface Payload {

    PayloadKind kind();
}
