package top.dhc.netsql.client;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.dhc.netsql.transport.DecodeException;
import top.dhc.netsql.transport.EncodeException;
import top.dhc.netsql.transport.Packager;
import top.dhc.netsql.transport.SizeLimit;
import top.dhc.netsql.transport.message.ClientErrMsg;
import top.dhc.netsql.transport.message.Command;
import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.Payload;

/**
 * 往返器（RoundTripper）
 *
 * 在 Packager 之上实现客户端的收发规则，所有底层异常都转换成 ConnectionException：
 * - IOException -> IO
 * - EncodeException -> ENCODE
 * - DecodeException -> DECODE
 *
 * 接收规则见 {@link #receive(PacketType)}。
 */
class RoundTripper {
    private static final Logger log = LoggerFactory.getLogger(RoundTripper.class);

    private final Packager packager;  // 连接上唯一的数据包收发入口。

    RoundTripper(Packager packager) {
        this.packager = packager;
    }

    /**
     * 发送一条命令并等待期望的响应标记，响应负载由调用方继续读取
     */
    void roundTrip(Command command, PacketType expected) throws ConnectionException {
        send(PacketType.COMMAND, command);
        receive(expected);
    }

    void send(PacketType type, Payload payload) throws ConnectionException {
        try {
            packager.send(type, payload);
        } catch(IOException e) {
            throw ConnectionException.io(e);
        } catch(EncodeException e) {
            throw ConnectionException.encode(e);
        }
    }

    /**
     * 读取一个标记并与期望的标记比较
     *
     * - 读到 ERROR：不论期望什么，都读取 ClientErrMsg 并作为服务器错误抛出
     * - 读到其它不符的标记：先丢弃该标记对应的负载，保证下一次交换从数据包边界开始，
     *   再抛出 UNEXPECTED_PACKET
     * - 读到期望的标记：直接返回，不读取负载
     */
    void receive(PacketType expected) throws ConnectionException {
        PacketType actual = readTag();
        if(actual == PacketType.ERROR) {
            throw serverError();
        }
        if(actual != expected) {
            throw unexpected(actual, expected.toString());
        }
    }

    /**
     * 丢弃意外标记对应的负载，返回 UNEXPECTED_PACKET 错误
     */
    ConnectionException unexpected(PacketType actual, String expected) throws ConnectionException {
        try {
            packager.skip(actual, SizeLimit.INFINITE);
        } catch(IOException e) {
            throw ConnectionException.io(e);
        } catch(DecodeException e) {
            throw ConnectionException.decode(e);
        }
        log.warn("Expected {} but received {}", expected, actual);
        return new ConnectionException(ConnectionException.Kind.UNEXPECTED_PACKET,
            "expected " + expected + " but received " + actual);
    }

    PacketType readTag() throws ConnectionException {
        try {
            return packager.receiveTag();
        } catch(IOException e) {
            throw ConnectionException.io(e);
        } catch(DecodeException e) {
            throw ConnectionException.decode(e);
        }
    }

    <T extends Payload> T read(Class<T> type, SizeLimit limit) throws ConnectionException {
        try {
            return packager.receive(type, limit);
        } catch(IOException e) {
            throw ConnectionException.io(e);
        } catch(DecodeException e) {
            throw ConnectionException.decode(e);
        }
    }

    /**
     * 读取 ERROR 标记之后的错误信息
     */
    ConnectionException serverError() throws ConnectionException {
        ClientErrMsg err = read(ClientErrMsg.class, SizeLimit.INFINITE);
        return ConnectionException.server(err);
    }

    void close() throws IOException {
        packager.close();
    }
}
