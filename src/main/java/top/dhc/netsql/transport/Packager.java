package top.dhc.netsql.transport;

import java.io.IOException;
import java.net.InetSocketAddress;

import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;

import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.Payload;
import top.dhc.netsql.transport.message.PayloadKind;

/**
 * 数据包打包器（Packager）
 *
 * 职责：
 * 组合 Transporter 和 PacketCodec，为连接两端提供按数据包收发的接口。
 *
 * 工作流程：
 * - 发送：先把负载完整编码，通过大小检查后再连同标记一起写出，
 *   编码失败时连接上不会留下半个数据包
 * - 接收：先读标记，调用方根据标记决定读取哪种负载
 */
public class Packager {
    private static final Logger log = LoggerFactory.getLogger(Packager.class);

    /** 数据传输器，负责底层字节流 */
    private final Transporter transporter;
    /** 编解码器，负责标记和负载与字节之间的转换 */
    private final PacketCodec codec;

    public Packager(Transporter transporter, PacketCodec codec) {
        this.transporter = transporter;
        this.codec = codec;
    }

    /**
     * 发送一个不带负载的数据包，例如 OK、ACC_GRANTED
     */
    public void send(PacketType type) throws IOException {
        Preconditions.checkArgument(!type.getPayload().hasPayload(), "%s requires a payload", type);
        write(type, codec.encodeTag(type));
    }

    /**
     * 发送标记和负载，负载按该种类的默认限制编码
     */
    public void send(PacketType type, Payload payload) throws IOException, EncodeException {
        send(type, payload, payload.kind().getLimit());
    }

    public void send(PacketType type, Payload payload, SizeLimit limit) throws IOException, EncodeException {
        Preconditions.checkArgument(type.getPayload() == payload.kind(),
            "%s cannot carry %s", type, payload.kind());
        byte[] body = codec.encode(payload, limit);
        write(type, Bytes.concat(codec.encodeTag(type), body));
    }

    /**
     * 读取下一个类型标记
     */
    public PacketType receiveTag() throws IOException, DecodeException {
        PacketType type = codec.decodeTag(transporter.input());
        log.trace("{} <- {}", transporter.getRemoteAddress(), type);
        return type;
    }

    /**
     * 读取一个负载，必须在读到对应的标记之后调用
     */
    public <T extends Payload> T receive(Class<T> type, SizeLimit limit) throws IOException, DecodeException {
        T payload = codec.decode(type, transporter.input(), limit);
        log.trace("{} <- {}", transporter.getRemoteAddress(), payload);
        return payload;
    }

    public <T extends Payload> T receive(Class<T> type) throws IOException, DecodeException {
        return receive(type, PayloadKind.of(type).getLimit());
    }

    /**
     * 丢弃给定标记所对应的负载，使数据流与下一个数据包对齐
     *
     * 丢弃时使用的大小限制由调用方决定：服务器对客户端发来的任何负载都按控制数据包限制，
     * 客户端信任服务器，按不限大小读取。
     */
    public void skip(PacketType type, SizeLimit limit) throws IOException, DecodeException {
        PayloadKind kind = type.getPayload();
        if(kind.hasPayload()) {
            Payload dropped = codec.decode(kind, transporter.input(), limit);
            log.debug("Discarded {} following {}", dropped, type);
        }
    }

    public InetSocketAddress getRemoteAddress() {
        return transporter.getRemoteAddress();
    }

    public boolean isClosed() {
        return transporter.isClosed();
    }

    public void close() throws IOException {
        transporter.close();
    }

    private void write(PacketType type, byte[] data) throws IOException {
        if(log.isTraceEnabled()) {
            log.trace("{} -> {} [{}]", transporter.getRemoteAddress(), type, Hex.encodeHexString(data));
        }
        transporter.send(data);
    }
}
