package top.dhc.netsql.transport.message;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * 问候消息（Greeting）
 *
 * 服务器在接受连接后立即发送，携带协议版本号和一段欢迎信息。
 * 版本号只用于展示，协议本身不做版本协商。
 */
public final class Greeting implements Payload {
    private final int protocolVersion;
    private final String message;

    public Greeting(int protocolVersion, String message) {
        Preconditions.checkArgument(protocolVersion >= 0 && protocolVersion <= 0xFF,
            "protocol version must fit in one byte: %s", protocolVersion);
        this.protocolVersion = protocolVersion;
        this.message = Preconditions.checkNotNull(message, "message");
    }

    public int getProtocolVersion() {
        return protocolVersion;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.GREETING;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Greeting)) {
            return false;
        }
        Greeting other = (Greeting) o;
        return protocolVersion == other.protocolVersion && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(protocolVersion, message);
    }

    @Override
    public String toString() {
        return "Greeting{version=" + protocolVersion + ", message='" + message + "'}";
    }
}
