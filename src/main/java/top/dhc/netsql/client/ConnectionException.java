package top.dhc.netsql.client;

import java.io.IOException;

import top.dhc.netsql.transport.DecodeException;
import top.dhc.netsql.transport.EncodeException;
import top.dhc.netsql.transport.message.ClientErrMsg;

/**
 * 客户端统一的错误类型
 *
 * 传输错误、编解码错误、数据包顺序错误、认证失败和服务器报告的错误都通过它交给调用方。
 * 调用方应根据 {@link #getKind()} 判断错误种类，而不是根据错误信息文本。
 *
 * <pre>{@code
 * try {
 *     conn.execute("SELECT 1");
 * } catch (ConnectionException e) {
 *     if (e.getKind() == ConnectionException.Kind.SERVER) {
 *         System.out.println(e.getServerError().getMsg());
 *     }
 * }
 * }</pre>
 */
public class ConnectionException extends Exception {

    public enum Kind {
        /** 地址不是合法的 IPv4 地址 */
        ADDR_PARSE("wrong IPv4 address format"),
        /** 建立连接失败或读写套接字失败 */
        IO("IO error occurred"),
        /** 收到的数据包类型与期望不符 */
        UNEXPECTED_PACKET("received unexpected package"),
        ENCODE("could not encode/ send package"),
        DECODE("could not decode/ receive package"),
        /** 服务器拒绝了登录 */
        AUTH("could not authenticate user"),
        /** 服务器发送了 ERROR 数据包，信息原样保留 */
        SERVER("server reported an error");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;
    private final ClientErrMsg serverError;

    public ConnectionException(Kind kind) {
        super(kind.getDescription());
        this.kind = kind;
        this.serverError = null;
    }

    public ConnectionException(Kind kind, String detail) {
        super(kind.getDescription() + ": " + detail);
        this.kind = kind;
        this.serverError = null;
    }

    public ConnectionException(Kind kind, Throwable cause) {
        super(cause.getMessage() == null ? kind.getDescription() : kind.getDescription() + ": " + cause.getMessage(), cause);
        this.kind = kind;
        this.serverError = null;
    }

    private ConnectionException(ClientErrMsg serverError) {
        super(serverError.getMsg());
        this.kind = Kind.SERVER;
        this.serverError = serverError;
    }

    public static ConnectionException server(ClientErrMsg err) {
        return new ConnectionException(err);
    }

    public static ConnectionException io(IOException e) {
        return new ConnectionException(Kind.IO, e);
    }

    public static ConnectionException encode(EncodeException e) {
        return new ConnectionException(Kind.ENCODE, e);
    }

    public static ConnectionException decode(DecodeException e) {
        return new ConnectionException(Kind.DECODE, e);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return 服务器发送的错误信息，只有 SERVER 类型的错误才有，其余返回 null
     */
    public ClientErrMsg getServerError() {
        return serverError;
    }

    /**
     * 面向用户的错误描述；服务器错误返回服务器给出的原文
     */
    public String getDescription() {
        return kind == Kind.SERVER ? serverError.getMsg() : kind.getDescription();
    }
}
