package top.dhc.netsql.transport.message;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * 错误信息（ClientErrMsg）
 *
 * 跟在 ERROR 标记后面，可以出现在协议的任何位置，取代原本期望的负载。
 * code 用于程序判断，msg 原样交给调用方。
 */
public final class ClientErrMsg implements Payload {
    public static final int UNKNOWN = 0;
    public static final int UNEXPECTED_PACKET = 1;
    public static final int QUERY_FAILED = 2;
    public static final int SERVER_BUSY = 3;

    private final int code;
    private final String msg;

    public ClientErrMsg(int code, String msg) {
        Preconditions.checkArgument(code >= 0 && code <= 0xFFFF, "error code must fit in u16: %s", code);
        this.code = code;
        this.msg = Preconditions.checkNotNull(msg, "msg");
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof ClientErrMsg)) {
            return false;
        }
        ClientErrMsg other = (ClientErrMsg) o;
        return code == other.code && msg.equals(other.msg);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, msg);
    }

    @Override
    public String toString() {
        return "ClientErrMsg{code=" + code + ", msg='" + msg + "'}";
    }
}
