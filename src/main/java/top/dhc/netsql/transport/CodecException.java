package top.dhc.netsql.transport;

/**
 * 编解码失败：字节格式错误、超出大小限制或数据流被截断
 */
public abstract class CodecException extends Exception {

    protected CodecException(String message) {
        super(message);
    }

    protected CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
