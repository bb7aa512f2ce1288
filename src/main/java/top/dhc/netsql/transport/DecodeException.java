package top.dhc.netsql.transport;

public class DecodeException extends CodecException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
