package top.dhc.netsql.transport;

public class EncodeException extends CodecException {

    public EncodeException(String message) {
        super(message);
    }
}
