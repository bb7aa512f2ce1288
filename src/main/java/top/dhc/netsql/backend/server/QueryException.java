package top.dhc.netsql.backend.server;

/**
 * 查询失败，信息会作为 ClientErrMsg 发给客户端
 */
public class QueryException extends Exception {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
