package top.dhc.netsql.backend.server;

import top.dhc.netsql.transport.message.ResultSet;

/**
 * 解析并执行查询语句
 *
 * 实现必须是线程安全的，所有连接处理线程共用同一个实例。
 */
public interface QueryExecutor {

    /**
     * @param query 客户端发来的原始语句
     * @return 查询结果
     * @throws QueryException 语句无法解析或执行失败，错误信息会原样发给客户端
     */
    ResultSet execute(String query) throws QueryException;
}
