package top.dhc.netsql.backend.server;

/**
 * 登录授权
 *
 * 实现必须是线程安全的，所有连接处理线程共用同一个实例。
 */
public interface Authorizer {

    /**
     * @return 用户名和密码是否允许登录
     */
    boolean authorize(String username, String password);
}
