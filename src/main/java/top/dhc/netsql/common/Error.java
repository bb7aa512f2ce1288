package top.dhc.netsql.common;

public class Error {
    // ========== 配置错误（config） ==========
    public static final RuntimeException InvalidConfigException = new RuntimeException("Invalid configuration file!");
    public static final RuntimeException InvalidAddressException = new RuntimeException("Invalid IPv4 address!");
    public static final RuntimeException InvalidPortException = new RuntimeException("Invalid port!");
    public static final RuntimeException InvalidUserTableException = new RuntimeException("Invalid user table!");

    // ========== SQL 词法错误（parser） ==========
    public static final RuntimeException InvalidCommandException = new RuntimeException("Invalid command!");
}
