package top.dhc.netsql.backend.config;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.net.InetAddresses;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import top.dhc.netsql.common.Error;
import top.dhc.netsql.transport.EncodeException;
import top.dhc.netsql.transport.PacketCodec;
import top.dhc.netsql.transport.SizeLimit;
import top.dhc.netsql.transport.message.Greeting;

/**
 * 服务器配置
 *
 * 从 JSON 文件读取，文件中没有给出的项使用默认值：
 * <pre>
 * {
 *   "address": "127.0.0.1",
 *   "port": 4242,
 *   "dir": "data",
 *   "greeting": "Welcome to netsql",
 *   "maxConnections": 20,
 *   "readTimeoutMillis": 0,
 *   "logLevel": "info",
 *   "logFile": "log.txt",
 *   "users": { "admin": "admin" }
 * }
 * </pre>
 * 配置对象创建后不可修改，作为参数交给 Server 和 ConnectionHandler。
 */
public final class ServerConfig {
    public static final String DEFAULT_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_PORT = 4242;
    public static final String DEFAULT_DIR = "data";
    public static final String DEFAULT_GREETING = "Welcome to netsql";
    public static final int DEFAULT_MAX_CONNECTIONS = 20;
    public static final String DEFAULT_LOG_LEVEL = "info";
    public static final String DEFAULT_LOG_FILE = "log.txt";

    private final InetAddress address;  // 监听地址，只接受 IPv4。
    private final int port;  // 监听端口，0 表示由系统分配。
    private final String dir;  // 数据目录，目前没有用到。
    private final String greeting;  // 问候数据包中的信息。
    private final int maxConnections;  // 同时处理的最大连接数。
    private final int readTimeoutMillis;  // 套接字读超时，0 表示一直等待。
    private final String logLevel;  // 日志级别，交给 log4j2。
    private final String logFile;  // 日志文件路径。
    private final Map<String, String> users;  // 用户名 -> 密码。

    private ServerConfig(InetAddress address, int port, String dir, String greeting, int maxConnections,
                         int readTimeoutMillis, String logLevel, String logFile, Map<String, String> users) {
        if(port < 0 || port > 0xFFFF) {
            throw Error.InvalidPortException;
        }
        if(maxConnections < 1 || readTimeoutMillis < 0) {
            throw Error.InvalidConfigException;
        }
        checkGreeting(greeting);
        this.address = address;
        this.port = port;
        this.dir = dir;
        this.greeting = greeting;
        this.maxConnections = maxConnections;
        this.readTimeoutMillis = readTimeoutMillis;
        this.logLevel = logLevel;
        this.logFile = logFile;
        this.users = users;
    }

    public static ServerConfig defaults() {
        return fromJson("{}");
    }

    /**
     * 读取配置文件，文件不存在时返回默认配置
     */
    public static ServerConfig load(Path file) throws IOException {
        if(!Files.exists(file)) {
            return defaults();
        }
        return fromJson(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    public static ServerConfig fromJson(String json) {
        CfgFile cfg;
        try {
            cfg = new Gson().fromJson(json, CfgFile.class);
        } catch(JsonParseException e) {
            throw Error.InvalidConfigException;
        }
        if(cfg == null) {
            cfg = new CfgFile();
        }
        Map<String, String> users = ImmutableMap.of("admin", "admin");
        if(cfg.users != null) {
            try {
                users = ImmutableMap.copyOf(cfg.users);
            } catch(NullPointerException e) {
                throw Error.InvalidUserTableException;
            }
        }
        return new ServerConfig(
            parseAddress(cfg.address != null ? cfg.address : DEFAULT_ADDRESS),
            cfg.port != null ? cfg.port : DEFAULT_PORT,
            cfg.dir != null ? cfg.dir : DEFAULT_DIR,
            cfg.greeting != null ? cfg.greeting : DEFAULT_GREETING,
            cfg.maxConnections != null ? cfg.maxConnections : DEFAULT_MAX_CONNECTIONS,
            cfg.readTimeoutMillis != null ? cfg.readTimeoutMillis : 0,
            cfg.logLevel != null ? cfg.logLevel : DEFAULT_LOG_LEVEL,
            cfg.logFile != null ? cfg.logFile : DEFAULT_LOG_FILE,
            users);
    }

    /**
     * 问候信息必须能放进一个控制数据包，否则每个连接都会在握手时失败
     */
    private static void checkGreeting(String greeting) {
        try {
            // 版本号不影响编码后的长度
            new PacketCodec().encode(new Greeting(0, greeting), SizeLimit.CONTROL);
        } catch(EncodeException e) {
            throw Error.InvalidConfigException;
        }
    }

    private static InetAddress parseAddress(String s) {
        InetAddress addr;
        try {
            addr = InetAddresses.forString(s);
        } catch(IllegalArgumentException e) {
            throw Error.InvalidAddressException;
        }
        if(!(addr instanceof Inet4Address)) {
            throw Error.InvalidAddressException;
        }
        return addr;
    }

    public ServerConfig withAddress(String address) {
        return new ServerConfig(parseAddress(address), port, dir, greeting, maxConnections,
            readTimeoutMillis, logLevel, logFile, users);
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(address, port, dir, greeting, maxConnections,
            readTimeoutMillis, logLevel, logFile, users);
    }

    public ServerConfig withLogLevel(String logLevel) {
        return new ServerConfig(address, port, dir, greeting, maxConnections,
            readTimeoutMillis, logLevel, logFile, users);
    }

    public ServerConfig withLogFile(String logFile) {
        return new ServerConfig(address, port, dir, greeting, maxConnections,
            readTimeoutMillis, logLevel, logFile, users);
    }

    public InetAddress getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public String getDir() {
        return dir;
    }

    public String getGreeting() {
        return greeting;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public String getLogFile() {
        return logFile;
    }

    public Map<String, String> getUsers() {
        return users;
    }

    @Override
    public String toString() {
        return "ServerConfig{address=" + address.getHostAddress() + ", port=" + port + ", dir='" + dir
            + "', maxConnections=" + maxConnections + ", readTimeoutMillis=" + readTimeoutMillis
            + ", logLevel=" + logLevel + ", logFile='" + logFile + "', users=" + users.keySet() + "}";
    }

    // JSON 文件的结构，所有字段都可以省略
    private static class CfgFile {
        String address;
        Integer port;
        String dir;
        String greeting;
        Integer maxConnections;
        Integer readTimeoutMillis;
        String logLevel;
        String logFile;
        Map<String, String> users;
    }
}
