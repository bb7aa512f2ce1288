package top.dhc.netsql.client;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;

import top.dhc.netsql.transport.PacketCodec;
import top.dhc.netsql.transport.Packager;
import top.dhc.netsql.transport.SizeLimit;
import top.dhc.netsql.transport.Transporter;
import top.dhc.netsql.transport.message.Command;
import top.dhc.netsql.transport.message.Greeting;
import top.dhc.netsql.transport.message.Login;
import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.ResultSet;

/**
 * 与服务器之间的一条连接
 *
 * 只能通过 {@link #connect} 创建，握手和登录全部成功后才会交给调用方，
 * 因此调用方拿到的连接总是处于 READY 状态。传输或解码出错后连接会被关闭。
 * 连接是同步的：同一时刻只有一个请求在进行，
 * 调用方阻塞到收到完整响应（成功、服务器错误或意外数据包）后才能发出下一个请求。
 *
 * 连接本身不是线程安全的，多个线程共享时需要由调用方加锁。
 */
public class Connection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    /** 客户端实现的协议版本 */
    public static final int PROTOCOL_VERSION = 1;

    public enum State {
        CONNECTING,
        AWAITING_GREETING,
        AWAITING_LOGIN_ACK,
        READY,
        CLOSED
    }

    private final String ip;  // 服务器地址，点分十进制的 IPv4 字符串。
    private final int port;  // 服务器端口。
    private final Login login;  // 登录信息，握手时发送。
    private final ResultSetProcessor processor;  // 把原始结果集转换成 DataSet。
    private RoundTripper rt;  // TCP 连接建立后创建。
    private Greeting greeting;  // 服务器的问候，握手完成前为 null。
    private volatile State state = State.CONNECTING;  // 当前所处的阶段。

    private Connection(String ip, int port, Login login, ResultSetProcessor processor) {
        this.ip = ip;
        this.port = port;
        this.login = login;
        this.processor = processor;
    }

    public static Connection connect(String address, int port, String username, String password) throws ConnectionException {
        return connect(address, port, username, password, ConnectOptions.DEFAULT);
    }

    /**
     * 建立连接：解析地址、建立 TCP 连接、接收问候、发送登录信息、等待授权结果
     *
     * @throws ConnectionException 任何一步失败都会关闭套接字并抛出对应种类的错误
     */
    public static Connection connect(String address, int port, String username, String password,
                                     ConnectOptions options) throws ConnectionException {
        Preconditions.checkArgument(port >= 0 && port <= 0xFFFF, "port out of range: %s", port);
        InetAddress addr = parseAddress(address);

        Connection conn = new Connection(address, port, new Login(username, password), options.getProcessor());
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(addr, port), options.getConnectTimeoutMillis());
            socket.setSoTimeout(options.getReadTimeoutMillis());
            socket.setTcpNoDelay(true);
            conn.rt = new RoundTripper(new Packager(new Transporter(socket), new PacketCodec()));
        } catch(IOException e) {
            conn.state = State.CLOSED;
            closeAfterFailure(socket, e);
            throw ConnectionException.io(e);
        }

        try {
            conn.handshake();
        } catch(ConnectionException | RuntimeException e) {
            conn.state = State.CLOSED;
            closeAfterFailure(socket, e);
            throw e;
        }
        log.info("Connected to {}:{} as {}", address, port, username);
        return conn;
    }

    private void handshake() throws ConnectionException {
        state = State.AWAITING_GREETING;
        rt.receive(PacketType.GREET);
        greeting = rt.read(Greeting.class, SizeLimit.CONTROL);
        if(greeting.getProtocolVersion() != PROTOCOL_VERSION) {
            log.warn("Server speaks protocol version {}, client speaks {}", greeting.getProtocolVersion(), PROTOCOL_VERSION);
        }
        log.debug("{}: received {}", state, greeting);

        rt.send(PacketType.LOGIN, login);
        state = State.AWAITING_LOGIN_ACK;

        PacketType status = rt.readTag();
        switch(status) {
            case ACC_GRANTED:
                state = State.READY;
                return;
            case ACC_DENIED:
                throw new ConnectionException(ConnectionException.Kind.AUTH);
            case ERROR:
                throw rt.serverError();
            default:
                throw rt.unexpected(status, state + " reply");
        }
    }

    private static InetAddress parseAddress(String address) throws ConnectionException {
        InetAddress addr;
        try {
            addr = InetAddresses.forString(address);
        } catch(IllegalArgumentException e) {
            throw new ConnectionException(ConnectionException.Kind.ADDR_PARSE, e);
        }
        if(!(addr instanceof Inet4Address)) {
            throw new ConnectionException(ConnectionException.Kind.ADDR_PARSE, address);
        }
        return addr;
    }

    /**
     * 发送 Ping，期望收到 OK
     */
    public void ping() throws ConnectionException {
        checkReady();
        try {
            rt.roundTrip(Command.PING, PacketType.OK);
        } catch(ConnectionException e) {
            throw abandonIfBroken(e);
        }
    }

    /**
     * 发送 Quit，期望收到 OK。无论往返是否成功，连接都会被关闭，
     * 因为服务器可能先一步关闭连接。
     */
    public void quit() throws ConnectionException {
        checkReady();
        try {
            rt.roundTrip(Command.QUIT, PacketType.OK);
        } finally {
            state = State.CLOSED;
            try {
                rt.close();
            } catch(IOException e) {
                log.debug("Error closing connection to {}:{}", ip, port, e);
            }
        }
        log.info("Disconnected from {}:{}", ip, port);
    }

    /**
     * 执行一条查询
     *
     * 查询语句和命令头一起受控制数据包大小的限制，过长的语句会以 ENCODE 错误失败，
     * 此时什么都没有发送，连接仍然可用。结果集不限大小。
     */
    public DataSet execute(String query) throws ConnectionException {
        checkReady();
        ResultSet rows;
        try {
            rt.roundTrip(Command.query(query), PacketType.RESPONSE);
            rows = rt.read(ResultSet.class, SizeLimit.INFINITE);
        } catch(ConnectionException e) {
            throw abandonIfBroken(e);
        }
        return processor.process(rows);
    }

    /**
     * 直接释放套接字，不与服务器进行 Quit 往返
     */
    @Override
    public void close() throws ConnectionException {
        if(state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        try {
            rt.close();
        } catch(IOException e) {
            throw ConnectionException.io(e);
        }
    }

    /**
     * IO 和 DECODE 错误发生时可能只读了半个数据包，剩下的字节无法与下一个数据包区分，
     * 连接只能关闭。其余错误发生时数据流仍在数据包边界上，连接保持可用。
     */
    private ConnectionException abandonIfBroken(ConnectionException e) {
        if(e.getKind() != ConnectionException.Kind.IO && e.getKind() != ConnectionException.Kind.DECODE) {
            return e;
        }
        log.warn("Closing connection to {}:{} after {} error", ip, port, e.getKind());
        state = State.CLOSED;
        try {
            rt.close();
        } catch(IOException closeError) {
            e.addSuppressed(closeError);
        }
        return e;
    }

    private void checkReady() throws ConnectionException {
        if(state != State.READY) {
            throw new ConnectionException(ConnectionException.Kind.IO, "connection is closed");
        }
    }

    private static void closeAfterFailure(Socket socket, Exception primary) {
        try {
            socket.close();
        } catch(IOException e) {
            primary.addSuppressed(e);
        }
    }

    public int getVersion() {
        return greeting.getProtocolVersion();
    }

    public String getMessage() {
        return greeting.getMessage();
    }

    public String getIp() {
        return ip;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return login.getUsername();
    }

    public State getState() {
        return state;
    }

    public static int getLibVersion() {
        return PROTOCOL_VERSION;
    }
}
