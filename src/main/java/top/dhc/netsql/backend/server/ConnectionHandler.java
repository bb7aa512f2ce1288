package top.dhc.netsql.backend.server;

import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.dhc.netsql.backend.config.ServerConfig;
import top.dhc.netsql.transport.DecodeException;
import top.dhc.netsql.transport.EncodeException;
import top.dhc.netsql.transport.PacketCodec;
import top.dhc.netsql.transport.Packager;
import top.dhc.netsql.transport.SizeLimit;
import top.dhc.netsql.transport.Transporter;
import top.dhc.netsql.transport.message.ClientErrMsg;
import top.dhc.netsql.transport.message.Command;
import top.dhc.netsql.transport.message.Greeting;
import top.dhc.netsql.transport.message.Login;
import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.Payload;
import top.dhc.netsql.transport.message.ResultSet;

/**
 * 处理一个客户端连接
 *
 * 每个被接受的套接字对应一个实例，在独立的线程中同步运行：
 * 发送问候 -> 等待登录 -> 授权 -> 循环处理命令，直到 Quit 或连接断开。
 * 除了只读的配置和线程安全的授权器、执行器之外，不与其它连接共享任何状态。
 */
public class ConnectionHandler implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    /** 服务器实现的协议版本 */
    public static final int PROTOCOL_VERSION = 1;

    public enum State {
        AWAIT_GREETING_SEND,
        AWAIT_LOGIN,
        AUTHORIZING,
        SERVING,
        CLOSED
    }

    private final Socket socket;  // 客户端套接字，处理结束后关闭。
    private final ServerConfig config;  // 只读配置，提供问候语和读超时。
    private final Authorizer authorizer;  // 登录时校验用户名和密码。
    private final QueryExecutor executor;  // 执行 Query 命令中的语句。
    private volatile State state = State.AWAIT_GREETING_SEND;  // 当前所处的阶段，出错时写入日志。

    public ConnectionHandler(Socket socket, ServerConfig config, Authorizer authorizer, QueryExecutor executor) {
        this.socket = socket;
        this.config = config;
        this.authorizer = authorizer;
        this.executor = executor;
    }

    @Override
    public void run() {
        InetSocketAddress address = (InetSocketAddress) socket.getRemoteSocketAddress();
        String peer = address.getAddress().getHostAddress() + ":" + address.getPort();
        log.info("Establish connection: {}", peer);

        Packager packager;
        try {
            socket.setSoTimeout(config.getReadTimeoutMillis());
            packager = new Packager(new Transporter(socket), new PacketCodec());
        } catch(IOException e) {
            log.error("Failed to set up connection {}", peer, e);
            closeSocket(peer);
            return;
        }

        try {
            if(handshake(packager, peer)) {
                serve(packager, peer);
            }
        } catch(SocketTimeoutException e) {
            log.warn("Connection {} timed out in state {}", peer, state);
        } catch(EOFException e) {
            log.info("Connection {} closed by peer in state {}", peer, state);
        } catch(IOException e) {
            log.warn("Transport error on {} in state {}: {}", peer, state, e.getMessage());
        } catch(DecodeException e) {
            log.warn("Malformed packet from {} in state {}: {}", peer, state, e.getMessage());
        } catch(RuntimeException e) {
            log.error("Connection handler for {} failed in state {}", peer, state, e);
        } finally {
            state = State.CLOSED;
            closeSocket(peer);
        }
    }

    /**
     * 发送问候并完成登录
     *
     * @return 是否授权成功
     */
    private boolean handshake(Packager packager, String peer) throws IOException, DecodeException {
        sendOrFail(packager, PacketType.GREET, new Greeting(PROTOCOL_VERSION, config.getGreeting()));
        state = State.AWAIT_LOGIN;

        PacketType tag = packager.receiveTag();
        if(tag != PacketType.LOGIN) {
            log.warn("Expected LOGIN from {} but received {}", peer, tag);
            sendError(packager, ClientErrMsg.UNEXPECTED_PACKET, "expected LOGIN but received " + tag);
            return false;
        }
        Login login = packager.receive(Login.class);
        state = State.AUTHORIZING;

        if(!authorizer.authorize(login.getUsername(), login.getPassword())) {
            log.info("Login denied for user '{}' from {}", login.getUsername(), peer);
            packager.send(PacketType.ACC_DENIED);
            return false;
        }
        packager.send(PacketType.ACC_GRANTED);
        state = State.SERVING;
        log.info("Login granted for user '{}' from {}", login.getUsername(), peer);
        return true;
    }

    private void serve(Packager packager, String peer) throws IOException, DecodeException {
        while(true) {
            PacketType tag = packager.receiveTag();
            if(tag != PacketType.COMMAND) {
                log.warn("Expected COMMAND from {} but received {}", peer, tag);
                packager.skip(tag, SizeLimit.CONTROL);
                sendError(packager, ClientErrMsg.UNEXPECTED_PACKET, "expected COMMAND but received " + tag);
                continue;
            }
            Command command = packager.receive(Command.class);
            log.debug("{}: {}", peer, command);
            switch(command.getType()) {
                case PING:
                    packager.send(PacketType.OK);
                    break;
                case QUIT:
                    packager.send(PacketType.OK);
                    log.info("Connection {} quit", peer);
                    return;
                default:
                    query(packager, command.getQuery());
            }
        }
    }

    private void query(Packager packager, String query) throws IOException {
        ResultSet rs;
        try {
            rs = executor.execute(query);
        } catch(QueryException e) {
            sendError(packager, ClientErrMsg.QUERY_FAILED, e.getMessage());
            return;
        } catch(RuntimeException e) {
            log.error("Executor failed on '{}'", query, e);
            sendError(packager, ClientErrMsg.UNKNOWN, "internal server error");
            return;
        }
        sendOrFail(packager, PacketType.RESPONSE, rs);
    }

    private void sendError(Packager packager, int code, String msg) throws IOException {
        sendOrFail(packager, PacketType.ERROR, new ClientErrMsg(code, msg == null ? "" : msg));
    }

    /**
     * 发送带负载的数据包。问候的长度在加载配置时已经检查过，这里编码失败说明程序有错
     */
    private void sendOrFail(Packager packager, PacketType type, Payload payload) throws IOException {
        try {
            packager.send(type, payload);
        } catch(EncodeException e) {
            throw new IllegalStateException("Cannot encode " + type, e);
        }
    }

    public State getState() {
        return state;
    }

    private void closeSocket(String peer) {
        try {
            socket.close();
        } catch(IOException e) {
            log.warn("Failed to close connection {}", peer, e);
        }
        log.info("Connection {} closed", peer);
    }
}
