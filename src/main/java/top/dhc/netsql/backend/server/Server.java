package top.dhc.netsql.backend.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import top.dhc.netsql.backend.config.ServerConfig;
import top.dhc.netsql.transport.EncodeException;
import top.dhc.netsql.transport.PacketCodec;
import top.dhc.netsql.transport.Packager;
import top.dhc.netsql.transport.Transporter;
import top.dhc.netsql.transport.message.ClientErrMsg;
import top.dhc.netsql.transport.message.PacketType;

/**
 * 服务器
 *
 * 接受连接的线程只负责 accept 并把套接字交给线程池，不读取客户端的任何数据；
 * 每个连接由线程池中的一个线程从头到尾同步处理。线程池满时向新连接写一个
 * SERVER_BUSY 错误（代替问候）后立即关闭。
 */
public class Server {
    private static final Logger log = LoggerFactory.getLogger(Server.class);

    /** 线程池已满时发给新连接的错误 */
    static final ClientErrMsg BUSY = new ClientErrMsg(ClientErrMsg.SERVER_BUSY, "too many connections");

    private final ServerConfig config;  // 监听地址、端口、最大连接数等配置。
    private final Authorizer authorizer;  // 所有连接共用的授权器。
    private final QueryExecutor executor;  // 所有连接共用的查询执行器。

    private volatile ServerSocket ss;  // 监听套接字，listen() 之后才有值。
    private volatile boolean shutdown;  // shutdown() 被调用后为 true，accept 循环据此退出。
    private ThreadPoolExecutor tpe;  // 处理连接的线程池，最多 maxConnections 个线程。

    public Server(ServerConfig config, Authorizer authorizer, QueryExecutor executor) {
        this.config = config;
        this.authorizer = authorizer;
        this.executor = executor;
    }

    /**
     * 绑定地址并开始服务，阻塞直到 {@link #shutdown()} 被调用
     */
    public void start() throws IOException {
        listen();
        serve();
    }

    /**
     * 绑定配置中的地址和端口，端口为 0 时由系统分配
     */
    public synchronized void listen() throws IOException {
        Preconditions.checkState(ss == null, "server is already listening");
        ServerSocket socket = new ServerSocket();
        try {
            socket.bind(new InetSocketAddress(config.getAddress(), config.getPort()));
        } catch(IOException e) {
            socket.close();
            throw e;
        }
        ss = socket;
        tpe = new ThreadPoolExecutor(0, config.getMaxConnections(), 60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("netsql-conn-%d").setDaemon(true).build(),
            new ThreadPoolExecutor.AbortPolicy());
        log.info("Server listen to {}:{}", config.getAddress().getHostAddress(), getLocalPort());
    }

    /**
     * 接受连接的循环，在调用线程中运行
     */
    public void serve() {
        Preconditions.checkState(ss != null, "listen() must be called first");
        while(!shutdown) {
            Socket socket;
            try {
                socket = ss.accept();
            } catch(IOException e) {
                if(shutdown) {
                    break;
                }
                log.warn("Failed to accept incoming connection", e);
                continue;
            }
            dispatch(socket);
        }
        log.info("Server stopped");
    }

    private void dispatch(Socket socket) {
        try {
            tpe.execute(new ConnectionHandler(socket, config, authorizer, executor));
        } catch(RejectedExecutionException e) {
            reject(socket);
        }
    }

    /**
     * 告知客户端服务器繁忙并关闭连接。新连接的发送缓冲区是空的，这里的写不会阻塞。
     */
    private void reject(Socket socket) {
        log.warn("Too many connections, rejecting {}", socket.getRemoteSocketAddress());
        try {
            new Packager(new Transporter(socket), new PacketCodec()).send(PacketType.ERROR, BUSY);
        } catch(IOException | EncodeException e) {
            log.warn("Failed to notify rejected connection {}", socket.getRemoteSocketAddress(), e);
        } finally {
            try {
                socket.close();
            } catch(IOException e) {
                log.warn("Failed to close rejected connection", e);
            }
        }
    }

    public int getLocalPort() {
        Preconditions.checkState(ss != null, "server is not listening");
        return ss.getLocalPort();
    }

    /**
     * 关闭监听套接字和线程池。已经在处理中的连接会在对端断开或读超时后结束。
     */
    public synchronized void shutdown() throws IOException {
        shutdown = true;
        if(tpe != null) {
            tpe.shutdownNow();
        }
        if(ss != null) {
            ss.close();
        }
    }
}
