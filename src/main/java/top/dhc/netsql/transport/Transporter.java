package top.dhc.netsql.transport;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * 数据传输器（Transporter）
 *
 * 职责：
 * 持有套接字，负责底层字节流的发送和接收。
 *
 * 输入流不做缓冲：解码器每次只读取当前值需要的字节，
 * 连接上剩下的字节始终留在套接字中，不会被提前读走。
 * 输出流带缓冲，每发送一个值后刷新一次。
 */
public class Transporter {
    /** Socket连接 */
    private final Socket socket;
    /** 套接字输入流，不带缓冲 */
    private final InputStream input;
    /** 带缓冲的输出流，每个数据包刷新一次 */
    private final OutputStream output;

    public Transporter(Socket socket) throws IOException {
        this.socket = socket;
        this.input = socket.getInputStream();
        this.output = new BufferedOutputStream(socket.getOutputStream());
    }

    /**
     * 发送数据并立即刷新
     */
    public void send(byte[] data) throws IOException {
        output.write(data);
        output.flush();
    }

    public InputStream input() {
        return input;
    }

    public InetSocketAddress getRemoteAddress() {
        return (InetSocketAddress) socket.getRemoteSocketAddress();
    }

    public boolean isClosed() {
        return socket.isClosed();
    }

    /**
     * 关闭连接，重复调用没有影响
     */
    public void close() throws IOException {
        socket.close();
    }
}
