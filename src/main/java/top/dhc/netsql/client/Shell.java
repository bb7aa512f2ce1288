package top.dhc.netsql.client;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * 交互式命令行
 *
 * 每读入一行：
 * - ping：探测连接
 * - info：显示服务器问候和连接信息
 * - quit / exit：结束会话并退出
 * - 其它内容都作为查询语句发送
 */
public class Shell {
    private final Connection conn;  // 已经登录的连接，Shell 结束时关闭。
    private final BufferedReader in;  // 用户输入，每行一条命令。
    private final PrintStream out;  // 提示符、结果和错误信息的输出。

    public Shell(Connection conn, BufferedReader in, PrintStream out) {
        this.conn = conn;
        this.in = in;
        this.out = out;
    }

    public void run() throws IOException {
        try {
            while(true) {
                out.print(":> ");
                out.flush();
                String line = in.readLine();
                if(line == null) {
                    break;
                }
                line = line.trim();
                if(line.isEmpty()) {
                    continue;
                }
                if("exit".equals(line) || "quit".equals(line)) {
                    quit();
                    return;
                }
                try {
                    dispatch(line);
                } catch(ConnectionException e) {
                    out.println("[" + e.getKind() + "] " + e.getMessage());
                    // 连接已经不可用
                    if(e.getKind() == ConnectionException.Kind.IO) {
                        return;
                    }
                }
            }
        } finally {
            closeConnection();
        }
    }

    private void dispatch(String line) throws ConnectionException {
        switch(line) {
            case "ping":
                conn.ping();
                out.println("pong");
                break;
            case "info":
                out.println(conn.getMessage());
                out.println("protocol version: " + conn.getVersion() + " (client " + Connection.getLibVersion() + ")");
                out.println("connected to " + conn.getIp() + ":" + conn.getPort() + " as " + conn.getUsername());
                break;
            default:
                DataSet result = conn.execute(line);
                out.println(result.format());
        }
    }

    private void quit() {
        try {
            conn.quit();
            out.println("Bye");
        } catch(ConnectionException e) {
            out.println("[" + e.getKind() + "] " + e.getMessage());
        }
    }

    private void closeConnection() {
        try {
            conn.close();
        } catch(ConnectionException e) {
            out.println("[" + e.getKind() + "] " + e.getMessage());
        }
    }
}
