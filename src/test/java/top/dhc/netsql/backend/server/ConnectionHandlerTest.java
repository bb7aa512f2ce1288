package top.dhc.netsql.backend.server;

import java.io.EOFException;
import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.google.common.base.Strings;

import top.dhc.netsql.transport.Packager;
import top.dhc.netsql.transport.SizeLimit;
import top.dhc.netsql.transport.message.ClientErrMsg;
import top.dhc.netsql.transport.message.Command;
import top.dhc.netsql.transport.message.Greeting;
import top.dhc.netsql.transport.message.Login;
import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionHandlerTest {

    private static final ResultSet ONE = ResultSet.builder().column("1", SqlType.INT).row(1).build();

    // "ok" 返回一行结果，"bad" 查询失败，其余语句让执行器本身出错
    private static final QueryExecutor STUB = query -> {
        if("ok".equals(query)) {
            return ONE;
        }
        if("bad".equals(query)) {
            throw new QueryException("syntax error");
        }
        throw new IllegalStateException("executor bug");
    };

    private static Greeting login(Packager client, String username, String password) throws Exception {
        assertEquals(PacketType.GREET, client.receiveTag());
        Greeting greeting = client.receive(Greeting.class);
        client.send(PacketType.LOGIN, new Login(username, password));
        return greeting;
    }

    private static void assertError(Packager client, int code, String msg) throws Exception {
        assertEquals(PacketType.ERROR, client.receiveTag());
        ClientErrMsg err = client.receive(ClientErrMsg.class);
        assertEquals(code, err.getCode());
        assertEquals(msg, err.getMsg());
    }

    private static void assertPong(Packager client) throws Exception {
        client.send(PacketType.COMMAND, Command.PING);
        assertEquals(PacketType.OK, client.receiveTag());
    }

    @Test
    void greetsWithConfiguredMessage() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();

            Greeting greeting = login(client, "alice", "pw");

            assertEquals(ConnectionHandler.PROTOCOL_VERSION, greeting.getProtocolVersion());
            assertEquals("hi there", greeting.getMessage());
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());
            client.close();
        }
    }

    @Test
    void deniedLoginClosesConnection() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();

            login(client, "alice", "wrong");

            assertEquals(PacketType.ACC_DENIED, client.receiveTag());
            assertThrows(EOFException.class, client::receiveTag);
            client.close();
        }
    }

    @Test
    void unknownUserIsDenied() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();

            login(client, "mallory", "pw");

            assertEquals(PacketType.ACC_DENIED, client.receiveTag());
            client.close();
        }
    }

    @Test
    void pingThenQuit() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();
            login(client, "bob", "secret");
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());

            assertPong(client);
            client.send(PacketType.COMMAND, Command.QUIT);

            assertEquals(PacketType.OK, client.receiveTag());
            assertThrows(EOFException.class, client::receiveTag);
            client.close();
        }
    }

    @Test
    void queryResultsAndFailures() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();
            login(client, "alice", "pw");
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());

            client.send(PacketType.COMMAND, Command.query("ok"));
            assertEquals(PacketType.RESPONSE, client.receiveTag());
            assertEquals(ONE, client.receive(ResultSet.class));

            client.send(PacketType.COMMAND, Command.query("bad"));
            assertError(client, ClientErrMsg.QUERY_FAILED, "syntax error");

            // 执行器内部错误不会结束连接
            client.send(PacketType.COMMAND, Command.query("boom"));
            assertError(client, ClientErrMsg.UNKNOWN, "internal server error");

            assertPong(client);
            client.close();
        }
    }

    @Test
    void unexpectedPacketWhileServingIsReportedAndSkipped() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();
            login(client, "alice", "pw");
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());

            client.send(PacketType.OK);
            assertError(client, ClientErrMsg.UNEXPECTED_PACKET, "expected COMMAND but received OK");

            // 负载会被完整读掉，下一个数据包仍然对齐
            client.send(PacketType.GREET, new Greeting(1, "not a command"));
            assertError(client, ClientErrMsg.UNEXPECTED_PACKET, "expected COMMAND but received GREET");

            client.send(PacketType.LOGIN, new Login("alice", "pw"));
            assertError(client, ClientErrMsg.UNEXPECTED_PACKET, "expected COMMAND but received LOGIN");

            assertPong(client);
            client.close();
        }
    }

    @Test
    void firstPacketOtherThanLoginIsRejected() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();
            assertEquals(PacketType.GREET, client.receiveTag());
            client.receive(Greeting.class);

            client.send(PacketType.OK);

            assertError(client, ClientErrMsg.UNEXPECTED_PACKET, "expected LOGIN but received OK");
            assertThrows(EOFException.class, client::receiveTag);
            client.close();
        }
    }

    @Test
    void idleConnectionTimesOut() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config("\"readTimeoutMillis\": 200"), STUB)) {
            Packager client = server.rawConnect();
            login(client, "alice", "pw");
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());

            // 不发送任何命令，服务器超时后关闭连接
            assertThrows(IOException.class, client::receiveTag);
            client.close();
        }
    }

    @Test
    void strayPayloadsFromClientAreBoundedByControlLimit() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();
            login(client, "alice", "pw");
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());

            client.send(PacketType.ERROR, new ClientErrMsg(ClientErrMsg.UNKNOWN, "small"));
            assertError(client, ClientErrMsg.UNEXPECTED_PACKET, "expected COMMAND but received ERROR");
            assertPong(client);

            // 错误信息和结果集只有服务器发给客户端时才不限大小
            client.send(PacketType.ERROR, new ClientErrMsg(ClientErrMsg.UNKNOWN, Strings.repeat("e", 4 * SizeLimit.CONTROL_BOUND)));
            assertThrows(IOException.class, client::receiveTag);
            client.close();
        }
    }

    @Test
    void oversizedResultSetFromClientEndsConnection() throws Exception {
        try(RunningServer server = new RunningServer(RunningServer.config(""), STUB)) {
            Packager client = server.rawConnect();
            login(client, "alice", "pw");
            assertEquals(PacketType.ACC_GRANTED, client.receiveTag());

            ResultSet.Builder builder = ResultSet.builder().column("s", SqlType.charOf(255));
            for(int i = 0; i < 16; i++) {
                builder.row(Strings.repeat("r", 255));
            }
            client.send(PacketType.RESPONSE, builder.build(), SizeLimit.INFINITE);

            assertThrows(IOException.class, client::receiveTag);
            client.close();
        }
    }
}
