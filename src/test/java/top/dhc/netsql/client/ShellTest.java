package top.dhc.netsql.client;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import top.dhc.netsql.transport.message.ClientErrMsg;
import top.dhc.netsql.transport.message.Command;
import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

import static org.junit.jupiter.api.Assertions.*;

final class ShellTest {

    private static String run(ScriptedServer server, String input) throws Exception {
        Connection conn = Connection.connect("127.0.0.1", server.port(), "alice", "pw",
            ConnectOptions.builder().readTimeoutMillis(5000).build());
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, "UTF-8");
        new Shell(conn, new BufferedReader(new StringReader(input)), out).run();
        assertEquals(Connection.State.CLOSED, conn.getState());
        return new String(buf.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void sessionWithQueriesAndErrors() throws Exception {
        try(ScriptedServer server = new ScriptedServer(p -> {
            ScriptedServer.grant(p);
            assertEquals(PacketType.COMMAND, p.receiveTag());
            assertEquals(Command.PING, p.receive(Command.class));
            p.send(PacketType.OK);

            assertEquals(PacketType.COMMAND, p.receiveTag());
            assertEquals(Command.query("SELECT 1"), p.receive(Command.class));
            p.send(PacketType.RESPONSE, ResultSet.builder().column("1", SqlType.INT).row(1).build());

            assertEquals(PacketType.COMMAND, p.receiveTag());
            assertEquals(Command.query("BAD SQL"), p.receive(Command.class));
            p.send(PacketType.ERROR, new ClientErrMsg(ClientErrMsg.QUERY_FAILED, "syntax error"));

            assertEquals(PacketType.COMMAND, p.receiveTag());
            assertEquals(Command.QUIT, p.receive(Command.class));
            p.send(PacketType.OK);
        })) {
            String output = run(server, "ping\n\n  SELECT 1  \nBAD SQL\ninfo\nquit\nping\n");

            assertTrue(output.contains("pong"), output);
            assertTrue(output.contains("1\n-\n1\n(1 row)"), output);
            assertTrue(output.contains("[SERVER] syntax error"), output);
            assertTrue(output.contains("hello"), output);
            assertTrue(output.contains("connected to 127.0.0.1:" + server.port() + " as alice"), output);
            assertTrue(output.trim().endsWith("Bye"), output);
            server.await();
        }
    }

    @Test
    void endOfInputClosesWithoutQuit() throws Exception {
        try(ScriptedServer server = new ScriptedServer(p -> ScriptedServer.grant(p))) {
            String output = run(server, "");

            assertEquals(":> ", output);
            server.await();
        }
    }

    @Test
    void transportErrorEndsSession() throws Exception {
        try(ScriptedServer server = new ScriptedServer(p -> {
            ScriptedServer.grant(p);
            assertEquals(PacketType.COMMAND, p.receiveTag());
            p.receive(Command.class);
        })) {
            String output = run(server, "SELECT 1\nping\n");

            assertTrue(output.contains("[IO]"), output);
            assertFalse(output.contains("pong"), output);
            server.await();
        }
    }
}
