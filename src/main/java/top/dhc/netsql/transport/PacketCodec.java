package top.dhc.netsql.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;

import top.dhc.netsql.transport.message.ClientErrMsg;
import top.dhc.netsql.transport.message.Column;
import top.dhc.netsql.transport.message.Command;
import top.dhc.netsql.transport.message.Greeting;
import top.dhc.netsql.transport.message.Login;
import top.dhc.netsql.transport.message.PacketType;
import top.dhc.netsql.transport.message.Payload;
import top.dhc.netsql.transport.message.PayloadKind;
import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

/**
 * 数据包编解码器（PacketCodec）
 *
 * 职责：
 * 把类型标记和各种负载转换成字节，或从字节流中读出来。
 *
 * 编码规则（全部大端）：
 * - 标记：1 字节类型值
 * - 字符串：u64 长度 + UTF-8 字节
 * - Greeting：u8 版本 + 字符串
 * - Login：用户名 + 密码
 * - Command：1 字节种类，Query 再跟一个字符串
 * - ClientErrMsg：u16 错误码 + 字符串
 * - ResultSet：u64 列数 + 每列（名称、1 字节类型、CHAR 再跟 1 字节长度）+ u64 行数 + 每行（u64 长度 + 字节）
 *
 * 解码时每次读取前都先检查大小限制，只读取当前值需要的字节，不会预读。
 * 值读到一半数据流结束、格式错误、超过限制都抛出 DecodeException；
 * 其它 IOException（包括在标记之前连接被关闭）说明连接本身出了问题，原样抛出。
 */
public class PacketCodec {

    /**
     * 编码类型标记
     */
    public byte[] encodeTag(PacketType type) {
        return new byte[]{(byte) type.getCode()};
    }

    /**
     * 编码负载
     *
     * @throws EncodeException 如果编码后的长度超过限制
     */
    public byte[] encode(Payload payload, SizeLimit limit) throws EncodeException {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        switch(payload.kind()) {
            case GREETING:
                Greeting greeting = (Greeting) payload;
                out.writeByte(greeting.getProtocolVersion());
                writeString(out, greeting.getMessage());
                break;
            case LOGIN:
                Login login = (Login) payload;
                writeString(out, login.getUsername());
                writeString(out, login.getPassword());
                break;
            case COMMAND:
                Command command = (Command) payload;
                out.writeByte(command.getType().getCode());
                if(command.getType() == Command.Type.QUERY) {
                    writeString(out, command.getQuery());
                }
                break;
            case ERROR:
                ClientErrMsg err = (ClientErrMsg) payload;
                out.writeShort(err.getCode());
                writeString(out, err.getMsg());
                break;
            case RESULT_SET:
                writeResultSet(out, (ResultSet) payload);
                break;
            default:
                throw new IllegalArgumentException("Nothing to encode for " + payload.kind());
        }
        byte[] data = out.toByteArray();
        if(!limit.allows(data.length)) {
            throw new EncodeException(payload.kind() + " of " + data.length + " bytes exceeds size limit " + limit);
        }
        return data;
    }

    /**
     * 读取一个类型标记
     *
     * @throws EOFException 如果对端在两个数据包之间关闭了连接
     */
    public PacketType decodeTag(InputStream in) throws IOException, DecodeException {
        int code = in.read();
        if(code < 0) {
            throw new EOFException("Connection closed by peer");
        }
        PacketType type = PacketType.fromCode(code);
        if(type == null) {
            throw new DecodeException("Unknown packet tag: " + code);
        }
        return type;
    }

    public <T extends Payload> T decode(Class<T> type, InputStream in, SizeLimit limit) throws IOException, DecodeException {
        return type.cast(decode(PayloadKind.of(type), in, limit));
    }

    /**
     * 读取一个指定种类的负载
     *
     * @return 解码出的负载，NONE 返回 null
     */
    public Payload decode(PayloadKind kind, InputStream in, SizeLimit limit) throws IOException, DecodeException {
        BoundedReader r = new BoundedReader(in, limit);
        switch(kind) {
            case NONE:
                return null;
            case GREETING:
                int version = r.u8();
                return new Greeting(version, r.string());
            case LOGIN:
                String username = r.string();
                return new Login(username, r.string());
            case COMMAND:
                return readCommand(r);
            case ERROR:
                int code = r.u16();
                return new ClientErrMsg(code, r.string());
            case RESULT_SET:
                return readResultSet(r);
            default:
                throw new IllegalArgumentException("Unknown payload kind: " + kind);
        }
    }

    private Command readCommand(BoundedReader r) throws IOException, DecodeException {
        int code = r.u8();
        Command.Type type = Command.Type.fromCode(code);
        if(type == null) {
            throw new DecodeException("Unknown command: " + code);
        }
        switch(type) {
            case PING:
                return Command.PING;
            case QUIT:
                return Command.QUIT;
            default:
                return Command.query(r.string());
        }
    }

    private void writeResultSet(ByteArrayDataOutput out, ResultSet rs) {
        out.writeLong(rs.getColumns().size());
        for(Column c : rs.getColumns()) {
            writeString(out, c.getName());
            SqlType type = c.getType();
            out.writeByte(type.getKind().getCode());
            if(type.getKind() == SqlType.Kind.CHAR) {
                out.writeByte(type.getSize());
            }
        }
        out.writeLong(rs.rowCount());
        for(byte[] row : rs.getRows()) {
            out.writeLong(row.length);
            out.write(row);
        }
    }

    private ResultSet readResultSet(BoundedReader r) throws IOException, DecodeException {
        long columnCount = r.u64();
        List<Column> columns = new ArrayList<>();
        for(long i = 0; i < columnCount; i++) {
            String name = r.string();
            int code = r.u8();
            SqlType.Kind kind = SqlType.Kind.fromCode(code);
            if(kind == null) {
                throw new DecodeException("Unknown column type: " + code);
            }
            SqlType type;
            switch(kind) {
                case INT:
                    type = SqlType.INT;
                    break;
                case BOOL:
                    type = SqlType.BOOL;
                    break;
                default:
                    int length = r.u8();
                    if(length < 1) {
                        throw new DecodeException("Invalid char length: " + length);
                    }
                    type = SqlType.charOf(length);
            }
            columns.add(new Column(name, type));
        }
        long rowCount = r.u64();
        List<byte[]> rows = new ArrayList<>();
        for(long i = 0; i < rowCount; i++) {
            rows.add(r.bytes(r.u64()));
        }
        try {
            return new ResultSet(columns, rows);
        } catch(IllegalArgumentException e) {
            throw new DecodeException("Malformed result set: " + e.getMessage(), e);
        }
    }

    private static void writeString(ByteArrayDataOutput out, String s) {
        byte[] raw = s.getBytes(StandardCharsets.UTF_8);
        out.writeLong(raw.length);
        out.write(raw);
    }

    /**
     * 按大小限制读取一个值，记录已经消耗的字节数
     */
    private static final class BoundedReader {
        // 超过这个长度时边读边扩容，不按声明的长度一次性分配
        private static final int EAGER_ALLOCATION = 64 * 1024;

        private final InputStream in;
        private final SizeLimit limit;
        // 当前值已经读取（预留）的字节数
        private long consumed;

        BoundedReader(InputStream in, SizeLimit limit) {
            this.in = in;
            this.limit = limit;
        }

        int u8() throws IOException, DecodeException {
            reserve(1);
            int b = in.read();
            if(b < 0) {
                throw truncated();
            }
            return b;
        }

        int u16() throws IOException, DecodeException {
            return Shorts.fromByteArray(bytes(2)) & 0xFFFF;
        }

        long u64() throws IOException, DecodeException {
            return Longs.fromByteArray(bytes(8));
        }

        String string() throws IOException, DecodeException {
            byte[] raw = bytes(u64());
            try {
                return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(raw)).toString();
            } catch(CharacterCodingException e) {
                throw new DecodeException("Invalid UTF-8 string", e);
            }
        }

        byte[] bytes(long n) throws IOException, DecodeException {
            if(n < 0 || n > Integer.MAX_VALUE - 8) {
                throw new DecodeException("Invalid length: " + n);
            }
            reserve(n);
            byte[] buf;
            if(n <= EAGER_ALLOCATION) {
                buf = new byte[(int) n];
                int read = ByteStreams.read(in, buf, 0, buf.length);
                if(read < n) {
                    throw truncated();
                }
            } else {
                buf = ByteStreams.toByteArray(ByteStreams.limit(in, n));
                if(buf.length < n) {
                    throw truncated();
                }
            }
            return buf;
        }

        private void reserve(long n) throws DecodeException {
            if(!limit.allows(consumed + n)) {
                throw new DecodeException("Size limit " + limit + " exceeded");
            }
            consumed += n;
        }

        private DecodeException truncated() {
            return new DecodeException("Unexpected end of stream");
        }
    }
}
