package top.dhc.netsql.client;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * 客户端启动器
 *
 * 用法：launcher -user NAME -password PASS [-host 127.0.0.1] [-port 4242] [-timeout ms]
 */
public class Launcher {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 4242;

    public static void main(String[] args) throws IOException {
        Options options = new Options();
        options.addOption("host", true, "-host 127.0.0.1");
        options.addOption("port", true, "-port 4242");
        options.addOption(Option.builder("user").hasArg().required().desc("-user NAME").build());
        options.addOption(Option.builder("password").hasArg().required().desc("-password PASS").build());
        options.addOption("timeout", true, "-timeout MILLIS (0 waits forever)");
        options.addOption("help", false, "print this message");

        CommandLine cmd;
        ConnectOptions connectOptions;
        int port;
        try {
            cmd = new DefaultParser().parse(options, args);
            port = Integer.parseInt(cmd.getOptionValue("port", String.valueOf(DEFAULT_PORT)));
            int timeout = Integer.parseInt(cmd.getOptionValue("timeout", "0"));
            connectOptions = ConnectOptions.builder()
                .connectTimeoutMillis(timeout)
                .readTimeoutMillis(timeout)
                .build();
        } catch(ParseException | IllegalArgumentException e) {
            System.out.println(e.getMessage());
            new HelpFormatter().printHelp("launcher", options);
            return;
        }
        if(cmd.hasOption("help")) {
            new HelpFormatter().printHelp("launcher", options);
            return;
        }

        Connection conn;
        try {
            conn = Connection.connect(cmd.getOptionValue("host", DEFAULT_HOST), port,
                cmd.getOptionValue("user"), cmd.getOptionValue("password"), connectOptions);
        } catch(ConnectionException e) {
            System.out.println("[" + e.getKind() + "] " + e.getMessage());
            return;
        }
        System.out.println(conn.getMessage());

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new Shell(conn, in, System.out).run();
    }
}
