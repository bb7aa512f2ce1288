package top.dhc.netsql.backend;

import java.io.IOException;
import java.nio.file.Paths;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.core.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.dhc.netsql.backend.config.ServerConfig;
import top.dhc.netsql.backend.server.LiteralSelectExecutor;
import top.dhc.netsql.backend.server.Server;
import top.dhc.netsql.backend.server.StaticAuthorizer;

public class Launcher {

    public static final String DEFAULT_CONFIG = "config.json";

    /** log4j2.xml 中引用的系统属性 */
    public static final String LOG_LEVEL_PROPERTY = "netsql.log.level";
    public static final String LOG_FILE_PROPERTY = "netsql.log.file";

    public static void main(String[] args) throws IOException {
        // 定义命令行选项
        Options options = new Options();
        options.addOption("cfg", true, "-cfg config.json");
        options.addOption("address", true, "-address 127.0.0.1");
        options.addOption("port", true, "-port 4242");
        options.addOption("loglevel", true, "-loglevel info");
        options.addOption("logfile", true, "-logfile log.txt");
        options.addOption("help", false, "print this message");

        ServerConfig config;
        try {
            CommandLineParser parser = new DefaultParser();
            CommandLine cmd = parser.parse(options, args);
            if(cmd.hasOption("help")) {
                new HelpFormatter().printHelp("launcher", options);
                return;
            }
            config = loadConfig(cmd);
        } catch(ParseException | RuntimeException e) {
            System.out.println(e.getMessage());
            new HelpFormatter().printHelp("launcher", options);
            return;
        }

        configureLogging(config);
        Logger log = LoggerFactory.getLogger(Launcher.class);
        log.info("Starting netsql server...");
        log.info("{}", config);

        new Server(config, new StaticAuthorizer(config.getUsers()), new LiteralSelectExecutor()).start();
    }

    /**
     * 读取配置文件，再用命令行上给出的值覆盖
     */
    static ServerConfig loadConfig(CommandLine cmd) throws IOException {
        ServerConfig config = ServerConfig.load(Paths.get(cmd.getOptionValue("cfg", DEFAULT_CONFIG)));
        if(cmd.hasOption("address")) {
            config = config.withAddress(cmd.getOptionValue("address"));
        }
        if(cmd.hasOption("port")) {
            config = config.withPort(Integer.parseInt(cmd.getOptionValue("port")));
        }
        if(cmd.hasOption("loglevel")) {
            config = config.withLogLevel(cmd.getOptionValue("loglevel"));
        }
        if(cmd.hasOption("logfile")) {
            config = config.withLogFile(cmd.getOptionValue("logfile"));
        }
        return config;
    }

    /**
     * 把日志级别和日志文件交给 log4j2，并按新的属性重新加载配置
     */
    static void configureLogging(ServerConfig config) {
        System.setProperty(LOG_LEVEL_PROPERTY, config.getLogLevel());
        System.setProperty(LOG_FILE_PROPERTY, config.getLogFile());
        LoggerContext.getContext(false).reconfigure();
    }
}
