package top.dhc.netsql.backend.server;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import top.dhc.netsql.backend.parser.Tokenizer;
import top.dhc.netsql.transport.message.ResultSet;
import top.dhc.netsql.transport.message.SqlType;

/**
 * 只计算常量的查询执行器
 *
 * 支持的语句：
 * <pre>
 *   SELECT item [, item ...] [;]
 *   item := literal [AS name]
 *   literal := [-]整数 | '字符串' | "字符串" | true | false
 * </pre>
 * 结果总是一行；列名为别名，没有别名时为常量的原文。
 * 其余语句都以 "syntax error" 失败，CREATE、INSERT 等已知关键字报告为不支持。
 */
public class LiteralSelectExecutor implements QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(LiteralSelectExecutor.class);

    public static final String SYNTAX_ERROR = "syntax error";

    private static final String[] UNSUPPORTED = {
        "create", "drop", "alter", "insert", "update", "delete", "begin", "commit", "abort", "show"
    };

    @Override
    public ResultSet execute(String query) throws QueryException {
        log.debug("Execute: {}", query);
        Tokenizer tokenizer = new Tokenizer(query);
        try {
            return select(tokenizer);
        } catch(RuntimeException e) {
            // 词法错误
            log.debug("Invalid statement: {}", tokenizer.errStat());
            throw new QueryException(SYNTAX_ERROR, e);
        }
    }

    private ResultSet select(Tokenizer tokenizer) throws QueryException {
        String keyword = tokenizer.peek();
        if("".equals(keyword)) {
            throw new QueryException("empty query");
        }
        if(!"select".equalsIgnoreCase(keyword)) {
            for(String k : UNSUPPORTED) {
                if(k.equalsIgnoreCase(keyword)) {
                    throw new QueryException("unsupported statement: " + keyword.toUpperCase());
                }
            }
            throw new QueryException(SYNTAX_ERROR);
        }
        tokenizer.pop();

        ResultSet.Builder builder = ResultSet.builder();
        List<Object> values = new ArrayList<>();
        while(true) {
            String text = tokenizer.peek();
            Object value = literal(tokenizer);
            String name = text;
            if(value instanceof Integer && (Integer) value < 0) {
                name = String.valueOf(value);
            }
            if("as".equalsIgnoreCase(tokenizer.peek())) {
                tokenizer.pop();
                name = tokenizer.peek();
                if(!isName(name)) {
                    throw new QueryException(SYNTAX_ERROR);
                }
                tokenizer.pop();
            }
            builder.column(name, typeOf(value));
            values.add(value);

            String next = tokenizer.peek();
            if(",".equals(next)) {
                tokenizer.pop();
                continue;
            }
            if(";".equals(next)) {
                tokenizer.pop();
                next = tokenizer.peek();
            }
            if(!"".equals(next)) {
                throw new QueryException(SYNTAX_ERROR);
            }
            break;
        }
        return builder.row(values.toArray()).build();
    }

    private Object literal(Tokenizer tokenizer) throws QueryException {
        String token = tokenizer.peek();
        tokenizer.pop();
        boolean negative = false;
        if("-".equals(token)) {
            negative = true;
            token = tokenizer.peek();
            tokenizer.pop();
        }
        if(isNumber(token)) {
            try {
                return Integer.parseInt(negative ? "-" + token : token);
            } catch(NumberFormatException e) {
                throw new QueryException("integer out of range: " + token, e);
            }
        }
        if(negative) {
            throw new QueryException(SYNTAX_ERROR);
        }
        if("true".equalsIgnoreCase(token) || "false".equalsIgnoreCase(token)) {
            return Boolean.parseBoolean(token.toLowerCase());
        }
        if(token.length() >= 2 && (token.charAt(0) == '\'' || token.charAt(0) == '"')) {
            String s = token.substring(1, token.length() - 1);
            if(s.getBytes(StandardCharsets.UTF_8).length > SqlType.MAX_CHAR_LENGTH) {
                throw new QueryException("string literal too long");
            }
            return s;
        }
        throw new QueryException(SYNTAX_ERROR);
    }

    private static SqlType typeOf(Object value) {
        if(value instanceof Integer) {
            return SqlType.INT;
        }
        if(value instanceof Boolean) {
            return SqlType.BOOL;
        }
        int length = ((String) value).getBytes(StandardCharsets.UTF_8).length;
        return SqlType.charOf(Math.max(1, length));
    }

    private static boolean isNumber(String token) {
        if(token.isEmpty()) {
            return false;
        }
        for(int i = 0; i < token.length(); i++) {
            if(token.charAt(i) < '0' || token.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private static boolean isName(String token) {
        return !token.isEmpty() && Character.isLetter(token.charAt(0)) && token.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    }
}
