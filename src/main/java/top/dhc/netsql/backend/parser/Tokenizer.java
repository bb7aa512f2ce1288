// Tokenizer 把查询语句切分成标记（token），供 LiteralSelectExecutor 使用。
// 标记分为：符号、带引号的字符串（保留引号，便于和普通单词区分）、由字母数字下划线组成的单词。

package top.dhc.netsql.backend.parser;

import top.dhc.netsql.common.Error;

public class Tokenizer {
    // 要切分的语句
    private final String stat;
    // 当前读取的位置
    private int pos;
    // 当前的标记
    private String currentToken;
    // 是否需要读取下一个标记
    private boolean flushToken;
    // 出现过的错误，出错之后不再继续切分
    private RuntimeException err;

    public Tokenizer(String stat) {
        this.stat = stat;
        this.pos = 0;
        this.currentToken = "";
        this.flushToken = true;
    }

    // peek() 方法：查看当前标记但不消费，语句结束时返回空字符串。
    public String peek() {
        if(err != null) {
            throw err;
        }
        if(flushToken) {
            String token;
            try {
                token = next();
            } catch(RuntimeException e) {
                err = e;
                throw e;
            }
            currentToken = token;
            flushToken = false;
        }
        return currentToken;
    }

    // pop() 方法：当前标记已处理。
    public void pop() {
        flushToken = true;
    }

    // errStat() 方法：在当前位置插入 "<< " 标出出错的地方。
    public String errStat() {
        return stat.substring(0, pos) + "<< " + stat.substring(pos);
    }

    private void popChar() {
        pos ++;
        if(pos > stat.length()) {
            pos = stat.length();
        }
    }

    private Character peekChar() {
        if(pos == stat.length()) {
            return null;
        }
        return stat.charAt(pos);
    }

    private String next() {
        while(true) {
            Character c = peekChar();
            if(c == null) {
                return "";
            }
            if(!isBlank(c)) {
                break;
            }
            popChar();
        }
        char c = peekChar();
        if(isSymbol(c)) {
            popChar();
            return String.valueOf(c);
        } else if(c == '"' || c == '\'') {
            return nextQuoteState();
        } else if(isAlphaBeta(c) || isDigit(c)) {
            return nextTokenState();
        } else {
            throw Error.InvalidCommandException;
        }
    }

    private String nextTokenState() {
        StringBuilder sb = new StringBuilder();
        while(true) {
            Character c = peekChar();
            if(c == null || !(isAlphaBeta(c) || isDigit(c) || c == '_')) {
                return sb.toString();
            }
            sb.append(c);
            popChar();
        }
    }

    // nextQuoteState() 方法：读取引号包围的字符串，返回值包含两侧的引号。
    private String nextQuoteState() {
        char quote = peekChar();
        popChar();
        StringBuilder sb = new StringBuilder().append(quote);
        while(true) {
            Character c = peekChar();
            if(c == null) {
                // 没有匹配的引号
                throw Error.InvalidCommandException;
            }
            popChar();
            sb.append(c);
            if(c == quote) {
                return sb.toString();
            }
        }
    }

    static boolean isDigit(char c) {
        return (c >= '0' && c <= '9');
    }

    static boolean isAlphaBeta(char c) {
        return ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'));
    }

    static boolean isSymbol(char c) {
        return (c == '>' || c == '<' || c == '=' || c == '*' ||
                c == ',' || c == '(' || c == ')' || c == '-' || c == ';');
    }

    static boolean isBlank(char c) {
        return (c == '\n' || c == ' ' || c == '\t' || c == '\r');
    }
}
