package top.dhc.netsql.backend.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import top.dhc.netsql.common.Error;

import static org.junit.jupiter.api.Assertions.*;

final class TokenizerTest {

    private static List<String> tokens(String stat) {
        Tokenizer tokenizer = new Tokenizer(stat);
        List<String> result = new ArrayList<>();
        while(true) {
            String token = tokenizer.peek();
            if("".equals(token)) {
                return result;
            }
            result.add(token);
            tokenizer.pop();
        }
    }

    @Test
    void splitsWordsSymbolsAndStrings() {
        assertEquals(Arrays.asList("SELECT", "1", ",", "'a b'", ",", "\"c\"", "AS", "col_1", ";"),
            tokens("SELECT 1,'a b' ,\t\"c\" AS col_1;"));
        assertEquals(Arrays.asList("-", "42"), tokens("\n-42\r\n"));
    }

    @Test
    void peekDoesNotConsume() {
        Tokenizer tokenizer = new Tokenizer("a b");

        assertEquals("a", tokenizer.peek());
        assertEquals("a", tokenizer.peek());
        tokenizer.pop();
        assertEquals("b", tokenizer.peek());
        tokenizer.pop();
        assertEquals("", tokenizer.peek());
    }

    @Test
    void invalidCharacterIsRememberedAndMarked() {
        Tokenizer tokenizer = new Tokenizer("SELECT #");
        assertEquals("SELECT", tokenizer.peek());
        tokenizer.pop();

        assertSame(Error.InvalidCommandException, assertThrows(RuntimeException.class, tokenizer::peek));
        assertSame(Error.InvalidCommandException, assertThrows(RuntimeException.class, tokenizer::peek));
        assertEquals("SELECT << #", tokenizer.errStat());
    }

    @Test
    void unterminatedQuoteIsAnError() {
        Tokenizer tokenizer = new Tokenizer("'abc");

        assertSame(Error.InvalidCommandException, assertThrows(RuntimeException.class, tokenizer::peek));
    }
}
