package com.postfixspin.render;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.postfixspin.text.SourceLexer;
import com.postfixspin.text.TokenGroup;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TokenPrinterTest {
    private final SourceLexer lexer = new SourceLexer();
    private final TokenPrinter printer = new TokenPrinter();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '`', value = {
        "let   y=f( a,b );|let y = f(a, b);",
        "match x {A=>1,B=>2}|match x { A => 1, B => 2 }",
        "a . b ( ) ?|a.b()?",
        "println ! ( \"x\" )|println!(\"x\")",
        "std :: mem :: take(v)|std::mem::take(v)",
        "if (a) {}|if (a) {}",
        "'outer : loop {}|'outer: loop {}",
        "&mut *x|& mut * x"
    })
    void testPrintsCanonicalSpacing(String source, String expected) {
        assertEquals(expected, printer.print(lexer.tokenize(source)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "x: ::std::vec::Vec<u8> = a..b;",
        "a - -b; c < <d as T>::x; e = !!f;",
        "v[0].0 = r#\"}\"# ;",
        "'a: { break 'a 1_u32 }"
    })
    void testReprintedSourceLexesToSameTree(String source) {
        TokenGroup original = lexer.tokenize(source);
        String printed = printer.print(original);
        assertEquals(printed, printer.print(lexer.tokenize(printed)));
        assertEquals(texts(original), texts(lexer.tokenize(printed)));
    }

    private String texts(TokenGroup group) {
        StringBuilder builder = new StringBuilder();
        group.children().forEach(child -> builder.append(child instanceof TokenGroup nested
                ? nested.delimiter().open() + texts(nested) + nested.delimiter().close()
                : child.toString()).append('|'));
        return builder.toString();
    }
}
