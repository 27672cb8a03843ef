package com.calcroom.parser;

import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;
import junit.framework.TestCase;

import java.util.List;

import static com.calcroom.parser.Token.Type.*;

public class TokenizerTest extends TestCase {

    private static List<Token.Type> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private static void expectError(CalculatorError expected, String input) {
        try {
            Tokenizer.lex(input);
            fail("Expected " + expected + " for \"" + input + "\"");
        } catch (CalculatorException ex) {
            assertEquals(input, expected, ex.error());
        }
    }

    public void testOperatorsNumbersAndPositions() {
        List<Token> tokens = Tokenizer.lex("12 + x*(3.5) = .5");
        assertEquals(List.of(NUMBER, PLUS, VARIABLE, STAR, LPAREN, NUMBER, RPAREN, EQUALS, NUMBER), types(tokens));
        assertEquals(12.0, tokens.get(0).number(), 0.0);
        assertEquals(3.5, tokens.get(5).number(), 0.0);
        assertEquals(0.5, tokens.get(8).number(), 0.0);
        assertEquals(0, tokens.get(0).pos());
        assertEquals(3, tokens.get(1).pos());
        assertEquals(5, tokens.get(2).pos());
    }

    public void testWhitespaceOnlyGivesNoTokens() {
        assertTrue(Tokenizer.lex("   \t ").isEmpty());
        assertTrue(Tokenizer.lex("").isEmpty());
    }

    public void testConstantsBecomeNumbers() {
        List<Token> tokens = Tokenizer.lex("pi + e");
        assertEquals(List.of(NUMBER, PLUS, NUMBER), types(tokens));
        assertEquals(Math.PI, tokens.get(0).number(), 0.0);
        assertEquals(Math.E, tokens.get(2).number(), 0.0);
    }

    public void testImplicitMultiplication() {
        assertEquals(List.of(NUMBER, STAR, VARIABLE), types(Tokenizer.lex("2x")));
        assertEquals(List.of(NUMBER, STAR, NUMBER), types(Tokenizer.lex("1.5pi")));
        assertEquals(List.of(NUMBER, STAR, LPAREN, NUMBER, RPAREN), types(Tokenizer.lex("2(3)")));
        assertEquals(List.of(NUMBER, STAR, VARIABLE), types(Tokenizer.lex("pix")));
        assertEquals(List.of(NUMBER, STAR, VARIABLE), types(Tokenizer.lex("ex")));
    }

    public void testSeparatedNumbersAreNotJoined() {
        assertEquals(List.of(NUMBER, NUMBER, PLUS), types(Tokenizer.lex("3 4 +")));
        assertEquals(List.of(NUMBER, VARIABLE), types(Tokenizer.lex("2 x")));
    }

    public void testFunctionsAreScannedBeforeExpansion() {
        List<Token> raw = new Tokenizer("log100(10) + sinpi").tokenize();
        assertEquals(List.of(FUNCTION, LPAREN, NUMBER, RPAREN, PLUS, FUNCTION, NUMBER), types(raw));
        assertEquals("log100", raw.get(0).text());
        assertEquals("sin", raw.get(5).text());
    }

    public void testFunctionsExpandToNumbers() {
        assertEquals(1.0, Tokenizer.lex("cos(0)").get(0).number(), 0.0);
        assertEquals(1.0, Tokenizer.lex("log10").get(0).number(), 1e-12);
        assertEquals(0.5, Tokenizer.lex("log100(10)").get(0).number(), 1e-12);
        assertEquals(2.0, Tokenizer.lex("log(100)").get(0).number(), 1e-12);
        assertEquals(0.0, Tokenizer.lex("sinpi").get(0).number(), 1e-12);
        assertEquals(1.0, Tokenizer.lex("exp(0)").get(0).number(), 0.0);
        assertEquals(3.0, Tokenizer.lex("sqrt(4+5)").get(0).number(), 0.0);
        assertEquals(1.0, Tokenizer.lex("cos(sin(0))").get(0).number(), 0.0);
    }

    public void testFunctionAfterNumberIsMultiplied() {
        List<Token> tokens = Tokenizer.lex("2cos(0)");
        assertEquals(List.of(NUMBER, STAR, NUMBER), types(tokens));
        assertEquals(1.0, tokens.get(2).number(), 0.0);
    }

    public void testExpandedOutputHasNoFunctionTokens() {
        for (Token t : Tokenizer.lex("sin(pi) + ln(e) * log2(8) - abs(0 - 3)")) {
            assertFalse(t.type() == FUNCTION);
        }
    }

    public void testUnknownCharacterFailsFast() {
        expectError(CalculatorError.UNEXPECTED_TOKEN, "2 # 3");
        expectError(CalculatorError.UNEXPECTED_TOKEN, "2 ^ 3");
    }

    public void testNonAsciiDigitIsUnexpected() {
        expectError(CalculatorError.UNEXPECTED_TOKEN, "\u0663 + 1");
        expectError(CalculatorError.UNEXPECTED_TOKEN, "1\u0663");
        expectError(CalculatorError.UNEXPECTED_TOKEN, "log\u0663");
    }

    public void testFunctionResultIsMultiplied() {
        List<Token> tokens = Tokenizer.lex("cos(0)x");
        assertEquals(List.of(NUMBER, STAR, VARIABLE), types(tokens));
        assertEquals(1.0, tokens.get(0).number(), 0.0);

        assertEquals(List.of(NUMBER, STAR, LPAREN, NUMBER, RPAREN), types(Tokenizer.lex("sin(0)(2)")));
        assertEquals(List.of(NUMBER, STAR, NUMBER), types(Tokenizer.lex("cos(0)pi")));
        assertEquals(List.of(NUMBER, STAR, VARIABLE), types(Tokenizer.lex("log10x")));
        assertEquals(List.of(FUNCTION, STAR, VARIABLE), types(new Tokenizer("log10x").tokenize()));
    }

    public void testPlainGroupIsNotMultiplied() {
        assertEquals(List.of(LPAREN, NUMBER, RPAREN, VARIABLE), types(Tokenizer.lex("(2)x")));
        assertEquals(List.of(FUNCTION, LPAREN, NUMBER, RPAREN), types(new Tokenizer("log100(10)").tokenize()));
    }

    public void testLoneDecimalPoint() {
        expectError(CalculatorError.PARSE_ERROR, ". + 1");
    }

    public void testFunctionErrors() {
        expectError(CalculatorError.UNMATCHED_LEFT_PARENTHESIS, "sin(90");
        expectError(CalculatorError.PARSE_ERROR, "sin");
        expectError(CalculatorError.PARSE_ERROR, "cos + 1");
        expectError(CalculatorError.INVALID_EXPRESSION, "ln(0)");
        expectError(CalculatorError.INVALID_EXPRESSION, "sqrt(2 - 3)");
        expectError(CalculatorError.INVALID_EXPRESSION, "sin(x)");
        expectError(CalculatorError.DIVISION_BY_ZERO, "cos(1/0)");
    }
}
