package com.calcroom.parser;

import com.calcroom.eval.MathFunction;
import com.calcroom.model.CalculatorError;
import com.calcroom.model.CalculatorException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.calcroom.parser.Token.Type.*;


public class Tokenizer {
    private final String s;
    private final List<Token> out = new ArrayList<>();
    // one entry per open '(', true when it opened a function argument
    private final Deque<Boolean> groups = new ArrayDeque<>();
    private int functionClose = -1;
    private int i = 0;

    public Tokenizer(String s) {
        this.s = s;
    }

    /**
     * Scans the input and expands every function application, so the result only holds
     * numbers, variables, operators, parentheses and '='.
     */
    public static List<Token> lex(String input) {
        return FunctionExpander.expand(new Tokenizer(input).tokenize());
    }

    public List<Token> tokenize() {
        while (true) {
            boolean glued = !skipWhiteSpace();
            if (i >= s.length()) {
                return out;
            }

            char c = s.charAt(i);

            if (c == '(') {
                Token open = new Token(LPAREN, "(", i++);
                implicitMultiply(glued, open);
                groups.push(!out.isEmpty() && out.get(out.size() - 1).type() == FUNCTION);
                out.add(open);
                continue;
            }

            if (c == ')') {
                if (!groups.isEmpty() && groups.pop()) functionClose = out.size();
                out.add(new Token(RPAREN, ")", i++));
                continue;
            }

            Token.Type single = singleCharType(c);
            if (single != null) {
                out.add(new Token(single, String.valueOf(c), i++));
                continue;
            }

            if (isNumberStart(c)) {
                out.add(readNumber());
                continue;
            }

            if (isIdentStart(c)) {
                Token ident = readIdent();
                implicitMultiply(glued, ident);
                out.add(ident);
                continue;
            }

            throw new CalculatorException(CalculatorError.UNEXPECTED_TOKEN,
                    "Unexpected character '" + c + "' at pos " + i);
        }
    }

    private boolean skipWhiteSpace() {
        int start = i;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i > start;
    }

    // 2x, 1.5pi, 2sin(x), 3(4+1), cos(0)x, sin(0)(2), log10x
    private void implicitMultiply(boolean glued, Token next) {
        if (!glued || out.isEmpty()) return;
        Token last = out.get(out.size() - 1);
        boolean product = last.type() == NUMBER
                || (last.type() == RPAREN && functionClose == out.size() - 1)
                || (last.type() == FUNCTION && next.type() == VARIABLE && hasBase(last));
        if (product) {
            out.add(new Token(STAR, "*", next.pos()));
        }
    }

    private static boolean hasBase(Token function) {
        return function.text().length() > MathFunction.LOG.symbol().length()
                && function.text().startsWith(MathFunction.LOG.symbol());
    }

    private Token readNumber() {
        int start = i;
        int j = i;
        while (j < s.length() && isDigit(s.charAt(j))) j++;

        if (j < s.length() && s.charAt(j) == '.') {
            j++;
            while (j < s.length() && isDigit(s.charAt(j))) j++;
        }
        String num = s.substring(i, j);
        if (num.equals(".")) {
            throw new CalculatorException(CalculatorError.PARSE_ERROR, "Malformed number at pos " + start);
        }
        i = j;
        return new Token(NUMBER, num, start);
    }

    private Token readIdent() {
        int start = i;

        MathFunction fn = MathFunction.matchAt(s, i);
        if (fn != null) {
            i += fn.symbol().length();
            if (fn == MathFunction.LOG) {
                // log100 -> base 100
                int j = i;
                while (j < s.length() && isDigit(s.charAt(j))) j++;
                if (j > i && j < s.length() && s.charAt(j) == '.') {
                    j++;
                    while (j < s.length() && isDigit(s.charAt(j))) j++;
                }
                i = j;
            }
            return new Token(FUNCTION, s.substring(start, i), start);
        }

        if (s.startsWith("pi", i)) {
            i += 2;
            return Token.number(Math.PI, start);
        }

        char c = s.charAt(i++);
        if (c == 'e') {
            return Token.number(Math.E, start);
        }
        return new Token(VARIABLE, String.valueOf(c), start);
    }

    private static Token.Type singleCharType(char c) {
        switch (c) {
            case '+': return PLUS;
            case '-': return MINUS;
            case '*': return STAR;
            case '/': return SLASH;
            case '=': return EQUALS;
            default: return null;
        }
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c);
    }

    private static boolean isNumberStart(char c) {
        return isDigit(c) || c == '.';
    }

    // Character.isDigit also accepts non-ASCII digits, which Double.parseDouble rejects
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
