package com.spreadsheet.engine.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a formula body (without the leading "=") into tokens.
 * Whitespace and characters with no meaning in a formula are skipped.
 */
public final class Tokenizer {

    private static final String OPERATOR_CHARS = "+-*/^&=<>!";

    private Tokenizer() {}

    public static List<Token> tokenize(String expr) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = expr.length();
        while (i < n) {
            char c = expr.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '(' || c == ')') {
                tokens.add(new Token(TokenType.PAREN, String.valueOf(c)));
                i++;
                continue;
            }
            if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ","));
                i++;
                continue;
            }

            // 'Sheet Name'!A1 or a single-quoted string
            if (c == '\'') {
                int close = expr.indexOf('\'', i + 1);
                int end = close < 0 ? n : close;
                String quoted = expr.substring(i + 1, end);
                i = close < 0 ? n : close + 1;
                if (i < n && expr.charAt(i) == '!') {
                    int refStart = ++i;
                    i = scanRefChars(expr, i);
                    tokens.add(crossSheetToken(quoted, expr.substring(refStart, i)));
                } else {
                    tokens.add(new Token(TokenType.STRING, quoted));
                }
                continue;
            }
            if (c == '"') {
                int close = expr.indexOf('"', i + 1);
                int end = close < 0 ? n : close;
                tokens.add(new Token(TokenType.STRING, expr.substring(i + 1, end)));
                i = close < 0 ? n : close + 1;
                continue;
            }

            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                String op = String.valueOf(c);
                i++;
                if (i < n) {
                    char next = expr.charAt(i);
                    if ((next == '=' && "<>=!".indexOf(c) >= 0) || (c == '<' && next == '>')) {
                        op += next;
                        i++;
                    }
                }
                tokens.add(new Token(TokenType.OPERATOR, op));
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(expr.charAt(i + 1)))) {
                int start = i;
                while (i < n && (Character.isDigit(expr.charAt(i)) || expr.charAt(i) == '.')) {
                    i++;
                }
                i = scanExponent(expr, i);
                tokens.add(new Token(TokenType.NUMBER, expr.substring(start, i)));
                continue;
            }

            if (isLetter(c)) {
                int start = i;
                while (i < n && isIdentifierChar(expr.charAt(i))) {
                    i++;
                }
                String id = expr.substring(start, i);
                String upper = id.toUpperCase(Locale.ROOT);

                if (i < n && expr.charAt(i) == '!' && !FunctionName.isBuiltIn(upper)
                        && !(i + 1 < n && expr.charAt(i + 1) == '=')) {
                    int refStart = ++i;
                    i = scanRefChars(expr, i);
                    tokens.add(crossSheetToken(id, expr.substring(refStart, i)));
                    continue;
                }
                if (i < n && expr.charAt(i) == ':') {
                    int secondStart = ++i;
                    while (i < n && Character.isLetterOrDigit(expr.charAt(i))) {
                        i++;
                    }
                    tokens.add(new Token(TokenType.RANGE,
                            upper + ":" + expr.substring(secondStart, i).toUpperCase(Locale.ROOT)));
                    continue;
                }
                // the paren must follow the name directly; "SUM (A1)" is a name then a group
                if (FunctionName.isBuiltIn(upper) && i < n && expr.charAt(i) == '(') {
                    tokens.add(new Token(TokenType.FUNCTION, upper));
                    continue;
                }
                if ("TRUE".equals(upper)) {
                    tokens.add(new Token(TokenType.NUMBER, "1"));
                    continue;
                }
                if ("FALSE".equals(upper)) {
                    tokens.add(new Token(TokenType.NUMBER, "0"));
                    continue;
                }
                // either a coordinate or an unknown name; the evaluator tells them apart
                tokens.add(new Token(TokenType.CELL_REF, upper));
                continue;
            }

            i++;
        }
        return tokens;
    }

    private static Token crossSheetToken(String sheetName, String ref) {
        String upper = ref.toUpperCase(Locale.ROOT);
        TokenType type = upper.contains(":") ? TokenType.CROSS_SHEET_RANGE : TokenType.CROSS_SHEET_REF;
        return new Token(type, upper, sheetName);
    }

    private static int scanRefChars(String expr, int i) {
        while (i < expr.length() && CellReferences.isRefChar(expr.charAt(i))) {
            i++;
        }
        return i;
    }

    // 1.5e10, 2E-3; a bare "e" with no digits after it is left alone
    private static int scanExponent(String expr, int i) {
        if (i >= expr.length() || (expr.charAt(i) != 'e' && expr.charAt(i) != 'E')) {
            return i;
        }
        int j = i + 1;
        if (j < expr.length() && (expr.charAt(j) == '+' || expr.charAt(j) == '-')) {
            j++;
        }
        if (j >= expr.length() || !Character.isDigit(expr.charAt(j))) {
            return i;
        }
        while (j < expr.length() && Character.isDigit(expr.charAt(j))) {
            j++;
        }
        return j;
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isIdentifierChar(char c) {
        return isLetter(c) || (c >= '0' && c <= '9') || c == '_';
    }
}
