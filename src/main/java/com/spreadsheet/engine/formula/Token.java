package com.spreadsheet.engine.formula;

import java.util.Objects;

/**
 * One lexical unit of a formula. Cross-sheet tokens carry the sheet name
 * separately; their text is the upper-cased reference or range.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final String sheetName;

    public Token(TokenType type, String text) {
        this(type, text, null);
    }

    public Token(TokenType type, String text, String sheetName) {
        this.type = type;
        this.text = text;
        this.sheetName = sheetName;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getSheetName() {
        return sheetName;
    }

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return type == token.type && text.equals(token.text) && Objects.equals(sheetName, token.sheetName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, sheetName);
    }

    @Override
    public String toString() {
        return sheetName == null ? type + "(" + text + ")" : type + "(" + sheetName + "!" + text + ")";
    }
}
