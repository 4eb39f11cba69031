package com.spreadsheet.engine.formula;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    @Test
    void tokenizesArithmeticWithPrecedenceMarkers() {
        List<Token> tokens = Tokenizer.tokenize("2 + 3*A1");
        assertEquals(Arrays.asList(
                new Token(TokenType.NUMBER, "2"),
                new Token(TokenType.OPERATOR, "+"),
                new Token(TokenType.NUMBER, "3"),
                new Token(TokenType.OPERATOR, "*"),
                new Token(TokenType.CELL_REF, "A1")
        ), tokens);
    }

    @Test
    void functionNamesNeedAnOpeningParen() {
        List<Token> tokens = Tokenizer.tokenize("sum(a1:b2, 1)");
        assertEquals(new Token(TokenType.FUNCTION, "SUM"), tokens.get(0));
        assertEquals(new Token(TokenType.PAREN, "("), tokens.get(1));
        assertEquals(new Token(TokenType.RANGE, "A1:B2"), tokens.get(2));
        assertEquals(new Token(TokenType.COMMA, ","), tokens.get(3));

        // without a call a built-in name is just a name
        assertEquals(new Token(TokenType.CELL_REF, "SUM"), Tokenizer.tokenize("sum").get(0));

        List<Token> spaced = Tokenizer.tokenize("SUM (A1)");
        assertEquals(new Token(TokenType.CELL_REF, "SUM"), spaced.get(0));
        assertEquals(new Token(TokenType.PAREN, "("), spaced.get(1));
        assertTrue(spaced.stream().noneMatch(t -> t.getType() == TokenType.FUNCTION));
    }

    @Test
    void combinesTwoCharacterOperators() {
        List<Token> tokens = Tokenizer.tokenize("A1<>B1>=C1<=D1");
        assertEquals("<>", tokens.get(1).getText());
        assertEquals(">=", tokens.get(3).getText());
        assertEquals("<=", tokens.get(5).getText());
        assertEquals(TokenType.OPERATOR, tokens.get(1).getType());
    }

    @Test
    void readsStringsAndBooleans() {
        List<Token> tokens = Tokenizer.tokenize("\"a, b\"&'single'&TRUE&false");
        assertEquals(new Token(TokenType.STRING, "a, b"), tokens.get(0));
        assertEquals(new Token(TokenType.STRING, "single"), tokens.get(2));
        assertEquals(new Token(TokenType.NUMBER, "1"), tokens.get(4));
        assertEquals(new Token(TokenType.NUMBER, "0"), tokens.get(6));
    }

    @Test
    void readsNumbersWithExponents() {
        List<Token> tokens = Tokenizer.tokenize("1.5e3+.25+2E-2");
        assertEquals(new Token(TokenType.NUMBER, "1.5e3"), tokens.get(0));
        assertEquals(new Token(TokenType.NUMBER, ".25"), tokens.get(2));
        assertEquals(new Token(TokenType.NUMBER, "2E-2"), tokens.get(4));
    }

    @Test
    void readsCrossSheetReferences() {
        List<Token> tokens = Tokenizer.tokenize("Data!b2+'My Sheet'!A1:A3");
        assertEquals(new Token(TokenType.CROSS_SHEET_REF, "B2", "Data"), tokens.get(0));
        assertEquals(new Token(TokenType.CROSS_SHEET_RANGE, "A1:A3", "My Sheet"), tokens.get(2));
    }

    @Test
    void notEqualIsNotASheetPrefix() {
        List<Token> tokens = Tokenizer.tokenize("A1!=B1");
        assertEquals(new Token(TokenType.CELL_REF, "A1"), tokens.get(0));
        assertEquals(new Token(TokenType.OPERATOR, "!="), tokens.get(1));
        assertEquals(new Token(TokenType.CELL_REF, "B1"), tokens.get(2));
    }

    @Test
    void skipsCharactersWithNoMeaning() {
        assertEquals(Tokenizer.tokenize("1+2"), Tokenizer.tokenize("1 + $2;"));
        assertTrue(Tokenizer.tokenize("   ").isEmpty());
    }
}
