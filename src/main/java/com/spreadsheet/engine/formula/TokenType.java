package com.spreadsheet.engine.formula;

public enum TokenType {
    NUMBER,
    STRING,
    CELL_REF,
    RANGE,
    CROSS_SHEET_REF,
    CROSS_SHEET_RANGE,
    FUNCTION,
    OPERATOR,
    PAREN,
    COMMA
}
