package com.spreadsheet.engine.formula;

/**
 * Thrown inside the evaluator for a token stream it cannot parse.
 * Never escapes {@link FormulaEngine}: the public entry points turn it into #ERROR!.
 */
class FormulaParseException extends RuntimeException {
    FormulaParseException(String message) {
        super(message);
    }
}
