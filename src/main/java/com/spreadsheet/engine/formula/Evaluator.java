package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellRef;
import com.spreadsheet.engine.models.FormulaError;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent evaluator over one token list.
 *
 * Precedence, lowest first: {@code &}, comparison, {@code + -}, {@code * /},
 * {@code ^}, unary {@code - +}, primary. Unary minus binds tighter than
 * {@code ^}, so {@code -2^2} is 4.
 *
 * Not thread-safe; create one per evaluation.
 */
final class Evaluator {

    private final List<Token> tokens;
    private final CellGetter getter;
    private final EvaluationContext context;
    private int pos;

    Evaluator(List<Token> tokens, CellGetter getter, EvaluationContext context) {
        this.tokens = tokens;
        this.getter = getter;
        this.context = context;
    }

    /** Scalar result of the whole token list. */
    Object evaluate() {
        pos = 0;
        Object value = parseExpression();
        expectEnd();
        return value;
    }

    /**
     * Grid result of the whole token list: an array-function call yields its
     * grid, {@code range op range} and {@code range op scalar} are computed
     * element-wise, anything else is the scalar result as a 1x1 grid.
     */
    List<List<String>> evaluateGrid() {
        pos = 0;
        if (!tokens.isEmpty() && isArrayCall(0) && matchingParen(1) >= tokens.size() - 1) {
            List<List<String>> grid = parseArrayCall();
            expectEnd();
            return grid;
        }
        if (isElementWise()) {
            return elementWise(tokens.get(0), tokens.get(1).getText(), tokens.get(2));
        }
        return ArrayFunctions.single(Values.toText(evaluate()));
    }

    // ------------------------
    // Expression grammar
    // ------------------------

    private Object parseExpression() {
        Object left = parseComparison();
        while (peekOperator("&")) {
            pos++;
            left = Operators.concat(left, parseComparison());
        }
        return left;
    }

    private Object parseComparison() {
        Object left = parseAdditive();
        while (peekType(TokenType.OPERATOR) && Operators.isComparison(peek().getText())) {
            String op = next().getText();
            left = Operators.compare(op, left, parseAdditive());
        }
        return left;
    }

    private Object parseAdditive() {
        Object left = parseMultiplicative();
        while (peekOperator("+") || peekOperator("-")) {
            String op = next().getText();
            left = Operators.arithmetic(op, left, parseMultiplicative());
        }
        return left;
    }

    private Object parseMultiplicative() {
        Object left = parsePower();
        while (peekOperator("*") || peekOperator("/")) {
            String op = next().getText();
            left = Operators.arithmetic(op, left, parsePower());
        }
        return left;
    }

    private Object parsePower() {
        Object base = parseUnary();
        while (peekOperator("^")) {
            pos++;
            base = Operators.arithmetic("^", base, parseUnary());
        }
        return base;
    }

    private Object parseUnary() {
        if (peekOperator("-")) {
            pos++;
            return Operators.negate(parseUnary());
        }
        if (peekOperator("+")) {
            pos++;
            return parseUnary();
        }
        return parsePrimary();
    }

    private Object parsePrimary() {
        Token t = peek();
        if (t == null) {
            throw new FormulaParseException("Unexpected end of formula");
        }
        switch (t.getType()) {
            case NUMBER:
                pos++;
                return Double.parseDouble(t.getText());
            case STRING:
                pos++;
                return t.getText();
            case PAREN:
                if (!"(".equals(t.getText())) {
                    throw new FormulaParseException("Unexpected ')' at token " + pos);
                }
                pos++;
                Object value = parseExpression();
                if (peekParen(")")) {
                    pos++;
                }
                return value;
            case CELL_REF:
                pos++;
                return readCell(t);
            case CROSS_SHEET_REF:
                pos++;
                return readCrossSheetCell(t);
            case RANGE:
            case CROSS_SHEET_RANGE:
                pos++;
                Object range = readRange(t);
                return range instanceof RangeValues ? ((RangeValues) range).sum() : range;
            case FUNCTION:
                return parseFunctionCall();
            default:
                throw new FormulaParseException("Unexpected token " + t);
        }
    }

    private Object readCell(Token t) {
        String id = CellReferences.normalize(t.getText());
        if (id != null) {
            return Values.fromCell(getter.get(id));
        }
        // unknown name; FOO(1, 2) is an unknown function
        if (peekParen("(")) {
            pos = Math.min(matchingParen(pos) + 1, tokens.size());
        }
        return FormulaError.NAME.text();
    }

    private Object readCrossSheetCell(Token t) {
        CrossSheetGetter crossSheet = context.getCrossSheetGetter();
        String id = CellReferences.normalize(t.getText());
        if (crossSheet == null || id == null) {
            return FormulaError.REF.text();
        }
        return Values.fromCell(crossSheet.get(t.getSheetName(), id));
    }

    /** RangeValues for a same-sheet or cross-sheet range token, or #REF!. */
    private Object readRange(Token t) {
        CellRef[] corners = CellReferences.parseRange(t.getText());
        boolean crossSheet = t.getType() == TokenType.CROSS_SHEET_RANGE;
        if (!CellReferences.isWithinLimit(corners) || (crossSheet && context.getCrossSheetGetter() == null)) {
            return FormulaError.REF.text();
        }
        int rows = corners[1].getRow() - corners[0].getRow() + 1;
        int cols = corners[1].getCol() - corners[0].getCol() + 1;
        List<String> values = new ArrayList<>(rows * cols);
        for (int r = corners[0].getRow(); r <= corners[1].getRow(); r++) {
            for (int c = corners[0].getCol(); c <= corners[1].getCol(); c++) {
                String id = CellReferences.cellId(c, r);
                String raw = crossSheet ? context.getCrossSheetGetter().get(t.getSheetName(), id) : getter.get(id);
                values.add(raw == null ? "" : raw);
            }
        }
        return new RangeValues(rows, cols, values);
    }

    // ------------------------
    // Function calls
    // ------------------------

    private Object parseFunctionCall() {
        if (isArrayCall(pos)) {
            return Values.fromCell(parseArrayCall().get(0).get(0));
        }
        FunctionName fn = FunctionName.lookup(next().getText());
        if (peekParen("(")) {
            pos++;
        }
        return Functions.call(fn, parseArguments());
    }

    private List<List<String>> parseArrayCall() {
        FunctionName fn = FunctionName.lookup(next().getText());
        int open = pos;
        if (peekParen("(")) {
            pos++;
        }
        if (fn == FunctionName.ARRAYFORMULA) {
            int close = Math.min(matchingParen(open), tokens.size());
            List<Token> inner = tokens.subList(pos, close);
            pos = Math.min(close + 1, tokens.size());
            List<List<String>> grid = new Evaluator(inner, getter, context).evaluateGrid();
            List<Object> args = new ArrayList<>();
            args.add(RangeValues.fromGrid(grid));
            return ArrayFunctions.compute(fn, new Arguments(args));
        }
        return ArrayFunctions.compute(fn, parseArguments());
    }

    /** Arguments after the opening parenthesis, through the closing one. */
    private Arguments parseArguments() {
        List<Object> args = new ArrayList<>();
        if (peekParen(")")) {
            pos++;
            return new Arguments(args);
        }
        while (true) {
            args.add(parseArgument());
            Token t = peek();
            if (t == null) {
                break;
            }
            if (t.getType() == TokenType.COMMA) {
                pos++;
            } else if (t.is(TokenType.PAREN, ")")) {
                pos++;
                break;
            } else {
                throw new FormulaParseException("Unexpected token " + t + " in argument list");
            }
        }
        return new Arguments(args);
    }

    private Object parseArgument() {
        Token t = peek();
        if (t == null || isArgumentEnd(pos)) {
            return "";
        }
        if ((t.getType() == TokenType.RANGE || t.getType() == TokenType.CROSS_SHEET_RANGE) && isArgumentEnd(pos + 1)) {
            pos++;
            return readRange(t);
        }
        if (isArrayCall(pos) && isArgumentEnd(matchingParen(pos + 1) + 1)) {
            return RangeValues.fromGrid(parseArrayCall());
        }
        return parseExpression();
    }

    // ------------------------
    // Element-wise array arithmetic
    // ------------------------

    private boolean isElementWise() {
        if (tokens.size() != 3) {
            return false;
        }
        Token left = tokens.get(0);
        Token op = tokens.get(1);
        Token right = tokens.get(2);
        return op.getType() == TokenType.OPERATOR && Operators.isBinary(op.getText())
                && isOperand(left) && isOperand(right)
                && (isRangeToken(left) || isRangeToken(right));
    }

    /**
     * Same shapes combine cell by cell, a 1x1 side is broadcast, and
     * mismatched shapes produce a single column as long as the longer side,
     * with 0 for missing elements.
     */
    private List<List<String>> elementWise(Token leftToken, String op, Token rightToken) {
        RangeValues left = operandGrid(leftToken);
        RangeValues right = operandGrid(rightToken);
        List<List<String>> grid = new ArrayList<>();

        boolean sameShape = left.getRowCount() == right.getRowCount() && left.getColCount() == right.getColCount();
        if (sameShape || left.size() == 1 || right.size() == 1) {
            RangeValues shape = left.size() == 1 && !sameShape ? right : left;
            for (int r = 0; r < shape.getRowCount(); r++) {
                List<String> row = new ArrayList<>();
                for (int c = 0; c < shape.getColCount(); c++) {
                    Object l = Values.fromCell(left.size() == 1 ? left.get(0, 0) : left.get(r, c));
                    Object rv = Values.fromCell(right.size() == 1 ? right.get(0, 0) : right.get(r, c));
                    row.add(Values.toText(Operators.apply(op, l, rv)));
                }
                grid.add(row);
            }
            return grid;
        }

        List<String> lv = left.getValues();
        List<String> rvs = right.getValues();
        int length = Math.max(lv.size(), rvs.size());
        for (int i = 0; i < length; i++) {
            Object l = i < lv.size() ? Values.fromCell(lv.get(i)) : 0.0;
            Object rv = i < rvs.size() ? Values.fromCell(rvs.get(i)) : 0.0;
            List<String> row = new ArrayList<>();
            row.add(Values.toText(Operators.apply(op, l, rv)));
            grid.add(row);
        }
        return grid;
    }

    private RangeValues operandGrid(Token t) {
        if (isRangeToken(t)) {
            Object range = readRange(t);
            return range instanceof RangeValues ? (RangeValues) range : RangeValues.single(range.toString());
        }
        List<Token> single = new ArrayList<>();
        single.add(t);
        return RangeValues.single(Values.toText(new Evaluator(single, getter, context).evaluate()));
    }

    private static boolean isRangeToken(Token t) {
        return t.getType() == TokenType.RANGE || t.getType() == TokenType.CROSS_SHEET_RANGE;
    }

    private static boolean isOperand(Token t) {
        switch (t.getType()) {
            case NUMBER:
            case STRING:
            case CELL_REF:
            case CROSS_SHEET_REF:
            case RANGE:
            case CROSS_SHEET_RANGE:
                return true;
            default:
                return false;
        }
    }

    // ------------------------
    // Token helpers
    // ------------------------

    private boolean isArrayCall(int index) {
        if (index >= tokens.size() || tokens.get(index).getType() != TokenType.FUNCTION) {
            return false;
        }
        FunctionName fn = FunctionName.lookup(tokens.get(index).getText());
        return fn != null && fn.isArrayFunction();
    }

    /**
     * Index of the ")" closing the "(" at {@code open}; tokens.size() when
     * the formula ends before it closes.
     */
    private int matchingParen(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(TokenType.PAREN, "(")) {
                depth++;
            } else if (t.is(TokenType.PAREN, ")")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return tokens.size();
    }

    private boolean isArgumentEnd(int index) {
        if (index >= tokens.size()) {
            return true;
        }
        Token t = tokens.get(index);
        return t.getType() == TokenType.COMMA || t.is(TokenType.PAREN, ")");
    }

    private void expectEnd() {
        if (pos < tokens.size()) {
            throw new FormulaParseException("Unexpected token " + tokens.get(pos) + " after end of expression");
        }
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private Token next() {
        return tokens.get(pos++);
    }

    private boolean peekType(TokenType type) {
        Token t = peek();
        return t != null && t.getType() == type;
    }

    private boolean peekOperator(String op) {
        Token t = peek();
        return t != null && t.isOperator(op);
    }

    private boolean peekParen(String paren) {
        Token t = peek();
        return t != null && t.is(TokenType.PAREN, paren);
    }
}
