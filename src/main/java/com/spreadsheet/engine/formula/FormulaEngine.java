package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.ArrayResult;
import com.spreadsheet.engine.models.FormulaError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Public entry points of the formula language.
 *
 * Evaluation never throws: errors are returned as sentinel values such as
 * {@code #DIV/0!}, and anything the evaluator cannot make sense of becomes
 * {@code #ERROR!}.
 */
public final class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private FormulaEngine() {}

    /**
     * Shape test for error values: starts with "#" and ends with "!" or "?".
     * "#N/A" does not match.
     */
    public static boolean isFormulaError(String value) {
        return FormulaError.matchesErrorShape(value);
    }

    /** Display text of a number: "14", "2.5", "0.30000000000000004", "1e+21". */
    public static String formatNumber(double value) {
        return Values.format(value);
    }

    public static boolean isArrayFormula(String formula) {
        return formula != null && formula.startsWith("{=") && formula.endsWith("}");
    }

    /** "{=SEQUENCE(3)}" becomes "=SEQUENCE(3)"; other text is returned unchanged. */
    public static String stripArrayBraces(String formula) {
        if (isArrayFormula(formula)) {
            return "=" + formula.substring(2, formula.length() - 1);
        }
        return formula;
    }

    /** True when the formula calls NOW, TODAY, RAND or RANDBETWEEN. */
    public static boolean isVolatile(String formula) {
        if (formula == null) {
            return false;
        }
        for (Token token : Tokenizer.tokenize(body(formula))) {
            if (token.getType() == TokenType.FUNCTION) {
                FunctionName fn = FunctionName.lookup(token.getText());
                if (fn != null && fn.isVolatile()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Substitutes named ranges textually, longest names first so that
     * "SalesTotal" wins over "Sales". Matching is case-insensitive and only
     * on whole identifiers; a sheet qualifier on the range is dropped.
     */
    public static String resolveNamedRanges(String formula, Map<String, String> namedRanges) {
        if (formula == null || namedRanges == null || namedRanges.isEmpty()) {
            return formula;
        }
        List<String> names = new ArrayList<>(namedRanges.keySet());
        names.sort((a, b) -> Integer.compare(b.length(), a.length()));

        String resolved = formula;
        for (String name : names) {
            if (name == null || name.isEmpty()) {
                continue;
            }
            String range = namedRanges.get(name);
            if (range == null) {
                continue;
            }
            int bang = range.lastIndexOf('!');
            String target = bang >= 0 ? range.substring(bang + 1) : range;
            Pattern pattern = Pattern.compile(
                    "(?<![A-Za-z0-9_])" + Pattern.quote(name) + "(?![A-Za-z0-9_])",
                    Pattern.CASE_INSENSITIVE);
            resolved = pattern.matcher(resolved).replaceAll(Matcher.quoteReplacement(target));
        }
        return resolved;
    }

    public static String evaluateFormula(String formula, CellGetter get) {
        return evaluateFormula(formula, get, EvaluationContext.EMPTY);
    }

    public static String evaluateFormula(String formula, CellGetter get,
                                         Map<String, String> namedRanges, CrossSheetGetter crossSheetGet) {
        return evaluateFormula(formula, get, new EvaluationContext(namedRanges, crossSheetGet));
    }

    /**
     * Evaluates "=expr" (the "=" is optional) to its display string.
     */
    public static String evaluateFormula(String formula, CellGetter get, EvaluationContext context) {
        try {
            List<Token> tokens = Tokenizer.tokenize(resolveNamedRanges(body(formula), context.getNamedRanges()));
            return Values.toText(new Evaluator(tokens, get, context).evaluate());
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Formula '{}' failed to evaluate: {}", formula, e.toString());
            return FormulaError.ERROR.text();
        }
    }

    public static ArrayResult evaluateArrayFormula(String formula, String sourceCell, CellGetter get) {
        return evaluateArrayFormula(formula, sourceCell, get, EvaluationContext.EMPTY);
    }

    public static ArrayResult evaluateArrayFormula(String formula, String sourceCell, CellGetter get,
                                                   Map<String, String> namedRanges, CrossSheetGetter crossSheetGet) {
        return evaluateArrayFormula(formula, sourceCell, get, new EvaluationContext(namedRanges, crossSheetGet));
    }

    /**
     * Evaluates an array formula ("{=...}" or "=...") to a grid anchored at
     * {@code sourceCell}. Never throws; a failure is the 1x1 grid #ERROR!.
     */
    public static ArrayResult evaluateArrayFormula(String formula, String sourceCell, CellGetter get,
                                                   EvaluationContext context) {
        try {
            List<Token> tokens = Tokenizer.tokenize(resolveNamedRanges(body(formula), context.getNamedRanges()));
            return new ArrayResult(new Evaluator(tokens, get, context).evaluateGrid(), sourceCell);
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Array formula '{}' at {} failed to evaluate: {}", formula, sourceCell, e.toString());
            return ArrayResult.single(FormulaError.ERROR.text(), sourceCell);
        }
    }

    private static String body(String formula) {
        String stripped = stripArrayBraces(formula);
        return stripped.startsWith("=") ? stripped.substring(1) : stripped;
    }
}
