package com.spreadsheet.engine.formula;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of built-in functions. An identifier followed by "(" is a
 * function call only when it names one of these.
 */
public enum FunctionName {
    // aggregate
    SUM(Family.AGGREGATE),
    AVERAGE(Family.AGGREGATE),
    COUNT(Family.AGGREGATE),
    MIN(Family.AGGREGATE),
    MAX(Family.AGGREGATE),
    MEDIAN(Family.AGGREGATE),
    STDEV(Family.AGGREGATE),
    VAR(Family.AGGREGATE),
    LARGE(Family.AGGREGATE),
    SMALL(Family.AGGREGATE),
    RANK(Family.AGGREGATE),
    // math
    ABS(Family.MATH),
    ROUND(Family.MATH),
    CEILING(Family.MATH),
    FLOOR(Family.MATH),
    MOD(Family.MATH),
    POWER(Family.MATH),
    SQRT(Family.MATH),
    LOG(Family.MATH),
    LN(Family.MATH),
    PI(Family.MATH),
    RAND(Family.MATH, true),
    RANDBETWEEN(Family.MATH, true),
    // text
    LEFT(Family.TEXT),
    RIGHT(Family.TEXT),
    MID(Family.TEXT),
    LEN(Family.TEXT),
    TRIM(Family.TEXT),
    UPPER(Family.TEXT),
    LOWER(Family.TEXT),
    PROPER(Family.TEXT),
    FIND(Family.TEXT),
    SUBSTITUTE(Family.TEXT),
    TEXT(Family.TEXT),
    CONCATENATE(Family.TEXT),
    // logic
    IF(Family.LOGIC),
    AND(Family.LOGIC),
    OR(Family.LOGIC),
    NOT(Family.LOGIC),
    IFERROR(Family.LOGIC),
    ISBLANK(Family.LOGIC),
    ISNA(Family.LOGIC),
    // lookup
    VLOOKUP(Family.LOOKUP),
    HLOOKUP(Family.LOOKUP),
    INDEX(Family.LOOKUP),
    MATCH(Family.LOOKUP),
    // conditional
    COUNTIF(Family.CONDITIONAL),
    SUMIF(Family.CONDITIONAL),
    AVERAGEIF(Family.CONDITIONAL),
    COUNTIFS(Family.CONDITIONAL),
    SUMIFS(Family.CONDITIONAL),
    // date
    NOW(Family.DATE, true),
    TODAY(Family.DATE, true),
    DATE(Family.DATE),
    YEAR(Family.DATE),
    MONTH(Family.DATE),
    DAY(Family.DATE),
    DATEDIF(Family.DATE),
    WEEKDAY(Family.DATE),
    EOMONTH(Family.DATE),
    // array / set
    UNIQUE(Family.ARRAY),
    SORT(Family.ARRAY),
    FILTER(Family.ARRAY),
    TRANSPOSE(Family.ARRAY),
    FLATTEN(Family.ARRAY),
    SEQUENCE(Family.ARRAY),
    ARRAYFORMULA(Family.ARRAY),
    MAP(Family.ARRAY),
    REDUCE(Family.ARRAY);

    public enum Family {
        AGGREGATE, MATH, TEXT, LOGIC, LOOKUP, CONDITIONAL, DATE, ARRAY
    }

    private static final Map<String, FunctionName> BY_NAME = new HashMap<>();

    static {
        for (FunctionName fn : values()) {
            BY_NAME.put(fn.name(), fn);
        }
    }

    private final Family family;
    private final boolean volatileResult;

    FunctionName(Family family) {
        this(family, false);
    }

    FunctionName(Family family, boolean volatileResult) {
        this.family = family;
        this.volatileResult = volatileResult;
    }

    public Family getFamily() {
        return family;
    }

    /** NOW, TODAY, RAND and RANDBETWEEN: results change without any input changing. */
    public boolean isVolatile() {
        return volatileResult;
    }

    /** Functions that produce a grid; REDUCE folds a grid down to a scalar. */
    public boolean isArrayFunction() {
        return family == Family.ARRAY && this != REDUCE;
    }

    /** Case-insensitive lookup; null when the name is not built in. */
    public static FunctionName lookup(String name) {
        return name == null ? null : BY_NAME.get(name.toUpperCase(Locale.ROOT));
    }

    public static boolean isBuiltIn(String name) {
        return lookup(name) != null;
    }
}
