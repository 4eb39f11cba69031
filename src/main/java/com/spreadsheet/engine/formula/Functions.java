package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.FormulaError;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.*;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Built-in function table. Every {@link FunctionName} has exactly one case
 * below; adding a name without an implementation does not compile.
 */
final class Functions {

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private Functions() {}

    static Object call(FunctionName fn, Arguments args) {
        return switch (fn) {
            // aggregate
            case SUM -> aggregate(args, Functions::sum);
            case AVERAGE -> aggregate(args, v -> v.isEmpty() ? 0.0 : sum(v) / v.size());
            case COUNT -> (double) numbers(args).values.size();
            case MIN -> aggregate(args, v -> v.isEmpty() ? 0.0 : Collections.min(v));
            case MAX -> aggregate(args, v -> v.isEmpty() ? 0.0 : Collections.max(v));
            case MEDIAN -> aggregate(args, Functions::median);
            case STDEV -> aggregate(args, v -> v.size() < 2 ? FormulaError.DIV0.text() : Math.sqrt(variance(v)));
            case VAR -> aggregate(args, v -> v.size() < 2 ? FormulaError.DIV0.text() : variance(v));
            case LARGE -> kth(args, true);
            case SMALL -> kth(args, false);
            case RANK -> rank(args);
            // math
            case ABS -> unary(args, Math::abs);
            case ROUND -> round(args);
            case CEILING -> step(args, true);
            case FLOOR -> step(args, false);
            case MOD -> mod(args);
            case POWER -> binary(args, Math::pow);
            case SQRT -> unary(args, Math::sqrt);
            case LOG -> args.has(1)
                    ? binary(args, (x, base) -> Math.log(x) / Math.log(base))
                    : unary(args, Math::log10);
            case LN -> unary(args, Math::log);
            case PI -> Math.PI;
            case RAND -> ThreadLocalRandom.current().nextDouble();
            case RANDBETWEEN -> binary(args, (lo, hi) ->
                    Math.floor(ThreadLocalRandom.current().nextDouble() * (hi - lo + 1)) + lo);
            // text
            case LEFT -> left(args);
            case RIGHT -> right(args);
            case MID -> mid(args);
            case LEN -> text(args, s -> (double) s.length());
            case TRIM -> text(args, String::trim);
            case UPPER -> text(args, s -> s.toUpperCase(Locale.ROOT));
            case LOWER -> text(args, s -> s.toLowerCase(Locale.ROOT));
            case PROPER -> text(args, Functions::proper);
            case FIND -> find(args);
            case SUBSTITUTE -> substitute(args);
            case TEXT -> TextFormat.format(args);
            case CONCATENATE -> concatenate(args);
            // logic
            case IF -> conditional(args);
            case AND -> logical(args, true);
            case OR -> logical(args, false);
            case NOT -> {
                Object value = args.scalar(0);
                yield Values.isError(value) ? value : Values.bool(!Values.isTruthy(value));
            }
            case IFERROR -> {
                Object value = args.scalar(0);
                yield Values.isErrorOrNaN(value) ? args.scalar(1) : value;
            }
            case ISBLANK -> Values.bool("".equals(args.scalar(0)));
            case ISNA -> Values.bool(FormulaError.NA.text().equals(Values.toText(args.scalar(0))));
            // lookup
            case VLOOKUP -> Lookups.vlookup(args);
            case HLOOKUP -> Lookups.hlookup(args);
            case INDEX -> Lookups.index(args);
            case MATCH -> Lookups.match(args);
            // conditional
            case COUNTIF -> Lookups.countIf(args);
            case SUMIF -> Lookups.sumIf(args, false);
            case AVERAGEIF -> Lookups.sumIf(args, true);
            case COUNTIFS -> Lookups.countIfs(args);
            case SUMIFS -> Lookups.sumIfs(args);
            // date
            case NOW -> (double) System.currentTimeMillis();
            case TODAY -> (double) toMillis(LocalDate.now().atStartOfDay(zone()));
            case DATE -> date(args);
            case YEAR -> datePart(args, z -> (double) z.getYear());
            case MONTH -> datePart(args, z -> (double) z.getMonthValue());
            case DAY -> datePart(args, z -> (double) z.getDayOfMonth());
            case DATEDIF -> dateDif(args);
            case WEEKDAY -> weekday(args);
            case EOMONTH -> endOfMonth(args);
            // array / set
            case UNIQUE, SORT, FILTER, TRANSPOSE, FLATTEN, SEQUENCE, ARRAYFORMULA, MAP ->
                    Values.fromCell(ArrayFunctions.compute(fn, args).get(0).get(0));
            case REDUCE -> ArrayFunctions.reduce(args);
        };
    }

    // ------------------------
    // Aggregates
    // ------------------------

    /** Numeric members of every argument, plus the first error met on the way. */
    private static final class Numbers {
        final List<Double> values = new ArrayList<>();
        Object error;

        void accept(Object value) {
            if (Values.isError(value)) {
                if (error == null) {
                    error = value;
                }
                return;
            }
            Double number = Values.tryNumber(value);
            if (number != null) {
                values.add(number);
            }
        }
    }

    private static Numbers numbers(Arguments args) {
        Numbers numbers = new Numbers();
        for (Object arg : args.all()) {
            collect(numbers, arg);
        }
        return numbers;
    }

    private static void collect(Numbers numbers, Object arg) {
        if (arg instanceof RangeValues) {
            for (String raw : ((RangeValues) arg).getValues()) {
                numbers.accept(raw);
            }
        } else {
            numbers.accept(arg);
        }
    }

    private interface Reducer {
        Object apply(List<Double> values);
    }

    private static Object aggregate(Arguments args, Reducer reducer) {
        Numbers numbers = numbers(args);
        return numbers.error != null ? numbers.error : reducer.apply(numbers.values);
    }

    private static double sum(List<Double> values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    private static double median(List<Double> values) {
        if (values.isEmpty()) {
            return 0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 1 ? sorted.get(mid) : (sorted.get(mid - 1) + sorted.get(mid)) / 2;
    }

    // sample variance (n - 1)
    private static double variance(List<Double> values) {
        double mean = sum(values) / values.size();
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (values.size() - 1);
    }

    private static Object kth(Arguments args, boolean largest) {
        Numbers numbers = new Numbers();
        collect(numbers, args.raw(0));
        Object error = numbers.error != null ? numbers.error : args.has(1) ? errorOrNull(args.scalar(1)) : null;
        if (error != null) {
            return error;
        }
        List<Double> sorted = new ArrayList<>(numbers.values);
        sorted.sort(largest ? Comparator.<Double>reverseOrder() : Comparator.<Double>naturalOrder());
        int k = (int) Math.floor(args.number(1, 1));
        return k >= 1 && k <= sorted.size() ? sorted.get(k - 1) : 0.0;
    }

    private static Object rank(Arguments args) {
        Object value = args.scalar(0);
        Numbers numbers = new Numbers();
        collect(numbers, args.raw(1));
        Object error = Values.isError(value) ? value : numbers.error;
        if (error != null) {
            return error;
        }
        boolean ascending = args.number(2, 0) != 0;
        List<Double> sorted = new ArrayList<>(numbers.values);
        sorted.sort(ascending ? Comparator.<Double>naturalOrder() : Comparator.<Double>reverseOrder());
        return (double) (sorted.indexOf(Values.toNumber(value)) + 1);
    }

    // ------------------------
    // Math
    // ------------------------

    private interface DoubleOp {
        double apply(double x);
    }

    private interface DoubleBinaryOp {
        double apply(double x, double y);
    }

    private static Object unary(Arguments args, DoubleOp op) {
        Object error = args.firstError();
        return error != null ? error : op.apply(args.number(0, 0));
    }

    private static Object binary(Arguments args, DoubleBinaryOp op) {
        Object error = args.firstError();
        return error != null ? error : op.apply(args.number(0, 0), args.number(1, 0));
    }

    private static Object round(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        double value = args.number(0, 0);
        int digits = (int) args.number(1, 0);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    private static Object step(Arguments args, boolean up) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        double value = args.number(0, 0);
        double step = args.number(1, 1);
        if (step == 0) {
            step = 1;
        }
        return (up ? Math.ceil(value / step) : Math.floor(value / step)) * step;
    }

    private static Object mod(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        double a = args.number(0, 0);
        double b = args.number(1, 0);
        if (b == 0) {
            return FormulaError.DIV0.text();
        }
        return a - b * Math.floor(a / b);
    }

    // ------------------------
    // Text
    // ------------------------

    private interface TextOp {
        Object apply(String s);
    }

    private static Object text(Arguments args, TextOp op) {
        Object value = args.scalar(0);
        return Values.isError(value) ? value : op.apply(Values.toText(value));
    }

    private static Object left(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        String s = args.text(0, "");
        int count = (int) args.number(1, 1);
        if (count < 0) {
            return FormulaError.VALUE.text();
        }
        return s.substring(0, Math.min(count, s.length()));
    }

    private static Object right(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        String s = args.text(0, "");
        int count = (int) args.number(1, 1);
        if (count < 0) {
            return FormulaError.VALUE.text();
        }
        return s.substring(Math.max(0, s.length() - count));
    }

    private static Object mid(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        String s = args.text(0, "");
        int start = (int) args.number(1, 1);
        int length = (int) args.number(2, 1);
        if (start < 1 || length < 0) {
            return FormulaError.VALUE.text();
        }
        int from = Math.min(start - 1, s.length());
        return s.substring(from, (int) Math.min((long) from + length, s.length()));
    }

    private static String proper(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean wordStart = true;
        for (char c : s.toCharArray()) {
            boolean wordChar = Character.isLetterOrDigit(c) || c == '_';
            sb.append(wordStart && wordChar ? Character.toUpperCase(c) : c);
            wordStart = !wordChar;
        }
        return sb.toString();
    }

    private static Object find(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        String needle = args.text(0, "");
        String haystack = args.text(1, "");
        int start = (int) args.number(2, 1);
        if (start < 1) {
            return FormulaError.VALUE.text();
        }
        int index = haystack.indexOf(needle, start - 1);
        return index < 0 ? FormulaError.VALUE.text() : (Object) (double) (index + 1);
    }

    private static Object substitute(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        String text = args.text(0, "");
        String oldText = args.text(1, "");
        String newText = args.text(2, "");
        if (oldText.isEmpty()) {
            return text;
        }
        if (!args.has(3)) {
            return text.replace(oldText, newText);
        }
        int instance = (int) args.number(3, 1);
        if (instance < 1) {
            return FormulaError.VALUE.text();
        }
        int index = -1;
        for (int i = 0; i < instance; i++) {
            index = text.indexOf(oldText, index + (i == 0 ? 1 : oldText.length()));
            if (index < 0) {
                return text;
            }
        }
        return text.substring(0, index) + newText + text.substring(index + oldText.length());
    }

    private static Object concatenate(Arguments args) {
        StringBuilder sb = new StringBuilder();
        for (Object arg : args.all()) {
            if (arg instanceof RangeValues) {
                for (String raw : ((RangeValues) arg).getValues()) {
                    if (Values.isError(raw)) {
                        return raw;
                    }
                    sb.append(Values.toText(Values.fromCell(raw)));
                }
            } else {
                if (Values.isError(arg)) {
                    return arg;
                }
                sb.append(Values.toText(arg));
            }
        }
        return sb.toString();
    }

    // ------------------------
    // Logic
    // ------------------------

    private static Object conditional(Arguments args) {
        Object condition = args.scalar(0);
        if (Values.isError(condition)) {
            return condition;
        }
        if (Values.isTruthy(condition)) {
            return args.has(1) ? args.scalar(1) : 1.0;
        }
        return args.has(2) ? args.scalar(2) : 0.0;
    }

    private static Object logical(Arguments args, boolean all) {
        boolean result = all;
        for (Object arg : args.all()) {
            List<Object> members = new ArrayList<>();
            if (arg instanceof RangeValues) {
                for (String raw : ((RangeValues) arg).getValues()) {
                    if (!raw.isEmpty()) {
                        members.add(Values.fromCell(raw));
                    }
                }
            } else {
                members.add(arg);
            }
            for (Object member : members) {
                if (Values.isError(member)) {
                    return member;
                }
                boolean truthy = Values.isTruthy(member);
                result = all ? result && truthy : result || truthy;
            }
        }
        return Values.bool(result);
    }

    // ------------------------
    // Dates (epoch milliseconds, JVM default zone)
    // ------------------------

    private interface DateField {
        double apply(ZonedDateTime dateTime);
    }

    static ZoneId zone() {
        return ZoneId.systemDefault();
    }

    static ZonedDateTime toDateTime(double millis) {
        return Instant.ofEpochMilli((long) millis).atZone(zone());
    }

    private static long toMillis(ZonedDateTime dateTime) {
        return dateTime.toInstant().toEpochMilli();
    }

    private static Object date(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        int year = (int) args.number(0, 1970);
        long month = (long) args.number(1, 1);
        long day = (long) args.number(2, 1);
        LocalDate date = LocalDate.of(year, 1, 1).plusMonths(month - 1).plusDays(day - 1);
        return (double) toMillis(date.atStartOfDay(zone()));
    }

    private static Object datePart(Arguments args, DateField field) {
        Object error = args.firstError();
        return error != null ? error : field.apply(toDateTime(args.number(0, 0)));
    }

    private static Object dateDif(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        double start = args.number(0, 0);
        double end = args.number(1, 0);
        String unit = args.text(2, "D").toUpperCase(Locale.ROOT);
        ZonedDateTime from = toDateTime(start);
        ZonedDateTime to = toDateTime(end);
        switch (unit) {
            case "M":
                return (double) ((to.getYear() - from.getYear()) * 12 + to.getMonthValue() - from.getMonthValue());
            case "Y":
                return (double) (to.getYear() - from.getYear());
            default:
                return Math.floor((end - start) / MILLIS_PER_DAY);
        }
    }

    private static Object weekday(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        // 0 = Sunday ... 6 = Saturday
        int day = toDateTime(args.number(0, 0)).getDayOfWeek().getValue() % 7;
        if (args.number(1, 1) == 2) {
            return (double) (day == 0 ? 7 : day);
        }
        return (double) (day + 1);
    }

    private static Object endOfMonth(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        ZonedDateTime shifted = toDateTime(args.number(0, 0)).plusMonths((long) args.number(1, 0));
        ZonedDateTime end = shifted.withDayOfMonth(shifted.toLocalDate().lengthOfMonth());
        return (double) toMillis(end);
    }

    private static Object errorOrNull(Object value) {
        return Values.isError(value) ? value : null;
    }
}
