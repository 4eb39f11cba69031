package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.FormulaError;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZonedDateTime;

/**
 * TEXT(value, pattern). Date patterns replace the first "yyyy", "mm" and
 * "dd"; numeric patterns built from "0" and "#" fix the number of decimals
 * to the length of the part after the first ".".
 */
final class TextFormat {

    private TextFormat() {}

    static Object format(Arguments args) {
        Object error = args.firstError();
        if (error != null) {
            return error;
        }
        Double value = Values.tryNumber(args.scalar(0));
        if (value == null) {
            return FormulaError.VALUE.text();
        }
        String pattern = args.text(1, "");
        if (pattern.contains("yyyy") || pattern.contains("mm") || pattern.contains("dd")) {
            ZonedDateTime date = Functions.toDateTime(value);
            return pattern
                    .replaceFirst("yyyy", String.valueOf(date.getYear()))
                    .replaceFirst("mm", twoDigits(date.getMonthValue()))
                    .replaceFirst("dd", twoDigits(date.getDayOfMonth()));
        }
        if (pattern.contains("#") || pattern.contains("0")) {
            if (value.isNaN() || value.isInfinite()) {
                return Values.format(value);
            }
            int dot = pattern.indexOf('.');
            int decimals = dot < 0 ? 0 : pattern.substring(dot + 1).split("\\.", -1)[0].length();
            return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
        }
        return Values.format(value);
    }

    private static String twoDigits(int value) {
        return value < 10 ? "0" + value : String.valueOf(value);
    }
}
