package com.bmsedge.sticklist.util;

import com.bmsedge.sticklist.model.ModelStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw cell values into the canonical forms used for matching.
 * Nothing here throws on malformed input: anything unusable comes back as {@code null}.
 */
public final class CellValueNormalizer {

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+", Pattern.UNICODE_CHARACTER_CLASS);

    // Trailing "(...)" group; content may not contain further parentheses
    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("^(.*)\\(([^()]*)\\)$", Pattern.DOTALL);

    private static final double INTEGRAL_TOLERANCE = 1e-9;

    // Above this a double no longer holds every integer exactly
    private static final double MAX_EXACT_INTEGRAL = 1e15;

    private CellValueNormalizer() {
    }

    public static String normalizeText(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public static String normalizeBlade(Object value) {
        String text = normalizeText(value);
        return text == null ? null : text.toUpperCase(Locale.ROOT);
    }

    public static String normalizeStyle(Object value) {
        return normalizeBlade(value);
    }

    /**
     * Splits "FT8 Pro (RED)" into ("FT8 Pro", "RED"). Full-width parentheses count as
     * ASCII ones. Without a trailing group the whole text is the base. The base never
     * comes back empty for non-blank input.
     */
    public static ModelStyle splitModelAndStyle(Object raw) {
        String text = normalizeText(raw);
        if (text == null) {
            return ModelStyle.EMPTY;
        }
        text = text.replace('（', '(').replace('）', ')');

        Matcher matcher = TRAILING_PARENTHETICAL.matcher(text);
        if (!matcher.matches()) {
            return new ModelStyle(text, null);
        }

        String base = matcher.group(1).trim();
        String style = matcher.group(2).trim();
        return new ModelStyle(base.isEmpty() ? text : base, style.isEmpty() ? null : style);
    }

    public static Integer parseFlex(Object value) {
        if (value == null) {
            return null;
        }
        if (isIntegral(value)) {
            return toIntOrNull((Number) value);
        }
        if (isFloating(value)) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                return null;
            }
            return toIntOrNull(Math.rint(d));
        }
        if (value instanceof String) {
            return firstDigitRun((String) value);
        }
        return null;
    }

    /**
     * Parses a Left/Right quantity. With defect exclusion on, any text carrying a
     * non-ASCII character (a defect annotation) is excluded outright.
     */
    public static Integer parseQuantity(Object value, boolean defectExclusionEnabled) {
        if (value == null) {
            return null;
        }
        if (isIntegral(value)) {
            return toIntOrNull((Number) value);
        }
        if (isFloating(value)) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                return null;
            }
            double rounded = Math.rint(d);
            if (Math.abs(d - rounded) < INTEGRAL_TOLERANCE) {
                return toIntOrNull(rounded);
            }
            return toIntOrNull(d < 0 ? Math.ceil(d) : Math.floor(d));
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return null;
            }
            if (defectExclusionEnabled && hasNonAscii(text)) {
                return null;
            }
            return firstDigitRun(text);
        }
        return null;
    }

    public static boolean hasNonAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 127) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads a POI cell into a plain Java value: String, Long for whole numbers, Double,
     * Boolean or LocalDateTime. Formulas yield their cached result. Blank, error and
     * missing cells are {@code null}.
     */
    public static Object readCellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return toNumber(cell.getNumericCellValue());
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    public static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    private static Object toNumber(double d) {
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < MAX_EXACT_INTEGRAL) {
            return (long) d;
        }
        return d;
    }

    private static Integer firstDigitRun(String text) {
        Matcher matcher = DIGIT_RUN.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            // digit run too long for an int
            return null;
        }
    }

    // Values outside the int range are absent rather than wrapped
    private static Integer toIntOrNull(Number value) {
        try {
            if (value instanceof BigInteger) {
                return ((BigInteger) value).intValueExact();
            }
            return Math.toIntExact(value.longValue());
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Integer toIntOrNull(double whole) {
        if (whole < Integer.MIN_VALUE || whole > Integer.MAX_VALUE) {
            return null;
        }
        return (int) whole;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    private static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float || value instanceof BigDecimal;
    }
}
