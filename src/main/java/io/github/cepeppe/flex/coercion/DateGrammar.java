package io.github.cepeppe.flex.coercion;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.exception.AmbiguousDateException;
import io.github.cepeppe.flex.exception.CoercionException;
import io.github.cepeppe.flex.logging.FlexLogger;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Grammatica di date, ore e date-ora usata dal servizio Flex.
 *
 * <h2>Date</h2>
 * <ul>
 *   <li>{@code yyyy-MM-dd} (ISO) e {@code yyyyMMdd}: non ambigue, accettate in ogni modalità.</li>
 *   <li>{@code dd-MMM-yy} (es. {@code 13-JUL-97}): non ambigua, accettata in ogni modalità.</li>
 *   <li>{@code NN/NN/yyyy} e {@code NN/NN/yy}: interpretate secondo {@link DateMode}.</li>
 * </ul>
 *
 * <h2>Ore</h2>
 * {@code HH:mm:ss} oppure {@code HHmmss}.
 *
 * <h2>Date-ora</h2>
 * Valori più corti di 12 caratteri sono solo date (mezzanotte). Altrimenti si prova prima il separatore
 * configurato, poi {@code ;}, {@code ,}, spazio e nessun separatore.
 */
final class DateGrammar {

    private static final FlexLogger LOG = FlexLogger.getLogger(DateGrammar.class);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12));

    private final CoercionOptions options;
    private final List<String> separators;

    DateGrammar(CoercionOptions options) {
        this.options = options;
        List<String> seps = new ArrayList<>();
        seps.add(String.valueOf(options.getDateTimeSeparator()));
        for (String s : Constants.Parsing.STANDARD_DATETIME_SEPARATORS) {
            if (!seps.contains(s)) seps.add(s);
        }
        this.separators = List.copyOf(seps);
    }

    /* =======================
       Date
       ======================= */

    LocalDate date(String value, String path, FieldType reported) {
        int len = value.length();

        if (len == 10 && value.charAt(4) == '-' && value.charAt(7) == '-') {
            return build(digits(value, 0, 4, path, reported), digits(value, 5, 7, path, reported),
                    digits(value, 8, 10, path, reported), value, path, reported);
        }
        if (len == 8 && allDigits(value)) {
            return build(digits(value, 0, 4, path, reported), digits(value, 4, 6, path, reported),
                    digits(value, 6, 8, path, reported), value, path, reported);
        }
        if (len == 9 && value.charAt(2) == '-' && value.charAt(6) == '-') {
            Integer month = MONTHS.get(value.substring(3, 6).toUpperCase(java.util.Locale.ROOT));
            if (month == null) {
                throw new CoercionException(path, value, reported, "unknown month name");
            }
            int year = century(digits(value, 7, 9, path, reported));
            return build(year, month, digits(value, 0, 2, path, reported), value, path, reported);
        }
        if ((len == 10 || len == 8) && value.charAt(2) == '/' && value.charAt(5) == '/') {
            return slashDate(value, path, reported);
        }
        throw new CoercionException(path, value, reported, "unsupported date format");
    }

    private LocalDate slashDate(String value, String path, FieldType reported) {
        int first = digits(value, 0, 2, path, reported);
        int second = digits(value, 3, 5, path, reported);
        int year = digits(value, 6, value.length(), path, reported);
        if (value.length() == 8) {
            year = century(year);
        }

        DateMode mode = options.getDateMode();
        switch (mode) {
            case ISO:
                throw new CoercionException(path, value, reported, "slash dates are not accepted in ISO mode");
            case LEGACY:
                return build(year, first, second, value, path, reported);
            case DAY_FIRST:
                return build(year, second, first, value, path, reported);
            default:
                break;
        }

        // AUTO: deducibile solo se un gruppo supera 12 oppure i gruppi coincidono
        if (first == second || (first > 12 && second <= 12) || (second > 12 && first <= 12)) {
            return first > 12
                    ? build(year, second, first, value, path, reported)
                    : build(year, first, second, value, path, reported);
        }
        if (first > 12) {
            throw new CoercionException(path, value, reported, "no group is a valid month");
        }
        if (options.isStrictAmbiguity()) {
            throw new AmbiguousDateException(path, value, reported, mode);
        }
        LOG.warn("Ambiguous date '{}' at {} read as month-first (strictAmbiguity disabled)", value, path);
        return build(year, first, second, value, path, reported);
    }

    /* =======================
       Time
       ======================= */

    LocalTime time(String value, String path, FieldType reported) {
        if (value.length() == 8 && value.charAt(2) == ':' && value.charAt(5) == ':') {
            return buildTime(digits(value, 0, 2, path, reported), digits(value, 3, 5, path, reported),
                    digits(value, 6, 8, path, reported), value, path, reported);
        }
        if (value.length() == 6 && allDigits(value)) {
            return buildTime(digits(value, 0, 2, path, reported), digits(value, 2, 4, path, reported),
                    digits(value, 4, 6, path, reported), value, path, reported);
        }
        throw new CoercionException(path, value, reported, "unsupported time format");
    }

    /* =======================
       Date-time
       ======================= */

    LocalDateTime dateTime(String value, String path) {
        if (value.length() < Constants.Parsing.MIN_DATETIME_LENGTH) {
            return date(value, path, FieldType.DATE_TIME).atStartOfDay();
        }

        CoercionException last = null;
        for (String sep : separators) {
            try {
                LocalDateTime parsed = sep.isEmpty() ? joined(value, path) : separated(value, sep, path);
                if (parsed != null) {
                    return parsed;
                }
            } catch (AmbiguousDateException e) {
                throw e;
            } catch (CoercionException e) {
                last = e;
            }
        }
        throw new CoercionException(path, value, FieldType.DATE_TIME,
                "no date/time separator among " + separators + " matches", last);
    }

    /** @return {@code null} se il separatore non compare esattamente una volta */
    private LocalDateTime separated(String value, String sep, String path) {
        int idx = value.indexOf(sep);
        if (idx < 0 || value.indexOf(sep, idx + 1) >= 0) {
            return null;
        }
        LocalDate d = date(value.substring(0, idx).trim(), path, FieldType.DATE_TIME);
        LocalTime t = time(value.substring(idx + 1).trim(), path, FieldType.DATE_TIME);
        return LocalDateTime.of(d, t);
    }

    private LocalDateTime joined(String value, String path) {
        CoercionException last = null;
        for (int timeLength : new int[]{8, 6}) {
            if (value.length() <= timeLength) continue;
            try {
                LocalTime t = time(value.substring(value.length() - timeLength), path, FieldType.DATE_TIME);
                LocalDate d = date(value.substring(0, value.length() - timeLength), path, FieldType.DATE_TIME);
                return LocalDateTime.of(d, t);
            } catch (AmbiguousDateException e) {
                throw e;
            } catch (CoercionException e) {
                last = e;
            }
        }
        if (last != null) throw last;
        return null;
    }

    /* =======================
       Helper
       ======================= */

    private static LocalDate build(int year, int month, int day, String raw, String path, FieldType reported) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new CoercionException(path, raw, reported, e.getMessage(), e);
        }
    }

    private static LocalTime buildTime(int h, int m, int s, String raw, String path, FieldType reported) {
        try {
            return LocalTime.of(h, m, s);
        } catch (DateTimeException e) {
            throw new CoercionException(path, raw, reported, e.getMessage(), e);
        }
    }

    private static int century(int twoDigitYear) {
        return (twoDigitYear > Constants.Parsing.TWO_DIGIT_YEAR_PIVOT ? 1900 : 2000) + twoDigitYear;
    }

    private static int digits(String value, int from, int to, String path, FieldType reported) {
        int out = 0;
        for (int i = from; i < to; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new CoercionException(path, value, reported, "unexpected character '" + c + "'");
            }
            out = out * 10 + (c - '0');
        }
        return out;
    }

    private static boolean allDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }
}
