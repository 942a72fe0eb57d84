package io.github.cepeppe.flex.coercion;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.codes.CodeTable;
import io.github.cepeppe.flex.codes.CodeTables;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.exception.CoercionException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Motore di coercion: converte il testo grezzo di un attributo nel valore tipizzato.
 *
 * <h2>Regole comuni</h2>
 * <ul>
 *   <li>Una stringa vuota (dopo il trim) è un valore assente per ogni tipo:
 *       {@code null} per gli scalari, lista vuota per {@link FieldType#CODE_LIST}.</li>
 *   <li>I valori non testuali sono sempre trimmati; il testo solo se {@link CoercionOptions#isTrimText()}.</li>
 *   <li>Un codice sconosciuto non è un errore: diventa {@link FlexCode.Unrecognized}.</li>
 * </ul>
 *
 * L'istanza è immutabile e thread-safe; non produce diagnostiche (lo fa l'assembler ispezionando
 * i {@link FlexCode} restituiti). Ogni metodo lancia {@link CoercionException} se il valore non rispetta
 * la grammatica del tipo.
 */
public final class FlexCoercer {

    private final CoercionOptions options;
    private final DateGrammar dates;

    public FlexCoercer(CoercionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.dates = new DateGrammar(options);
    }

    /**
     * Coercion generica guidata da {@link Target}; usata dall'assembler per gli attributi dello schema.
     *
     * @param raw  testo dell'attributo, {@code null} se assente
     * @param path path dell'attributo, usato nei messaggi d'errore
     */
    public Object coerce(String raw, Target target, String path) {
        switch (target.type()) {
            case TEXT:
                return text(raw);
            case INTEGER:
                return integer(raw, path);
            case DECIMAL:
                return decimal(raw, path);
            case BOOLEAN:
                return bool(raw, path);
            case DATE:
                return date(raw, path);
            case TIME:
                return time(raw, path);
            case DATE_TIME:
                return dateTime(raw, path);
            case CODE:
                return rawCode(target.codeTable(), raw);
            case CODE_LIST:
                return rawCodeList(target.codeTable(), raw, target.separator());
            default:
                throw new IllegalStateException("Unhandled field type " + target.type());
        }
    }

    /* =======================
       Scalari
       ======================= */

    public String text(String raw) {
        if (raw == null) return null;
        String v = options.isTrimText() ? raw.trim() : raw;
        return v.isEmpty() ? null : v;
    }

    public Integer integer(String raw, String path) {
        String v = normalize(raw);
        if (v == null) return null;
        try {
            return Integer.valueOf(v);
        } catch (NumberFormatException e) {
            throw new CoercionException(path, raw, FieldType.INTEGER, "not a base-10 integer", e);
        }
    }

    /** Decimale esatto: la scala del testo sorgente è conservata ({@code "368.80"} resta a due decimali). */
    public BigDecimal decimal(String raw, String path) {
        String v = normalize(raw);
        if (v == null) return null;
        String digits = v.replace(",", "");
        if (digits.isEmpty()) {
            throw new CoercionException(path, raw, FieldType.DECIMAL, "no digits");
        }
        try {
            return new BigDecimal(digits);
        } catch (NumberFormatException e) {
            throw new CoercionException(path, raw, FieldType.DECIMAL, "not a decimal number", e);
        }
    }

    public Boolean bool(String raw, String path) {
        String v = normalize(raw);
        if (v == null) return null;
        if ("Y".equals(v)) return Boolean.TRUE;
        if ("N".equals(v)) return Boolean.FALSE;
        throw new CoercionException(path, raw, FieldType.BOOLEAN, "expected Y or N");
    }

    /* =======================
       Date / ore
       ======================= */

    public LocalDate date(String raw, String path) {
        String v = normalize(raw);
        return v == null ? null : dates.date(v, path, FieldType.DATE);
    }

    public LocalTime time(String raw, String path) {
        String v = normalize(raw);
        return v == null ? null : dates.time(v, path, FieldType.TIME);
    }

    public LocalDateTime dateTime(String raw, String path) {
        String v = normalize(raw);
        return v == null ? null : dates.dateTime(v, path);
    }

    /* =======================
       Codici
       ======================= */

    /** Singolo codice: confronto esatto, fallback {@link FlexCode.Unrecognized}. */
    public <E extends Enum<E> & CodeTable> FlexCode<E> code(Class<E> table, String raw) {
        String v = normalize(raw);
        return v == null ? null : CodeTables.lookup(table, v);
    }

    /** Lista di codici con il separatore di default {@code ;}. */
    public <E extends Enum<E> & CodeTable> List<FlexCode<E>> codeList(Class<E> table, String raw) {
        return codeList(table, raw, Constants.Parsing.DEFAULT_CODE_LIST_SEPARATOR);
    }

    /**
     * Lista di codici: token trimmati, vuoti scartati, ordine e duplicati conservati.
     * Con {@link CoercionOptions#isLegacyCodeRuns()} un valore senza separatore come {@code "OP"}
     * viene letto carattere per carattere, ma solo se ogni carattere è un codice noto.
     */
    public <E extends Enum<E> & CodeTable> List<FlexCode<E>> codeList(Class<E> table, String raw, String separator) {
        String v = normalize(raw);
        if (v == null) return List.of();

        List<FlexCode<E>> out = new ArrayList<>();
        for (String token : tokens(table, v, separator)) {
            out.add(CodeTables.lookup(table, token));
        }
        return List.copyOf(out);
    }

    private List<String> tokens(Class<? extends Enum<?>> table, String value, String separator) {
        List<String> out = new ArrayList<>();
        if (options.isLegacyCodeRuns() && isCodeRun(table, value, separator)) {
            for (int i = 0; i < value.length(); i++) {
                out.add(String.valueOf(value.charAt(i)));
            }
            return out;
        }
        int from = 0;
        while (from <= value.length()) {
            int idx = value.indexOf(separator, from);
            int end = idx < 0 ? value.length() : idx;
            String token = value.substring(from, end).trim();
            if (!token.isEmpty()) out.add(token);
            if (idx < 0) break;
            from = idx + separator.length();
        }
        return out;
    }

    private static boolean isCodeRun(Class<? extends Enum<?>> table, String value, String separator) {
        if (value.length() < 2 || value.contains(separator) || CodeTables.isKnown(table, value)) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!CodeTables.isKnown(table, String.valueOf(value.charAt(i)))) {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private FlexCode<?> rawCode(Class<? extends Enum<?>> table, String raw) {
        return code((Class) table, raw);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private List<?> rawCodeList(Class<? extends Enum<?>> table, String raw, String separator) {
        return codeList((Class) table, raw, separator);
    }

    private static String normalize(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        return v.isEmpty() ? null : v;
    }
}
