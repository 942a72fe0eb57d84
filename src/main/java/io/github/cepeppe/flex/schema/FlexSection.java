package io.github.cepeppe.flex.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca un componente {@code List<R>} come sezione ripetuta: gli elementi {@code R} sono raccolti,
 * in ordine di documento, dall'elemento wrapper indicato.
 *
 * <pre>{@code
 * @FlexSection("Trades") List<Trade> trades          // <Trades><Trade/>...</Trades>
 * @FlexSection(value = "FxPositions", nested = "FxLots") List<FxLot> fxLots
 * }</pre>
 *
 * I figli singoli (es. {@code AccountInformation}) non richiedono annotazione: basta che il tipo
 * del componente sia un record {@link FlexElement}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface FlexSection {

    /** Nome dell'elemento wrapper. */
    String value();

    /** Wrapper intermedio opzionale (al più uno per sezione). */
    String nested() default "";

    /** Attributo del wrapper che dichiara il numero di elementi; vuoto = nessun controllo. */
    String countAttribute() default "";

    /** Se {@code true} il wrapper (e il suo count, se dichiarato) deve essere presente. */
    boolean required() default false;
}
