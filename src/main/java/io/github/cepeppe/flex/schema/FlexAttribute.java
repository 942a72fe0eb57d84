package io.github.cepeppe.flex.schema;

import io.github.cepeppe.flex.Constants;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Dettagli opzionali di un componente-attributo.
 * <p>
 * Senza annotazione il nome dell'attributo XML coincide con il nome del componente
 * e il campo è facoltativo.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface FlexAttribute {

    /** Nome dell'attributo XML; vuoto = nome del componente. */
    String value() default "";

    /** Un attributo obbligatorio assente fa fallire l'intero parsing. */
    boolean required() default false;

    /** Separatore dei token per le liste di codici. */
    String separator() default Constants.Parsing.DEFAULT_CODE_LIST_SEPARATOR;
}
