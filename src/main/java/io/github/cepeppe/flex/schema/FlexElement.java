package io.github.cepeppe.flex.schema;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marca un record come tipo di destinazione di un elemento XML.
 * Il valore è il nome dell'elemento (es. {@code "Trade"}).
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FlexElement {
    String value();
}
