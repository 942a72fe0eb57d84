package io.github.cepeppe.flex.schema;

import io.github.cepeppe.flex.coercion.Target;

/**
 * Attributo dichiarato da un record.
 *
 * @param name      nome dell'attributo XML
 * @param component nome del componente del record
 * @param index     posizione del componente nel costruttore canonico
 * @param target    tipo di destinazione della coercion
 * @param required  se {@code true} l'assenza è un errore fatale
 */
public record AttributeSpec(String name, String component, int index, Target target, boolean required) {
}
