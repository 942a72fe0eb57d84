package io.github.cepeppe.flex.schema;

import io.github.cepeppe.flex.exception.FlexException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema di un elemento: tipo record di destinazione, attributi dichiarati e figli strutturali.
 * Istanze immutabili, costruite solo dal {@link SchemaRegistry}.
 */
public final class RecordSchema {

    private final String elementName;
    private final Class<? extends Record> type;
    private final Constructor<? extends Record> constructor;
    private final int arity;
    private final List<AttributeSpec> attributes;
    private final Map<String, AttributeSpec> attributesByName;
    private final List<ChildSpec> children;
    private final Map<String, ChildSpec> childrenByElement;

    RecordSchema(String elementName,
                 Class<? extends Record> type,
                 Constructor<? extends Record> constructor,
                 List<AttributeSpec> attributes,
                 List<ChildSpec> children) {
        this.elementName = elementName;
        this.type = type;
        this.constructor = constructor;
        this.arity = constructor.getParameterCount();
        this.attributes = List.copyOf(attributes);
        this.children = List.copyOf(children);

        Map<String, AttributeSpec> byName = new LinkedHashMap<>();
        for (AttributeSpec a : attributes) {
            if (byName.put(a.name(), a) != null) {
                throw new IllegalStateException("Duplicate attribute '" + a.name() + "' on " + type.getSimpleName());
            }
        }
        this.attributesByName = Collections.unmodifiableMap(byName);

        Map<String, ChildSpec> byElement = new LinkedHashMap<>();
        for (ChildSpec c : children) {
            if (byElement.put(c.elementName(), c) != null) {
                throw new IllegalStateException("Duplicate child '" + c.elementName() + "' on " + type.getSimpleName());
            }
        }
        this.childrenByElement = Collections.unmodifiableMap(byElement);
    }

    public String elementName() {
        return elementName;
    }

    public Class<? extends Record> type() {
        return type;
    }

    public int arity() {
        return arity;
    }

    /** Attributi nell'ordine dei componenti. */
    public List<AttributeSpec> attributes() {
        return attributes;
    }

    /** @return lo spec, o {@code null} se l'attributo non è dichiarato (schema drift) */
    public AttributeSpec attribute(String name) {
        return attributesByName.get(name);
    }

    public List<ChildSpec> children() {
        return children;
    }

    /** @return lo spec del figlio diretto, o {@code null} se l'elemento non appartiene al record */
    public ChildSpec child(String elementName) {
        return childrenByElement.get(elementName);
    }

    /**
     * Invoca il costruttore canonico.
     *
     * @param args un valore per componente, nell'ordine di dichiarazione
     */
    public Record instantiate(Object[] args) {
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw FlexException.wrap(e.getCause(), FlexException.Code.INTERNAL,
                    "Constructor of " + type.getSimpleName() + " rejected the assembled values",
                    "record", type.getSimpleName());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw FlexException.wrap(e, FlexException.Code.INTERNAL,
                    "Cannot instantiate " + type.getSimpleName(), "record", type.getSimpleName());
        }
    }

    @Override
    public String toString() {
        return "RecordSchema[" + elementName + " -> " + type.getSimpleName()
                + ", attributes=" + attributes.size() + ", children=" + children.size() + "]";
    }
}
