package io.github.cepeppe.flex.schema;

import io.github.cepeppe.flex.Constants;
import io.github.cepeppe.flex.codes.CodeTable;
import io.github.cepeppe.flex.codes.CodeTables;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.coercion.FieldType;
import io.github.cepeppe.flex.coercion.Target;
import io.github.cepeppe.flex.logging.FlexLogger;
import io.github.cepeppe.flex.model.FlexQueryResponse;

import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry degli schemi: per ogni nome di elemento il record di destinazione, gli attributi attesi
 * (tipo e obbligatorietà) e i figli strutturali.
 *
 * <h2>Origine dei dati</h2>
 * Gli schemi sono derivati per reflection dalle dichiarazioni sui record del package {@code model}
 * ({@link FlexElement}, {@link FlexAttribute}, {@link FlexSection}), a partire dalla radice
 * {@link FlexQueryResponse}. Aggiungere un campo o una sezione significa modificare solo il record.
 *
 * <h2>Tipi dei componenti</h2>
 * <ul>
 *   <li>{@code String} &rarr; TEXT, {@code Integer} &rarr; INTEGER, {@code BigDecimal} &rarr; DECIMAL,
 *       {@code Boolean} &rarr; BOOLEAN</li>
 *   <li>{@code LocalDate} / {@code LocalTime} / {@code LocalDateTime} &rarr; DATE / TIME / DATE_TIME</li>
 *   <li>{@code FlexCode<E>} &rarr; CODE, {@code List<FlexCode<E>>} &rarr; CODE_LIST</li>
 *   <li>record {@link FlexElement} &rarr; figlio singolo; {@code List<R>} con {@link FlexSection} &rarr; sezione</li>
 * </ul>
 *
 * <h2>Thread-safety</h2>
 * Costruito una sola volta (holder idiom) e poi immutabile: nessun lock sui lookup.
 */
public final class SchemaRegistry {

    private static final FlexLogger LOG = FlexLogger.getLogger(SchemaRegistry.class);

    private static final Map<Class<?>, FieldType> SCALARS = Map.of(
            String.class, FieldType.TEXT,
            Integer.class, FieldType.INTEGER,
            BigDecimal.class, FieldType.DECIMAL,
            Boolean.class, FieldType.BOOLEAN,
            LocalDate.class, FieldType.DATE,
            LocalTime.class, FieldType.TIME,
            LocalDateTime.class, FieldType.DATE_TIME
    );

    private static final class Holder {
        private static final SchemaRegistry INSTANCE = forRoot(FlexQueryResponse.class);
    }

    private final RecordSchema root;
    private final Map<String, RecordSchema> byElement;
    private final Map<Class<?>, RecordSchema> byType;

    private SchemaRegistry(RecordSchema root, Map<String, RecordSchema> byElement, Map<Class<?>, RecordSchema> byType) {
        this.root = root;
        this.byElement = Collections.unmodifiableMap(byElement);
        this.byType = Collections.unmodifiableMap(byType);
    }

    /** Registry del vocabolario Flex, condiviso dall'intero processo. */
    public static SchemaRegistry getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Costruisce un registry a partire da un record radice qualsiasi.
     *
     * @throws IllegalStateException se le dichiarazioni sui record non sono coerenti
     */
    public static SchemaRegistry forRoot(Class<? extends Record> rootType) {
        long t0 = System.nanoTime();
        Map<String, RecordSchema> byElement = new LinkedHashMap<>();
        Map<Class<?>, RecordSchema> byType = new LinkedHashMap<>();

        Deque<Class<? extends Record>> pending = new ArrayDeque<>();
        pending.add(rootType);
        while (!pending.isEmpty()) {
            Class<? extends Record> type = pending.poll();
            if (byType.containsKey(type)) continue;

            RecordSchema schema = describe(type);
            RecordSchema clash = byElement.put(schema.elementName(), schema);
            if (clash != null) {
                throw new IllegalStateException("Element '" + schema.elementName() + "' declared by both "
                        + clash.type().getSimpleName() + " and " + type.getSimpleName());
            }
            byType.put(type, schema);
            for (ChildSpec child : schema.children()) {
                pending.add(child.itemType());
            }
        }

        SchemaRegistry registry = new SchemaRegistry(byType.get(rootType), byElement, byType);
        LOG.debug("Schema registry for {} built: {} element(s) in {} ms",
                rootType.getSimpleName(), byElement.size(), (System.nanoTime() - t0) / 1_000_000);
        return registry;
    }

    /* =======================
       Lookup
       ======================= */

    public RecordSchema root() {
        return root;
    }

    /** Lookup per nome: un elemento fuori vocabolario produce {@link ElementBinding.Unmapped}, mai un errore. */
    public ElementBinding lookup(String elementName) {
        RecordSchema schema = byElement.get(elementName);
        return schema != null ? new ElementBinding.Mapped(schema) : new ElementBinding.Unmapped(elementName);
    }

    /** @throws IllegalArgumentException se il tipo non appartiene al registry */
    public RecordSchema schemaOf(Class<? extends Record> type) {
        RecordSchema schema = byType.get(type);
        if (schema == null) {
            throw new IllegalArgumentException(type.getName() + " is not part of this registry");
        }
        return schema;
    }

    public Set<String> elementNames() {
        return byElement.keySet();
    }

    /* =======================
       Reflection
       ======================= */

    private static RecordSchema describe(Class<? extends Record> type) {
        FlexElement element = type.getAnnotation(FlexElement.class);
        if (element == null) {
            throw new IllegalStateException(type.getName() + " is not annotated with @FlexElement");
        }

        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        List<AttributeSpec> attributes = new ArrayList<>();
        List<ChildSpec> children = new ArrayList<>();

        for (int i = 0; i < components.length; i++) {
            RecordComponent rc = components[i];
            parameterTypes[i] = rc.getType();

            FlexSection section = rc.getAnnotation(FlexSection.class);
            if (section != null) {
                children.add(section(type, rc, i, section));
            } else if (rc.getType().isAnnotationPresent(FlexElement.class)) {
                Class<? extends Record> itemType = asRecord(type, rc, rc.getType());
                String name = itemType.getAnnotation(FlexElement.class).value();
                children.add(new ChildSpec(name, rc.getName(), i, ChildSpec.Kind.SINGLE, itemType, name, "", "", false));
            } else {
                attributes.add(attribute(type, rc, i));
            }
        }

        try {
            Constructor<? extends Record> ctor = type.getDeclaredConstructor(parameterTypes);
            return new RecordSchema(element.value(), type, ctor, attributes, children);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("No canonical constructor on " + type.getName(), e);
        }
    }

    private static AttributeSpec attribute(Class<?> owner, RecordComponent rc, int index) {
        FlexAttribute ann = rc.getAnnotation(FlexAttribute.class);
        String name = ann != null && !ann.value().isEmpty() ? ann.value() : rc.getName();
        boolean required = ann != null && ann.required();
        String separator = ann != null ? ann.separator() : Constants.Parsing.DEFAULT_CODE_LIST_SEPARATOR;

        Class<?> raw = rc.getType();
        FieldType scalar = SCALARS.get(raw);
        if (scalar != null) {
            return new AttributeSpec(name, rc.getName(), index, Target.of(scalar), required);
        }
        if (raw == FlexCode.class) {
            Class<? extends Enum<?>> table = codeTable(owner, rc, rc.getGenericType());
            return new AttributeSpec(name, rc.getName(), index, Target.code(table), required);
        }
        if (raw == List.class) {
            Type element = typeArgument(owner, rc, rc.getGenericType());
            if (element instanceof ParameterizedType pt && pt.getRawType() == FlexCode.class) {
                Class<? extends Enum<?>> table = codeTable(owner, rc, pt);
                return new AttributeSpec(name, rc.getName(), index, Target.codeList(table, separator), required);
            }
        }
        throw new IllegalStateException("Unsupported component type " + rc.getGenericType()
                + " for " + owner.getSimpleName() + "." + rc.getName());
    }

    private static ChildSpec section(Class<?> owner, RecordComponent rc, int index, FlexSection section) {
        if (rc.getType() != List.class) {
            throw new IllegalStateException("@FlexSection requires a List component: "
                    + owner.getSimpleName() + "." + rc.getName());
        }
        Type element = typeArgument(owner, rc, rc.getGenericType());
        if (!(element instanceof Class<?> itemClass) || !itemClass.isAnnotationPresent(FlexElement.class)) {
            throw new IllegalStateException("@FlexSection item must be a @FlexElement record: "
                    + owner.getSimpleName() + "." + rc.getName());
        }
        Class<? extends Record> itemType = asRecord(owner, rc, itemClass);
        return new ChildSpec(section.value(), rc.getName(), index, ChildSpec.Kind.SECTION, itemType,
                itemType.getAnnotation(FlexElement.class).value(),
                section.nested(), section.countAttribute(), section.required());
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Enum<?>> codeTable(Class<?> owner, RecordComponent rc, Type flexCodeType) {
        Type arg = typeArgument(owner, rc, flexCodeType);
        if (arg instanceof Class<?> c && c.isEnum() && CodeTable.class.isAssignableFrom(c)) {
            Class<? extends Enum<?>> table = (Class<? extends Enum<?>>) c;
            CodeTables.warmUp(table);
            return table;
        }
        throw new IllegalStateException("FlexCode component needs a concrete code table: "
                + owner.getSimpleName() + "." + rc.getName());
    }

    private static Type typeArgument(Class<?> owner, RecordComponent rc, Type type) {
        if (type instanceof ParameterizedType pt && pt.getActualTypeArguments().length == 1) {
            return pt.getActualTypeArguments()[0];
        }
        throw new IllegalStateException("Raw generic type on " + owner.getSimpleName() + "." + rc.getName());
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Record> asRecord(Class<?> owner, RecordComponent rc, Class<?> type) {
        if (!type.isRecord()) {
            throw new IllegalStateException("Child type must be a record: " + owner.getSimpleName() + "." + rc.getName());
        }
        return (Class<? extends Record>) type;
    }
}
