package io.github.cepeppe.flex.assembler;

import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.coercion.FieldType;
import io.github.cepeppe.flex.coercion.FlexCoercer;
import io.github.cepeppe.flex.exception.FlexParseException;
import io.github.cepeppe.flex.exception.RequiredFieldException;
import io.github.cepeppe.flex.exception.StrictModeViolationException;
import io.github.cepeppe.flex.logging.FlexLogger;
import io.github.cepeppe.flex.model.FlexQueryResponse;
import io.github.cepeppe.flex.schema.AttributeSpec;
import io.github.cepeppe.flex.schema.ChildSpec;
import io.github.cepeppe.flex.schema.ElementBinding;
import io.github.cepeppe.flex.schema.RecordSchema;
import io.github.cepeppe.flex.schema.SchemaRegistry;
import io.github.cepeppe.flex.xml.XmlNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Costruisce il grafo tipizzato a partire dall'albero XML.
 *
 * <h2>Algoritmo</h2>
 * Visita depth-first: per ogni elemento si consulta il {@link SchemaRegistry}, si convertono gli attributi
 * dichiarati con il {@link FlexCoercer} e si accodano i record figli, in ordine di documento, alla lista
 * del componente corrispondente. Ogni elemento è visitato una sola volta.
 *
 * <h2>Errori</h2>
 * <ul>
 *   <li>Fatali: struttura non valida, campo obbligatorio assente, coercion fallita, violazioni strict.</li>
 *   <li>Non fatali: elementi non mappati, schema drift, codici sconosciuti; raccolti come {@link Diagnostic}.</li>
 * </ul>
 *
 * Un'istanza serve un solo documento (accumula diagnostiche): usare {@link #assemble(XmlNode, SchemaRegistry, ParseOptions)}.
 */
public final class FlexAssembler {

    private static final FlexLogger LOG = FlexLogger.getLogger(FlexAssembler.class);

    private final SchemaRegistry registry;
    private final ParseOptions options;
    private final FlexCoercer coercer;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, Map<String, String>> extras = new LinkedHashMap<>();

    private FlexAssembler(SchemaRegistry registry, ParseOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
        this.coercer = new FlexCoercer(options.getCoercion());
    }

    /**
     * Assembla il documento.
     *
     * @throws FlexParseException (o sottoclassi) alla prima condizione fatale; nessun risultato parziale
     */
    public static FlexParseResult assemble(XmlNode root, SchemaRegistry registry, ParseOptions options) {
        return new FlexAssembler(registry, options).run(root);
    }

    private FlexParseResult run(XmlNode root) {
        RecordSchema rootSchema = registry.root();
        if (!rootSchema.elementName().equals(root.name())) {
            throw FlexParseException.structure(root.name(),
                    "Unexpected root element, expected " + rootSchema.elementName(), "root", root.name());
        }
        FlexQueryResponse response = (FlexQueryResponse) build(root, rootSchema, root.name());
        return new FlexParseResult(response, diagnostics, extras);
    }

    /* =======================
       Record
       ======================= */

    private Record build(XmlNode node, RecordSchema schema, String path) {
        Object[] args = new Object[schema.arity()];

        collectUndeclared(node, schema, path);
        for (AttributeSpec spec : schema.attributes()) {
            args[spec.index()] = attribute(node, schema, spec, path);
        }

        boolean[] seen = new boolean[schema.arity()];
        for (XmlNode child : node.children()) {
            ChildSpec spec = schema.child(child.name());
            String childPath = path + "/" + child.name();
            if (spec == null) {
                unmapped(child, childPath);
                continue;
            }
            if (seen[spec.index()]) {
                throw FlexParseException.structure(childPath,
                        "Element " + child.name() + " may appear only once in " + schema.elementName());
            }
            seen[spec.index()] = true;

            if (spec.kind() == ChildSpec.Kind.SINGLE) {
                args[spec.index()] = build(child, registry.schemaOf(spec.itemType()), childPath);
            } else {
                args[spec.index()] = section(child, spec, childPath);
            }
        }

        for (ChildSpec spec : schema.children()) {
            if (seen[spec.index()]) continue;
            if (spec.required()) {
                throw FlexParseException.structure(path,
                        schema.elementName() + " must contain exactly one " + spec.elementName());
            }
            if (spec.kind() == ChildSpec.Kind.SECTION) {
                args[spec.index()] = List.of();
            }
        }

        return schema.instantiate(args);
    }

    private Object attribute(XmlNode node, RecordSchema schema, AttributeSpec spec, String path) {
        String raw = node.attribute(spec.name());
        String attrPath = path + "@" + spec.name();
        Object value = coercer.coerce(raw, spec.target(), attrPath);

        if (value == null && spec.required()) {
            throw new RequiredFieldException(attrPath, schema.type().getSimpleName(), spec.name());
        }
        if (spec.target().type() == FieldType.CODE) {
            checkCode((FlexCode<?>) value, spec, attrPath);
        } else if (spec.target().type() == FieldType.CODE_LIST) {
            for (Object code : (List<?>) value) {
                checkCode((FlexCode<?>) code, spec, attrPath);
            }
        }
        return value;
    }

    private void checkCode(FlexCode<?> code, AttributeSpec spec, String attrPath) {
        if (code == null || code.isKnown()) return;
        report(new Diagnostic(attrPath, code.raw(), DiagnosticKind.UNRECOGNIZED_CODE,
                "Code '" + code.raw() + "' is not in " + spec.target().codeTable().getSimpleName()));
    }

    private void collectUndeclared(XmlNode node, RecordSchema schema, String path) {
        for (Map.Entry<String, String> e : node.attributes().entrySet()) {
            if (schema.attribute(e.getKey()) == null) {
                drift(path, e.getKey(), e.getValue());
            }
        }
    }

    /* =======================
       Sezioni
       ======================= */

    private List<Record> section(XmlNode wrapper, ChildSpec spec, String wrapperPath) {
        for (Map.Entry<String, String> e : wrapper.attributes().entrySet()) {
            if (!e.getKey().equals(spec.countAttribute())) {
                drift(wrapperPath, e.getKey(), e.getValue());
            }
        }

        XmlNode container = wrapper;
        String containerPath = wrapperPath;
        if (spec.hasNested()) {
            container = nested(wrapper, spec, wrapperPath);
            if (container == null) {
                return List.of();
            }
            containerPath = wrapperPath + "/" + spec.nested();
        }

        List<Record> items = new ArrayList<>(container.children().size());
        RecordSchema itemSchema = registry.schemaOf(spec.itemType());
        for (XmlNode item : container.children()) {
            String itemPath = containerPath + "/" + item.name();
            ElementBinding binding = registry.lookup(item.name());
            if (binding instanceof ElementBinding.Mapped mapped && mapped.schema() == itemSchema) {
                items.add(build(item, itemSchema, itemPath + "[" + items.size() + "]"));
            } else {
                unmapped(item, itemPath);
            }
        }

        if (spec.hasCount()) {
            checkCount(wrapper, spec, wrapperPath, items.size());
        }
        return Collections.unmodifiableList(items);
    }

    private XmlNode nested(XmlNode wrapper, ChildSpec spec, String wrapperPath) {
        XmlNode found = null;
        for (XmlNode child : wrapper.children()) {
            if (!child.name().equals(spec.nested())) {
                unmapped(child, wrapperPath + "/" + child.name());
                continue;
            }
            if (found != null) {
                throw FlexParseException.structure(wrapperPath + "/" + spec.nested(),
                        spec.elementName() + " may contain at most one " + spec.nested());
            }
            found = child;
        }
        if (found != null) {
            for (Map.Entry<String, String> e : found.attributes().entrySet()) {
                drift(wrapperPath + "/" + spec.nested(), e.getKey(), e.getValue());
            }
        }
        return found;
    }

    private void checkCount(XmlNode wrapper, ChildSpec spec, String wrapperPath, int actual) {
        String countPath = wrapperPath + "@" + spec.countAttribute();
        Integer declared = coercer.integer(wrapper.attribute(spec.countAttribute()), countPath);
        if (declared == null) {
            if (spec.required()) {
                throw new RequiredFieldException(countPath, spec.elementName(), spec.countAttribute());
            }
            return;
        }
        if (declared != actual) {
            throw FlexParseException.structure(wrapperPath,
                    spec.elementName() + " declares " + spec.countAttribute() + "=" + declared
                            + " but contains " + actual + " " + spec.itemElement() + " element(s)",
                    "declared", declared, "actual", actual);
        }
    }

    /* =======================
       Diagnostiche
       ======================= */

    private void unmapped(XmlNode node, String path) {
        report(new Diagnostic(path, node.name(), DiagnosticKind.UNMAPPED_ELEMENT,
                "Element " + node.name() + " is not part of the schema; subtree skipped"));
    }

    private void drift(String path, String attribute, String value) {
        String attrPath = path + "@" + attribute;
        report(new Diagnostic(attrPath, value, DiagnosticKind.SCHEMA_DRIFT,
                "Attribute " + attribute + " is not declared; " + (options.isPermissive() ? "retained" : "discarded")));
        if (options.isPermissive()) {
            extras.computeIfAbsent(path, k -> new LinkedHashMap<>()).put(attribute, value);
        }
    }

    private void report(Diagnostic diagnostic) {
        if (options.isStrict()) {
            LOG.debug("Strict mode violation: {}", diagnostic);
            throw new StrictModeViolationException(diagnostic);
        }
        LOG.debug("{}", diagnostic);
        diagnostics.add(diagnostic);
    }
}
