package io.github.cepeppe.flex.assembler;

import io.github.cepeppe.flex.model.FlexQueryResponse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito di un parsing riuscito.
 *
 * @param response        il grafo tipizzato
 * @param diagnostics     eventi non fatali, in ordine di incontro
 * @param extraAttributes attributi non dichiarati, per path del record (popolato solo in modalità permissive)
 */
public record FlexParseResult(FlexQueryResponse response,
                              List<Diagnostic> diagnostics,
                              Map<String, Map<String, String>> extraAttributes) {

    public FlexParseResult {
        diagnostics = List.copyOf(diagnostics);
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        extraAttributes.forEach((path, attrs) -> copy.put(path, Collections.unmodifiableMap(new LinkedHashMap<>(attrs))));
        extraAttributes = Collections.unmodifiableMap(copy);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
