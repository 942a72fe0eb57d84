package io.github.cepeppe.flex.exception;

import io.github.cepeppe.flex.assembler.Diagnostic;
import io.github.cepeppe.flex.assembler.DiagnosticKind;

import java.util.Map;

/**
 * Un evento normalmente non fatale (elemento non mappato, schema drift, codice sconosciuto)
 * promosso a errore dalla configurazione strict.
 */
public class StrictModeViolationException extends FlexParseException {

    private static final long serialVersionUID = 1L;

    private final Diagnostic diagnostic;

    public StrictModeViolationException(Diagnostic diagnostic) {
        super(Code.STRICT_MODE, diagnostic.path(),
                "Strict mode: " + diagnostic.kind() + " '" + diagnostic.rawValue() + "'",
                Map.of("kind", diagnostic.kind().name(), "raw", String.valueOf(diagnostic.rawValue())),
                null);
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    public DiagnosticKind getKind() {
        return diagnostic.kind();
    }
}
