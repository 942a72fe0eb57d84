package io.github.cepeppe.flex.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FlexLogger - Facciata minima per il logging della libreria.
 *
 * Uso:
 *   private static final FlexLogger LOG = FlexLogger.getLogger(MyClass.class);
 *   LOG.info("Parsed {} statements", n);
 *   LOG.error("Parse failed", e);
 *
 * Livelli adottati nel parser:
 * - DEBUG: singoli eventi diagnostici (drift, elementi non mappati, codici sconosciuti) e tentativi HTTP.
 * - INFO:  riepiloghi di parsing/configurazione.
 * - WARN:  retry di polling e fallback su date ambigue.
 * - ERROR: solo prima di propagare un errore fatale da un entry point pubblico.
 */
public final class FlexLogger {

    private final Logger delegate;

    private FlexLogger(Logger delegate) {
        this.delegate = delegate;
    }

    /** Restituisce un logger legato alla classe chiamante. */
    public static FlexLogger getLogger(Class<?> clazz) {
        return new FlexLogger(LoggerFactory.getLogger(clazz));
    }

    public boolean isDebugEnabled() { return delegate.isDebugEnabled(); }

    // Livelli standard
    public void trace(String msg, Object... args) { delegate.trace(msg, args); }
    public void debug(String msg, Object... args) { delegate.debug(msg, args); }
    public void info (String msg, Object... args) { delegate.info (msg, args); }
    public void warn (String msg, Object... args) { delegate.warn (msg, args); }
    public void error(String msg, Object... args) { delegate.error(msg, args); }

    // Overload comodo con Throwable
    public void warn (String msg, Throwable t)   { delegate.warn (msg, t); }
    public void error(String msg, Throwable t)   { delegate.error(msg, t); }
}
