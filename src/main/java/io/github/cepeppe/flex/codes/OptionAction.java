package io.github.cepeppe.flex.codes;

/** Evento su opzione (esercizio, assegnazione, scadenza). */
public enum OptionAction implements CodeTable {
    ASSIGNMENT("Assignment"),
    EXERCISE("Exercise"),
    EXPIRATION("Expiration"),
    SELL("Sell");

    private final String code;

    OptionAction(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
