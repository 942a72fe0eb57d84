package io.github.cepeppe.flex.codes;

/** Livello di dettaglio di una riga (esecuzione, ordine, lotto, riepilogo). */
public enum LevelOfDetail implements CodeTable {
    EXECUTION("EXECUTION"),
    ORDER("ORDER"),
    CLOSED_LOT("CLOSED_LOT"),
    TRADE_TRANSFERS("TRADE_TRANSFERS"),
    LOT("LOT"),
    SUMMARY("SUMMARY"),
    SYMBOL_SUMMARY("SYMBOL_SUMMARY");

    private final String code;

    LevelOfDetail(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
