package io.github.cepeppe.flex.codes;

/** Tipologia d'ordine. */
public enum OrderType implements CodeTable {
    LIMIT("LMT"),
    MARKET("MKT"),
    MARKET_ON_CLOSE("MOC");

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
