package io.github.cepeppe.flex.codes;

/** Lato del trade; le varianti {@code (Ca.)} indicano un trade cancellato. */
public enum BuySell implements CodeTable {
    BUY("BUY"),
    CANCEL_BUY("BUY (Ca.)"),
    SELL("SELL"),
    CANCEL_SELL("SELL (Ca.)");

    private final String code;

    BuySell(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
