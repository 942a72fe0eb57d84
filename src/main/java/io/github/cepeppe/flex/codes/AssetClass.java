package io.github.cepeppe.flex.codes;

/** Categoria dello strumento ({@code assetCategory}). */
public enum AssetClass implements CodeTable {
    CASH("CASH"),
    BILL("BILL"),
    BOND("BOND"),
    STOCK("STK"),
    OPTION("OPT"),
    WARRANT("WAR"),
    FUTURE("FUT"),
    FUTURE_OPTION("FOP"),
    CFD("CFD");

    private final String code;

    AssetClass(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
