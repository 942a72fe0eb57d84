package io.github.cepeppe.flex.codes;

/**
 * Permessi di trading del conto ({@code AccountInformation@tradingPermissions}).
 * Il testo è quello della pagina "Trading Permissions" del portale, spazi inclusi.
 */
public enum TradingPermission implements CodeTable {
    STOCKS("Stocks"),
    OPTIONS("Options"),
    MUTUAL_FUNDS("Mutual Funds"),
    FUTURES("Futures"),
    FOREX("Forex"),
    BONDS("Bonds"),
    CFDS("CFDs"),
    IBG_NOTES("IBG Notes"),
    WARRANTS("Warrants"),
    US_TREASURY_BILLS("US Treasury Bills"),
    FUTURES_OPTIONS("Futures Options"),
    SSF("SSF"),
    STOCK_LOAN("Stock Loan"),
    STOCK_BORROW("Stock Borrow");

    private final String code;

    TradingPermission(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
