package io.github.cepeppe.flex.codes;

/** Tipologia di trade ({@code transactionType} di Trade e TradeConfirmation). */
public enum TradeType implements CodeTable {
    EXCH_TRADE("ExchTrade"),
    TRADE_CANCEL("TradeCancel"),
    FRAC_SHARE("FracShare"),
    FRAC_SHARE_CANCEL("FracShareCancel"),
    TRADE_CORRECT("TradeCorrect"),
    BOOK_TRADE("BookTrade"),
    DVP_TRADE("DvpTrade");

    private final String code;

    TradeType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
