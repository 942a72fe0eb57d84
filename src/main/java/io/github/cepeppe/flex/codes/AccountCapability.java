package io.github.cepeppe.flex.codes;

/** Capability del conto ({@code AccountInformation@accountCapabilities}). */
public enum AccountCapability implements CodeTable {
    CASH("Cash"),
    MARGIN("Margin"),
    PORTFOLIO_MARGIN("Portfolio Margin"),
    IB_PRIME("IBPrime");

    private final String code;

    AccountCapability(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
