package io.github.cepeppe.flex.codes;

/** Tipologia di movimento di cassa ({@code CashTransaction.type}). */
public enum CashAction implements CodeTable {
    DEPOSITS_WITHDRAWALS("Deposits/Withdrawals"),
    DEPOSITS_AND_WITHDRAWALS("Deposits & Withdrawals"),
    BROKER_INTEREST_PAID("Broker Interest Paid"),
    BROKER_INTEREST_RECEIVED("Broker Interest Received"),
    WITHHOLDING_TAX("Withholding Tax"),
    BOND_INTEREST_RECEIVED("Bond Interest Received"),
    BOND_INTEREST_PAID("Bond Interest Paid"),
    OTHER_FEES("Other Fees"),
    DIVIDENDS("Dividends"),
    PAYMENT_IN_LIEU("Payment In Lieu Of Dividends"),
    COMMISSION_ADJUSTMENTS("Commission Adjustments");

    private final String code;

    CashAction(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
