package io.github.cepeppe.flex.codes;

/** Tipologia di corporate action. */
public enum Reorg implements CodeTable {
    BOND_CONVERSION("BC"),
    BOND_MATURITY("BM"),
    CONTRACT_SOULTE("CA"),
    CONTRACT_CONSOLIDATION("CC"),
    CASH_DIVIDEND("CD"),
    CHOICE_DIVIDEND("CH"),
    CONVERTIBLE_ISSUE("CI"),
    CONTRACT_SPINOFF("CO"),
    COUPON_PAYMENT("CP"),
    CONTRACT_SPLIT("CS"),
    CFD_TERMINATION("CT"),
    DIVIDEND_RIGHTS_ISSUE("DI"),
    DELIST_WORTHLESS("DW"),
    EXPIRE_DIVIDEND_RIGHT("ED"),
    FEE_ALLOCATION("FA"),
    FORWARD_SPLIT_ISSUE("FI"),
    FORWARD_SPLIT("FS"),
    GENERIC_VOLUNTARY("GV"),
    CHOICE_DIVIDEND_DELIVERY("HD"),
    CHOICE_DIVIDEND_ISSUE("HI"),
    ISSUE_CHANGE("IC"),
    ASSET_PURCHASE("OR"),
    PURCHASE_ISSUE("PI"),
    PROXY_VOTE("PV"),
    RIGHTS_ISSUE("RI"),
    REVERSE_SPLIT("RS"),
    STOCK_DIVIDEND("SD"),
    SPINOFF("SO"),
    SUBSCRIBE_RIGHTS("SR"),
    MERGER("TC"),
    TENDER_ISSUE("TI"),
    TENDER("TO");

    private final String code;

    Reorg(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
