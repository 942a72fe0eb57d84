package io.github.cepeppe.flex.codes;

/**
 * Flag usati negli attributi {@code notes} e {@code code} (liste di codici separate da {@code ;}).
 * <p>
 * Nei documenti legacy alcuni flag mono-carattere possono comparire concatenati senza separatore
 * (es. {@code "OP"} = Opening + Partial): vedi {@code CoercionOptions#isLegacyCodeRuns()}.
 */
public enum Code implements CodeTable {
    ASSIGNMENT("A"),
    AUTO_EXERCISE("AEx"),            // esercizio automatico per dividendo
    ADJUSTMENT("Adj"),
    ALLOCATION("Al"),
    AWAY("Aw"),                      // away trade
    BUY_IN("B"),                     // buy-in automatico
    BORROW("Bo"),                    // direct borrow
    CLOSING("C"),
    CASH_DELIVERY("CD"),
    COMPLEX("CP"),                   // posizione complessa
    CANCEL("Ca"),
    CORRECT("Co"),
    CROSSING("Cx"),                  // crossing eseguito come dual agent
    DUAL("D"),                       // solo trade confirm
    ETF("ETF"),                      // creazione/rimborso ETF
    EXPIRED("Ep"),
    EXERCISE("Ex"),
    GUARANTEED("G"),
    HIGHEST_COST("HC"),              // metodo di abbinamento lotti
    HF_INVESTMENT("HFI"),
    HF_REDEMPTION("HFR"),
    INTERNAL("I"),
    AFFILIATE("IA"),                 // eseguito contro un affiliato del broker
    INVESTOR("INV"),
    MARGIN_LOW("L"),                 // margin violation
    WASH_SALE("LD"),                 // loss disallowed da wash sale
    LIFO("LI"),
    LONG_TERM("LT"),
    LOAN("Lo"),                      // direct loan
    MANUAL("M"),
    MANUAL_EXERCISE("MEx"),
    MAX_LOSS("ML"),
    MAX_LT_GAIN("MLG"),
    MAX_LT_LOSS("MLL"),
    MAX_ST_GAIN("MSG"),
    MAX_ST_LOSS("MSL"),
    OPENING("O"),
    PARTIAL("P"),
    PRICE_IMPROVEMENT("PI"),
    POST_ACCRUAL("Po"),
    PRINCIPAL("Pr"),
    REINVESTMENT("R"),
    REDEMPTION("RED"),
    REVERSE("Re"),                   // storno di accrual
    REIMBURSEMENT("Ri"),
    SOLICITED_IB("SI"),
    SPECIFIC_LOT("SL"),
    SOLICITED_OTHER("SO"),
    SHORTENED_SETTLEMENT("SS"),
    SHORT_TERM("ST"),
    STOCK_YIELD("SY"),
    TRANSFER("T");

    private final String code;

    Code(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
