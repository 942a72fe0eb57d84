package io.github.cepeppe.flex.codes;

/** Tipologia di trasferimento titoli. */
public enum TransferType implements CodeTable {
    INTERNAL("INTERNAL"),
    ACATS("ACATS");

    private final String code;

    TransferType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
