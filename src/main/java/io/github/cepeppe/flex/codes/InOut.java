package io.github.cepeppe.flex.codes;

/** Direzione di un trasferimento titoli. */
public enum InOut implements CodeTable {
    IN("IN"),
    OUT("OUT");

    private final String code;

    InOut(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
