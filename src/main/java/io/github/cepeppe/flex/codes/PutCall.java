package io.github.cepeppe.flex.codes;

/** Tipo di opzione. */
public enum PutCall implements CodeTable {
    PUT("P"),
    CALL("C");

    private final String code;

    PutCall(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
