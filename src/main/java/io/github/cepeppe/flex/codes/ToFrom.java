package io.github.cepeppe.flex.codes;

/** Direzione di un trade transfer. */
public enum ToFrom implements CodeTable {
    TO("To"),
    FROM("From");

    private final String code;

    ToFrom(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
