package io.github.cepeppe.flex.codes;

/** Lato della posizione aperta. */
public enum LongShort implements CodeTable {
    LONG("Long"),
    SHORT("Short");

    private final String code;

    LongShort(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
