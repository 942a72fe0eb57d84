package io.github.cepeppe.flex.codes;

/** Indicatore apertura/chiusura di posizione. */
public enum OpenClose implements CodeTable {
    OPEN("O"),
    CLOSE("C"),
    CLOSE_OPEN("C;O");

    private final String code;

    OpenClose(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
