package io.github.cepeppe.flex.codes;

/** Consegna/ricezione in un trade transfer. */
public enum DeliveredReceived implements CodeTable {
    DELIVERED("Delivered"),
    RECEIVED("Received");

    private final String code;

    DeliveredReceived(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }
}
