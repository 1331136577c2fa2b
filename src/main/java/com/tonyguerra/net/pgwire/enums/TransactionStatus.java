package com.tonyguerra.net.pgwire.enums;

/**
 * Backend transaction status as reported by ReadyForQuery.
 */
public enum TransactionStatus {
    IDLE('I'),
    IN_TRANSACTION('T'),
    FAILED('E'),
    UNKNOWN('?');

    private final char indicator;

    TransactionStatus(char indicator) {
        this.indicator = indicator;
    }

    public char indicator() {
        return indicator;
    }

    public static TransactionStatus of(byte indicator) {
        for (final var status : values()) {
            if (status.indicator == indicator) {
                return status;
            }
        }

        return UNKNOWN;
    }
}
