package com.earningsbot.core;

public record ItemOutcome(
        String symbol,
        OutcomeStatus status,
        String detail
) {
    public ItemOutcome {
        symbol = symbol == null ? "" : symbol;
        status = status == null ? OutcomeStatus.ERROR : status;
        detail = detail == null ? "" : detail;
    }

    public static ItemOutcome newAlert(String symbol, String detail) {
        return new ItemOutcome(symbol, OutcomeStatus.NEW_ALERT, detail);
    }

    public static ItemOutcome duplicate(String symbol, String detail) {
        return new ItemOutcome(symbol, OutcomeStatus.DUPLICATE, detail);
    }

    public static ItemOutcome noSignal(String symbol, String detail) {
        return new ItemOutcome(symbol, OutcomeStatus.NO_SIGNAL, detail);
    }

    public static ItemOutcome noData(String symbol, String detail) {
        return new ItemOutcome(symbol, OutcomeStatus.NO_DATA, detail);
    }

    public static ItemOutcome rateLimited(String symbol, String detail) {
        return new ItemOutcome(symbol, OutcomeStatus.RATE_LIMITED, detail);
    }

    public static ItemOutcome error(String symbol, String detail) {
        return new ItemOutcome(symbol, OutcomeStatus.ERROR, detail);
    }
}
