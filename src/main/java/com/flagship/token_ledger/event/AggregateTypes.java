package com.flagship.token_ledger.event;

public final class AggregateTypes {

    public static final String TOKEN = "Token";
    public static final String PENDING_TRANSFER = "PendingTransfer";

    private AggregateTypes() {
    }
}
