package com.bit.hydro.ledger;

@FunctionalInterface
public interface LedgerAction<T> {
    T apply(LedgerContext context);
}
