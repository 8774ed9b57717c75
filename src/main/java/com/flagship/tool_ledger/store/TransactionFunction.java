package com.flagship.tool_ledger.store;

/**
 * Body of a store transaction. May be invoked more than once when the store retries
 * after a conflict, so it must not have side effects outside the transaction.
 */
@FunctionalInterface
public interface TransactionFunction<T> {

    T apply(StoreTransaction transaction);
}
