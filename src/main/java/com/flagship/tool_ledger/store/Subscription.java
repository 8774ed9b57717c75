package com.flagship.tool_ledger.store;

public interface Subscription {

    void cancel();

    boolean isActive();
}
