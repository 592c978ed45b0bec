package com.flagship.split_ledger.mirror;

@FunctionalInterface
public interface MirrorEventListener {

    void onDebtSettled(MirrorSettlementEvent event);
}
