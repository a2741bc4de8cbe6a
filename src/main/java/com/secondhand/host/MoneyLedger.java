package com.secondhand.host;

/**
 * Monetary ledger owned by the host application.
 */
public interface MoneyLedger {

    /**
     * Take {@code amount} from an owner's balance.
     *
     * @return false if the owner can't cover the amount; nothing is debited in that case
     */
    boolean debit(String ownerId, long amount);

    void credit(String ownerId, long amount);
}
