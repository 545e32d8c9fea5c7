package ca.jonathanfritz.zkbcat.transactions;

/**
 * Whether money left the account or arrived in it. Derived solely from the presence of a sign on the statement amount.
 */
public enum Direction {

    /**
     * outflow, the statement amount carried a leading minus
     */
    DEBIT,

    /**
     * inflow, the statement amount was unsigned
     */
    CREDIT
}
