package ca.jonathanfritz.zkbcat.transactions;

/**
 * The closed set of spending categories. Declaration order is the priority order used when a description matches
 * the keywords of more than one category, so do not reorder these values.
 */
public enum Category {
    GROCERIES,
    TRANSPORT,
    RENT,
    UTILITIES,
    HEALTHCARE,
    DINING,
    SHOPPING,
    INSURANCE,
    SALARY,
    ENTERTAINMENT,
    EDUCATION,
    SAVINGS,
    OTHER
}
