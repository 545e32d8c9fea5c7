package ca.jonathanfritz.zkbcat.matching;

import ca.jonathanfritz.zkbcat.transactions.Category;
import com.google.inject.Inject;

import java.util.Locale;

/**
 * Maps a free-text transaction description to a {@link Category}. Categorization is pure and deterministic, so the
 * host can call it again at any time to recategorize a transaction.
 */
public class Categorizer {

    private final CategoryRulesConfig categoryRulesConfig;

    @Inject
    public Categorizer(CategoryRulesConfig categoryRulesConfig) {
        this.categoryRulesConfig = categoryRulesConfig;
    }

    /**
     * @param details the transaction description
     * @return the first category in priority order with a keyword contained in details, or {@link Category#OTHER}
     */
    public Category categorize(String details) {
        if (details == null || details.isBlank()) {
            return Category.OTHER;
        }

        return categoryRulesConfig.findMatchingCategory(details.toLowerCase(Locale.ROOT))
                .orElse(Category.OTHER);
    }
}
