package ca.jonathanfritz.zkbcat.matching;

import ca.jonathanfritz.zkbcat.transactions.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Assigns a category to every transaction description that contains at least one of its keywords.
 * Keywords are case-insensitive substrings, so "coop" matches "COOP Zürich" as well as "Coop Pronto".
 */
public class CategoryRule {

    private Category category;
    private List<String> keywords = new ArrayList<>();

    // Default constructor for Jackson deserialization
    public CategoryRule() {}

    public CategoryRule(Category category, List<String> keywords) {
        this.category = category;
        setKeywords(keywords);
    }

    public Category getCategory() {
        return category;
    }

    public void setCategory(Category category) {
        this.category = category;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? keywords : new ArrayList<>();
    }

    /**
     * Tests whether any keyword of this rule occurs in the description.
     *
     * @param lowercaseDescription a transaction description that has already been lowercased with {@link Locale#ROOT}
     * @return true if the rule matches, false otherwise
     */
    public boolean matches(String lowercaseDescription) {
        if (category == null || lowercaseDescription == null || lowercaseDescription.isEmpty()) {
            return false;
        }

        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .anyMatch(lowercaseDescription::contains);
    }

    @Override
    public String toString() {
        return "CategoryRule{" + "category=" + category + ", keywords=" + keywords + '}';
    }
}
