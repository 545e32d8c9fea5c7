package ca.jonathanfritz.zkbcat.matching;

import ca.jonathanfritz.zkbcat.transactions.Category;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The keyword table used to categorize transactions.
 * Rules are consulted in {@link Category} declaration order, whatever order they were listed in, so a description that
 * matches keywords of two categories always resolves to the category that is declared first. Rules for the same
 * category keep their listed order.
 */
public class CategoryRulesConfig {

    private int version = 1;
    private List<CategoryRule> rules = new ArrayList<>();

    // Default constructor for Jackson deserialization
    public CategoryRulesConfig() {}

    public CategoryRulesConfig(List<CategoryRule> rules) {
        setRules(rules);
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public List<CategoryRule> getRules() {
        return rules;
    }

    public void setRules(List<CategoryRule> rules) {
        this.rules = rules != null ? rules : new ArrayList<>();
    }

    /**
     * Finds the highest priority category that has a keyword contained in the description.
     *
     * @param lowercaseDescription the lowercased transaction description
     * @return the matching category, or empty if no rule matches
     */
    public Optional<Category> findMatchingCategory(String lowercaseDescription) {
        if (lowercaseDescription == null || lowercaseDescription.isEmpty()) {
            return Optional.empty();
        }

        return getRulesInPriorityOrder().stream()
                .filter(rule -> rule.matches(lowercaseDescription))
                .findFirst()
                .map(CategoryRule::getCategory);
    }

    /**
     * Returns the rules that have a category, sorted by category priority. The sort is stable.
     */
    @JsonIgnore
    public List<CategoryRule> getRulesInPriorityOrder() {
        return rules.stream()
                .filter(rule -> rule.getCategory() != null)
                .sorted(Comparator.comparing(CategoryRule::getCategory))
                .toList();
    }

    /**
     * Returns an empty configuration with no rules.
     */
    public static CategoryRulesConfig empty() {
        return new CategoryRulesConfig(new ArrayList<>());
    }
}
