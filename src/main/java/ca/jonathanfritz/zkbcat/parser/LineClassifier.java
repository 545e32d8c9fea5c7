package ca.jonathanfritz.zkbcat.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes lines of statement text that belong to the document layout rather than to a transaction: page markers,
 * balance and account headers, the bank's name, separator rules and blank lines.
 */
public class LineClassifier {

    // anchored at the start of the stripped line, case-sensitive like the statement headers themselves
    private static final List<Pattern> NOISE_PATTERNS = List.of(
            Pattern.compile("^Page\\s+\\d+"),
            Pattern.compile("^Seite\\s+\\d+"),
            Pattern.compile("^IBAN"),
            Pattern.compile("^Saldo"),
            Pattern.compile("^Balance"),
            Pattern.compile("^Kontostand"),
            Pattern.compile("^Zürcher\\s+Kantonalbank"),
            Pattern.compile("^ZKB"),
            Pattern.compile("^Kontoauszug"),
            Pattern.compile("^Account\\s+Statement"),
            Pattern.compile("^-{3,}"),
            Pattern.compile("^={3,}")
    );

    /**
     * @return true if the line should be dropped before any attempt is made to parse it as a transaction
     */
    public boolean isNoise(String line) {
        if (line == null || line.isBlank()) {
            return true;
        }

        final String stripped = line.strip();
        return NOISE_PATTERNS.stream().anyMatch(p -> p.matcher(stripped).find());
    }
}
