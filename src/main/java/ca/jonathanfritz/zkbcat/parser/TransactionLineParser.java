package ca.jonathanfritz.zkbcat.parser;

import ca.jonathanfritz.zkbcat.config.AppConfig;
import ca.jonathanfritz.zkbcat.matching.Categorizer;
import ca.jonathanfritz.zkbcat.transactions.Direction;
import ca.jonathanfritz.zkbcat.transactions.Transaction;
import com.google.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a single line of statement text into a {@link Transaction}.
 * <p>
 * A transaction line starts with a date like 15.01.2026 or 15.01.26, followed by a description, followed by an amount
 * like CHF 45.80, -7'500.00 or 12,50. When the text after the date contains more than one amount, the last one is the
 * transaction amount and anything before it is part of the description. An amount with a leading minus is a
 * {@link Direction#DEBIT}; any other amount is a {@link Direction#CREDIT}.
 * <p>
 * Lines that do not have this shape are not errors: {@link #parse(String)} simply returns an empty optional.
 */
public class TransactionLineParser {

    private static final Locale STATEMENT_LOCALE = Locale.forLanguageTag("de-CH");

    private static final Pattern DATE_PATTERN = Pattern.compile("(?<!\\d)(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4}|\\d{2})(?!\\d)");

    private static final DateTimeFormatter FOUR_DIGIT_YEAR = DateTimeFormatter.ofPattern("d.M.uuuu", STATEMENT_LOCALE)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TWO_DIGIT_YEAR = new DateTimeFormatterBuilder()
            .appendPattern("d.M.")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
            .toFormatter(STATEMENT_LOCALE)
            .withResolverStyle(ResolverStyle.STRICT);

    private final Categorizer categorizer;
    private final Pattern amountPattern;

    @Inject
    public TransactionLineParser(Categorizer categorizer, AppConfig appConfig) {
        this(categorizer, appConfig.getCurrencyCodes());
    }

    public TransactionLineParser(Categorizer categorizer, List<String> currencyCodes) {
        this.categorizer = categorizer;
        this.amountPattern = buildAmountPattern(currencyCodes);
    }

    /**
     * Groups: 1 = currency code, 2 = minus sign, 3 = integer part with optional ' thousands separators,
     * 4 = two digit fraction. An amount may not touch letters, digits or other separators on either side.
     */
    static Pattern buildAmountPattern(List<String> currencyCodes) {
        final String currencies = currencyCodes.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(c -> Pattern.quote(c.strip()))
                .collect(Collectors.joining("|"));
        final String currencyPrefix = currencies.isEmpty() ? "" : "(?:(" + currencies + ")\\s*)?";

        return Pattern.compile("(?<![\\p{L}\\p{N}'.,])"
                + currencyPrefix
                + "(-)?"
                + "(\\d{1,3}(?:'\\d{3})+|\\d+)"
                + "(?:[.,](\\d{2}))?"
                + "(?![\\p{L}\\p{N}']|[.,]\\p{N})");
    }

    /**
     * Attempts to parse a line of statement text as a transaction
     *
     * @param line the line, with or without surrounding whitespace
     * @return the categorized transaction, or empty if the line has no valid date followed by an amount
     */
    public Optional<Transaction> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        final Matcher dateMatcher = DATE_PATTERN.matcher(line);
        if (!dateMatcher.find()) {
            return Optional.empty();
        }

        final Optional<LocalDate> date = parseDate(dateMatcher.group());
        if (date.isEmpty()) {
            return Optional.empty();
        }

        // earlier amount-shaped tokens are part of the description, i.e. street numbers or a year
        final Matcher amountMatcher = amountPattern.matcher(line);
        amountMatcher.region(dateMatcher.end(), line.length()).useTransparentBounds(true);
        MatchResult lastAmount = null;
        while (amountMatcher.find()) {
            lastAmount = amountMatcher.toMatchResult();
        }
        if (lastAmount == null) {
            return Optional.empty();
        }

        final String details = StringUtils.defaultIfBlank(line.substring(dateMatcher.end(), lastAmount.start()).strip(),
                Transaction.UNKNOWN_DETAILS);
        final Direction direction = lastAmount.group(2) != null ? Direction.DEBIT : Direction.CREDIT;

        return Optional.of(Transaction.newBuilder()
                .setDate(date.get())
                .setDetails(details)
                .setAmount(parseAmount(lastAmount.group(3), lastAmount.group(4)))
                .setDirection(direction)
                .setCategory(categorizer.categorize(details))
                .build());
    }

    static Optional<LocalDate> parseDate(String dateToken) {
        for (DateTimeFormatter formatter : List.of(FOUR_DIGIT_YEAR, TWO_DIGIT_YEAR)) {
            try {
                return Optional.of(LocalDate.parse(dateToken, formatter));
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return Optional.empty();
    }

    private static BigDecimal parseAmount(String integerPart, String fraction) {
        final String digits = integerPart.replace("'", "");
        return new BigDecimal(fraction != null ? digits + "." + fraction : digits);
    }
}
