package ca.jonathanfritz.zkbcat.transactions;

import ca.jonathanfritz.zkbcat.exception.ErrorKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of parsing one statement. A result is either {@link Outcome#COMPLETED}, holding zero or more transactions
 * and at most one soft warning, or a {@link Outcome#STRUCTURAL_FAILURE} holding no transactions and a single fatal
 * error. Instances are immutable; the transactions themselves stay mutable so that the host can recategorize them
 * during the dry run.
 */
public final class ParseResult {

    public enum Outcome {
        COMPLETED,
        STRUCTURAL_FAILURE
    }

    private final Outcome outcome;
    private final ErrorKind failureKind;
    private final List<Transaction> transactions;
    private final List<String> rawLines;
    private final List<String> parseErrors;
    private final String sourceName;

    private ParseResult(Outcome outcome, ErrorKind failureKind, List<Transaction> transactions, List<String> rawLines,
                        List<String> parseErrors, String sourceName) {
        this.outcome = outcome;
        this.failureKind = failureKind;
        this.transactions = List.copyOf(transactions);
        this.rawLines = List.copyOf(rawLines);
        this.parseErrors = List.copyOf(parseErrors);
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    }

    /**
     * A parse that ran to the end. Zero transactions is a legitimate outcome.
     */
    public static ParseResult completed(String sourceName, List<Transaction> transactions, List<String> rawLines,
                                        List<String> parseErrors) {
        return new ParseResult(Outcome.COMPLETED, null, transactions, rawLines, parseErrors, sourceName);
    }

    /**
     * A parse that was stopped by a fatal validation problem before any line was examined
     */
    public static ParseResult structuralFailure(String sourceName, ErrorKind kind, String reason) {
        if (!kind.isFatal()) {
            throw new IllegalArgumentException(kind + " is not a fatal error kind");
        }
        return new ParseResult(Outcome.STRUCTURAL_FAILURE, kind, List.of(), List.of(), List.of(reason), sourceName);
    }

    /**
     * Returns a copy of this result under a different display name
     */
    public ParseResult withSourceName(String newSourceName) {
        return new ParseResult(outcome, failureKind, transactions, rawLines, parseErrors, newSourceName);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isStructuralFailure() {
        return outcome == Outcome.STRUCTURAL_FAILURE;
    }

    /**
     * The kind of fatal error that stopped the parse, or empty if the parse completed
     */
    public Optional<ErrorKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    public List<Transaction> getTransactions() {
        return transactions;
    }

    public List<String> getRawLines() {
        return rawLines;
    }

    public List<String> getParseErrors() {
        return parseErrors;
    }

    public String getSourceName() {
        return sourceName;
    }

    public long getCreditCount() {
        return count(Direction.CREDIT);
    }

    public long getDebitCount() {
        return count(Direction.DEBIT);
    }

    /**
     * Sums the amounts of every transaction in the given direction
     */
    public BigDecimal getTotal(Direction direction) {
        return transactions.stream()
                .filter(t -> t.getDirection() == direction)
                .map(Transaction::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Credits minus debits
     */
    public BigDecimal getBalance() {
        return getTotal(Direction.CREDIT).subtract(getTotal(Direction.DEBIT));
    }

    private long count(Direction direction) {
        return transactions.stream().filter(t -> t.getDirection() == direction).count();
    }

    @Override
    public String toString() {
        return "ParseResult{" +
                "outcome=" + outcome +
                ", sourceName='" + sourceName + '\'' +
                ", transactions=" + transactions.size() +
                ", rawLines=" + rawLines.size() +
                ", parseErrors=" + parseErrors +
                '}';
    }
}
