package ca.jonathanfritz.zkbcat.transactions;

import static org.junit.jupiter.api.Assertions.*;

import ca.jonathanfritz.zkbcat.exception.ErrorKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParseResultTest {

    @Test
    void summarizesCreditsAndDebits() {
        // Setup
        List<Transaction> transactions = List.of(
                transaction("87.35", Direction.CREDIT),
                transaction("45.80", Direction.CREDIT),
                transaction("17.90", Direction.DEBIT));

        // Execute
        ParseResult result = ParseResult.completed("statement.pdf", transactions, List.of(), List.of());

        // Verify
        assertEquals(2, result.getCreditCount());
        assertEquals(1, result.getDebitCount());
        assertEquals(new BigDecimal("133.15"), result.getTotal(Direction.CREDIT));
        assertEquals(new BigDecimal("17.90"), result.getTotal(Direction.DEBIT));
        assertEquals(new BigDecimal("115.25"), result.getBalance());
        assertFalse(result.isStructuralFailure());
        assertTrue(result.getFailureKind().isEmpty());
    }

    @Test
    void emptyResultHasZeroTotals() {
        // Execute
        ParseResult result = ParseResult.completed("statement.pdf", List.of(), List.of(), List.of("warning"));

        // Verify
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getBalance()));
        assertEquals(0, result.getCreditCount());
    }

    @Test
    void structuralFailureHoldsSingleReason() {
        // Execute
        ParseResult result = ParseResult.structuralFailure("statement.pdf", ErrorKind.PAGE_LIMIT_EXCEEDED, "too many pages");

        // Verify
        assertTrue(result.isStructuralFailure());
        assertEquals(ErrorKind.PAGE_LIMIT_EXCEEDED, result.getFailureKind().orElseThrow());
        assertTrue(result.getTransactions().isEmpty());
        assertTrue(result.getRawLines().isEmpty());
        assertEquals(List.of("too many pages"), result.getParseErrors());
    }

    @Test
    void softWarningCannotBeStructuralFailure() {
        assertThrows(IllegalArgumentException.class,
                () -> ParseResult.structuralFailure("statement.pdf", ErrorKind.NO_TRANSACTIONS_FOUND, "none"));
    }

    @Test
    void listsAreImmutableCopies() {
        // Setup
        List<String> rawLines = new ArrayList<>(List.of("line 1"));
        ParseResult result = ParseResult.completed("statement.pdf", List.of(), rawLines, List.of());

        // Execute: Modify the list that was passed in
        rawLines.add("line 2");

        // Verify: The result is not affected, and cannot be modified directly
        assertEquals(List.of("line 1"), result.getRawLines());
        assertThrows(UnsupportedOperationException.class, () -> result.getRawLines().add("line 3"));
    }

    @Test
    void withSourceNameKeepsEverythingElse() {
        // Setup
        ParseResult result = ParseResult.completed("0b1e.pdf", List.of(transaction("1.00", Direction.DEBIT)),
                List.of("raw"), List.of());

        // Execute
        ParseResult renamed = result.withSourceName("januar.pdf");

        // Verify
        assertEquals("januar.pdf", renamed.getSourceName());
        assertEquals(result.getTransactions(), renamed.getTransactions());
        assertEquals(result.getRawLines(), renamed.getRawLines());
        assertEquals(result.getOutcome(), renamed.getOutcome());
    }

    private static Transaction transaction(String amount, Direction direction) {
        return Transaction.newBuilder()
                .setDate(LocalDate.of(2026, 1, 1))
                .setDetails("test")
                .setAmount(new BigDecimal(amount))
                .setDirection(direction)
                .build();
    }
}
