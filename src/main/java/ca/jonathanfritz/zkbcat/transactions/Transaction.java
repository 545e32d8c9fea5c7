package ca.jonathanfritz.zkbcat.transactions;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single transaction recovered from a statement line. Amounts are stored as a non-negative magnitude; the sign that
 * appeared on the statement is only used to pick the {@link Direction}.
 */
public class Transaction {

    public static final String UNKNOWN_DETAILS = "Unknown Transaction";

    private final LocalDate date;
    private final String details;
    private final BigDecimal amount;
    private final Direction direction;
    private Category category;

    private Transaction(Builder builder) {
        date = Objects.requireNonNull(builder.date, "date");
        details = StringUtils.isBlank(builder.details) ? UNKNOWN_DETAILS : builder.details.trim();
        amount = Objects.requireNonNull(builder.amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Transaction amount must not be negative, but was " + amount);
        }
        direction = Objects.requireNonNull(builder.direction, "direction");
        category = builder.category != null ? builder.category : Category.OTHER;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getDetails() {
        return details;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Direction getDirection() {
        return direction;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Lets the host override the category that was assigned when the transaction was parsed
     */
    public void setCategory(Category category) {
        this.category = Objects.requireNonNull(category, "category");
    }

    /**
     * The amount with the sign implied by its {@link Direction}: negative for debits, positive for credits
     */
    public BigDecimal getSignedAmount() {
        return direction == Direction.DEBIT ? amount.negate() : amount;
    }

    @Override
    public String toString() {
        return "Transaction{" +
                "date=" + date +
                ", details='" + details + '\'' +
                ", amount=" + amount +
                ", direction=" + direction +
                ", category=" + category +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return amount.compareTo(that.amount) == 0 &&
                direction == that.direction &&
                category == that.category &&
                Objects.equals(date, that.date) &&
                Objects.equals(details, that.details);
    }

    /**
     * Leaves out the category, which {@link #setCategory(Category)} may change while the transaction is held in a
     * hash-based collection
     */
    @Override
    public int hashCode() {
        return Objects.hash(date, details, amount.stripTrailingZeros(), direction);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Transaction copy) {
        return new Builder()
                .setDate(copy.getDate())
                .setDetails(copy.getDetails())
                .setAmount(copy.getAmount())
                .setDirection(copy.getDirection())
                .setCategory(copy.getCategory());
    }

    public static final class Builder {

        private LocalDate date;
        private String details;
        private BigDecimal amount;
        private Direction direction;
        private Category category;

        private Builder() {
        }

        public Builder setDate(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder setDetails(String details) {
            this.details = details;
            return this;
        }

        public Builder setAmount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder setDirection(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder setCategory(Category category) {
            this.category = category;
            return this;
        }

        public Transaction build() {
            return new Transaction(this);
        }
    }
}
