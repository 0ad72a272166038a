package com.greeksync.domain.vo;

import com.greeksync.domain.enums.ContractType;
import com.greeksync.domain.enums.OptionRight;
import com.greeksync.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable key for a single option contract. The same identity is used for the
 * feed subscription, the fetch outcome, and the cache record.
 *
 * <p>Strike is normalized (trailing zeros stripped) so that 150, 150.0 and 150.00
 * produce equal identities. Exchange and currency are optional; the terminal omits
 * the exchange for some portfolio items.
 *
 * <p>The canonical key is {@code SYMBOL|EXPIRY|STRIKE|RIGHT|EXCHANGE|CURRENCY}, e.g.
 * {@code AAPL|20250117|150|C|SMART|USD}. {@link #fromKey(String)} parses it back.
 */
@Value
public class OptionIdentity {

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String SEPARATOR = "|";

    String symbol;
    LocalDate expiry;
    BigDecimal strike;
    OptionRight right;
    String exchange;
    String currency;

    @Builder
    public OptionIdentity(
            String symbol, LocalDate expiry, BigDecimal strike, OptionRight right, String exchange, String currency) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Option symbol is required");
        }
        this.symbol = symbol.trim().toUpperCase();
        this.expiry = Objects.requireNonNull(expiry, "expiry");
        this.strike = Objects.requireNonNull(strike, "strike").stripTrailingZeros();
        this.right = Objects.requireNonNull(right, "right");
        this.exchange = blankToNull(exchange);
        this.currency = blankToNull(currency);
    }

    /**
     * Builds the identity of an option position.
     *
     * @throws IllegalArgumentException if the position is not an option or lacks strike/expiry/right
     */
    public static OptionIdentity fromPosition(Position position) {
        if (position.getContractType() != ContractType.OPT) {
            throw new IllegalArgumentException("Not an option position: " + position.getSymbol());
        }
        if (position.getStrike() == null || position.getExpiry() == null || position.getRight() == null) {
            throw new IllegalArgumentException("Option position " + position.getLocalSymbol()
                    + " is missing strike, expiry or right");
        }
        return OptionIdentity.builder()
                .symbol(position.getSymbol())
                .expiry(parseExpiry(position.getExpiry()))
                .strike(position.getStrike())
                .right(OptionRight.fromCode(position.getRight()))
                .exchange(position.getExchange())
                .currency(position.getCurrency())
                .build();
    }

    /** Parses a canonical key produced by {@link #toKey()}. */
    public static OptionIdentity fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Identity key is required");
        }
        String[] parts = key.split("\\|", -1);
        if (parts.length != 6) {
            throw new IllegalArgumentException("Malformed identity key: " + key);
        }
        try {
            return OptionIdentity.builder()
                    .symbol(parts[0])
                    .expiry(parseExpiry(parts[1]))
                    .strike(new BigDecimal(parts[2]))
                    .right(OptionRight.fromCode(parts[3]))
                    .exchange(parts[4])
                    .currency(parts[5])
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed strike in identity key: " + key, e);
        }
    }

    public String toKey() {
        return String.join(
                SEPARATOR,
                symbol,
                EXPIRY_FORMAT.format(expiry),
                strike.toPlainString(),
                right.getCode(),
                exchange == null ? "" : exchange,
                currency == null ? "" : currency);
    }

    /** Short label for logs, e.g. {@code AAPL 20250117 150C}. */
    public String toDisplayString() {
        return symbol + " " + EXPIRY_FORMAT.format(expiry) + " " + strike.toPlainString() + right.getCode();
    }

    private static LocalDate parseExpiry(String expiry) {
        try {
            return LocalDate.parse(expiry.trim(), EXPIRY_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unsupported option expiry (expected yyyyMMdd): " + expiry, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim().toUpperCase();
    }
}
