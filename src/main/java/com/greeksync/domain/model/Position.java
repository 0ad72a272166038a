package com.greeksync.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.greeksync.domain.enums.ContractType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A held instrument in the brokerage account, as reported by the position source.
 *
 * <p>Field names bind to the snake_case position export ({@code contract_type},
 * {@code avg_cost}, ...). Quantity is signed: positive = long, negative = short,
 * and is exported under the key {@code position}.
 *
 * <p>Strike, expiry and right are only populated for {@link ContractType#OPT}.
 * Expiry keeps the terminal's raw {@code yyyyMMdd} form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String symbol;
    private ContractType contractType;
    private String exchange;
    private String currency;

    @JsonAlias("position")
    private BigDecimal quantity;

    private BigDecimal avgCost;
    private BigDecimal marketPrice;
    private BigDecimal marketValue;
    private BigDecimal unrealizedPnl;
    private BigDecimal realizedPnl;

    private String account;

    /** Contract multiplier; 100 for equity options. */
    private Integer multiplier;

    private String localSymbol;

    private BigDecimal strike;
    private String expiry;

    /** "C" or "P". */
    private String right;

    private LocalDateTime updateTime;

    public boolean isOption() {
        return contractType == ContractType.OPT;
    }

    /** Local symbol when the terminal reported one, otherwise the underlying symbol. */
    public String toDisplayString() {
        return localSymbol != null ? localSymbol : symbol;
    }
}
