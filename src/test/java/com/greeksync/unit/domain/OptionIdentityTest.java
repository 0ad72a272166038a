package com.greeksync.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.greeksync.domain.enums.ContractType;
import com.greeksync.domain.enums.OptionRight;
import com.greeksync.domain.model.Position;
import com.greeksync.domain.vo.OptionIdentity;
import com.greeksync.unit.support.TestOptions;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OptionIdentityTest {

    @Test
    @DisplayName("Strike scale does not affect equality")
    void strikeIsNormalized() {
        OptionIdentity a = TestOptions.option("AAPL", "150", OptionRight.CALL);
        OptionIdentity b = TestOptions.option("AAPL", "150.00", OptionRight.CALL);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.toKey()).isEqualTo("AAPL|20250117|150|C|SMART|USD");
    }

    @Test
    @DisplayName("Canonical key parses back to an equal identity")
    void keyRoundTrip() {
        OptionIdentity identity = TestOptions.option("SPY", "432.5", OptionRight.PUT);

        assertThat(OptionIdentity.fromKey(identity.toKey())).isEqualTo(identity);
    }

    @Test
    @DisplayName("Missing exchange and currency are kept empty in the key")
    void optionalFieldsInKey() {
        OptionIdentity identity = OptionIdentity.builder()
                .symbol("qqq")
                .expiry(LocalDate.of(2025, 3, 21))
                .strike(new BigDecimal("400"))
                .right(OptionRight.CALL)
                .exchange(" ")
                .build();

        assertThat(identity.getSymbol()).isEqualTo("QQQ");
        assertThat(identity.getExchange()).isNull();
        assertThat(identity.toKey()).isEqualTo("QQQ|20250321|400|C||");
        assertThat(OptionIdentity.fromKey(identity.toKey())).isEqualTo(identity);
    }

    @Test
    @DisplayName("Malformed keys are rejected")
    void malformedKey() {
        assertThatThrownBy(() -> OptionIdentity.fromKey("AAPL_150_20250117_C"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OptionIdentity.fromKey("AAPL|20250117|abc|C|SMART|USD"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OptionIdentity.fromKey("AAPL|2025-01-17|150|C|SMART|USD"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Identity is derived from an option position")
    void fromPosition() {
        Position position = Position.builder()
                .symbol("AAPL")
                .contractType(ContractType.OPT)
                .exchange("SMART")
                .currency("USD")
                .strike(new BigDecimal("150.0"))
                .expiry("20250117")
                .right("C")
                .build();

        assertThat(OptionIdentity.fromPosition(position)).isEqualTo(TestOptions.AAPL_150C);
    }

    @Test
    @DisplayName("Stock positions have no option identity")
    void stockPositionRejected() {
        assertThatThrownBy(() -> OptionIdentity.fromPosition(TestOptions.stockPosition("AAPL", 100)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not an option");
    }
}
