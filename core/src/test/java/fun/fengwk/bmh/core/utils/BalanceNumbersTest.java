package fun.fengwk.bmh.core.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BalanceNumbers tests.
 *
 * @author fengwk
 */
class BalanceNumbersTest {

    @Test
    void shouldFormatWithOneDecimal() {
        assertThat(BalanceNumbers.format(42.50D)).isEqualTo("$42.5");
        assertThat(BalanceNumbers.format(10D)).isEqualTo("$10.0");
        assertThat(BalanceNumbers.format(0.04D)).isEqualTo("$0.0");
        assertThat(BalanceNumbers.format(1234.56D)).isEqualTo("$1234.6");
    }

    @Test
    void shouldParseFirstNumber() {
        assertThat(BalanceNumbers.parseFirstNumber("$42.5")).isEqualTo(42.5D);
        assertThat(BalanceNumbers.parseFirstNumber("balance: $1,234.50 left")).isEqualTo(1234.5D);
        assertThat(BalanceNumbers.parseFirstNumber("-3.25 owed")).isEqualTo(-3.25D);
        assertThat(BalanceNumbers.parseFirstNumber(", then 7")).isEqualTo(7D);
    }

    @Test
    void shouldReturnNullWithoutNumber() {
        assertThat(BalanceNumbers.parseFirstNumber(null)).isNull();
        assertThat(BalanceNumbers.parseFirstNumber("  ")).isNull();
        assertThat(BalanceNumbers.parseFirstNumber("error")).isNull();
        assertThat(BalanceNumbers.parseFirstNumber("API failed")).isNull();
    }

}
