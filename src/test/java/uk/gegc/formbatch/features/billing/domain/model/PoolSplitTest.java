package uk.gegc.formbatch.features.billing.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PoolSplit")
class PoolSplitTest {

    @Nested
    @DisplayName("draw")
    class Draw {

        @Test
        @DisplayName("takes monthly, then rollover, then top-up")
        void drawsInPoolOrder() {
            PoolSplit drawn = PoolSplit.draw(new PoolSplit(3, 2, 5), 6);

            assertThat(drawn).isEqualTo(new PoolSplit(3, 2, 1));
            assertThat(drawn.total()).isEqualTo(6);
        }

        @Test
        @DisplayName("stays in the monthly pool when it covers the amount")
        void monthlyOnly() {
            assertThat(PoolSplit.draw(new PoolSplit(10, 4, 4), 7)).isEqualTo(new PoolSplit(7, 0, 0));
        }

        @Test
        @DisplayName("skips empty pools")
        void skipsEmptyPools() {
            assertThat(PoolSplit.draw(new PoolSplit(0, 0, 9), 4)).isEqualTo(new PoolSplit(0, 0, 4));
        }

        @Test
        @DisplayName("rejects an amount the pools cannot cover")
        void rejectsShortfall() {
            assertThatThrownBy(() -> PoolSplit.draw(new PoolSplit(1, 1, 1), 4))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects a negative amount")
        void rejectsNegative() {
            assertThatThrownBy(() -> PoolSplit.draw(new PoolSplit(1, 1, 1), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("refund")
    class Refund {

        @Test
        @DisplayName("returns top-up first, then rollover, then monthly")
        void refundsInReverseOrder() {
            PoolSplit drawn = new PoolSplit(3, 2, 1);

            assertThat(drawn.refund(1)).isEqualTo(new PoolSplit(0, 0, 1));
            assertThat(drawn.refund(2)).isEqualTo(new PoolSplit(0, 1, 1));
            assertThat(drawn.refund(4)).isEqualTo(new PoolSplit(1, 2, 1));
        }

        @Test
        @DisplayName("never returns more to a pool than was drawn from it")
        void boundedByDrawnAmounts() {
            PoolSplit drawn = new PoolSplit(3, 2, 1);

            assertThat(drawn.refund(6)).isEqualTo(drawn);
            assertThatThrownBy(() -> drawn.refund(7)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("charged part is what remains after the refund")
        void chargedRemainder() {
            PoolSplit drawn = new PoolSplit(3, 2, 1);
            PoolSplit refund = drawn.refund(2);

            assertThat(drawn.minus(refund)).isEqualTo(new PoolSplit(3, 1, 0));
        }
    }
}
