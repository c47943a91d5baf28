package com.commerce.core.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommerceExceptionTest {

    @Test
    void onlyTransientPaymentFailuresAreRetryable() {
        assertThat(ErrorCode.GATEWAY_ERROR.isRetryable()).isTrue();
        assertThat(ErrorCode.NETWORK_ERROR.isRetryable()).isTrue();
        assertThat(ErrorCode.TIMEOUT_ERROR.isRetryable()).isTrue();

        assertThat(ErrorCode.VALIDATION_FAILED.isRetryable()).isFalse();
        assertThat(ErrorCode.INSUFFICIENT_FUNDS.isRetryable()).isFalse();
        assertThat(ErrorCode.UNKNOWN.isRetryable()).isFalse();
    }

    @Test
    void foreignExceptionsClassifyAsUnknown() {
        assertThat(CommerceException.classify(new IllegalStateException("bug"))).isEqualTo(ErrorCode.UNKNOWN);
        assertThat(CommerceException.classify(new InsufficientStockException("none left")))
                .isEqualTo(ErrorCode.INSUFFICIENT_STOCK);
    }
}
