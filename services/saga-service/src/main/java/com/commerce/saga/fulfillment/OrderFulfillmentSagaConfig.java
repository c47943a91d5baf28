package com.commerce.saga.fulfillment;

import com.commerce.saga.orchestration.SagaDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OrderFulfillmentSagaConfig {

    public static final String SAGA_TYPE = "ORDER_FULFILLMENT";

    @Bean
    public SagaDefinition orderFulfillmentSaga(ReserveStockStep reserveStock,
                                               CapturePaymentStep capturePayment,
                                               CommitStockStep commitStock) {
        return new SagaDefinition(SAGA_TYPE, List.of(reserveStock, capturePayment, commitStock));
    }
}
