package com.commerce.saga.refund;

import com.commerce.saga.orchestration.SagaDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class RefundSagaConfig {

    public static final String SAGA_TYPE = "REFUND";

    @Bean
    public SagaDefinition refundSaga(RecordRefundInitiatedStep recordInitiated,
                                     GatewayRefundStep gatewayRefund,
                                     RecordRefundProcessedStep recordProcessed,
                                     RestockStep restock) {
        return new SagaDefinition(SAGA_TYPE, List.of(recordInitiated, gatewayRefund, recordProcessed, restock));
    }
}
