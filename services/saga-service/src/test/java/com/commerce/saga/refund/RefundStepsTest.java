package com.commerce.saga.refund;

import com.commerce.core.eventlog.EventLog;
import com.commerce.events.AggregateTypes;
import com.commerce.events.EventTypes;
import com.commerce.events.refund.RefundCompletedEvent;
import com.commerce.events.serde.EventObjectMapper;
import com.commerce.inventory.gateway.InventoryGateway;
import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.entity.EntryType;
import com.commerce.ledger.service.LedgerEntryInput;
import com.commerce.saga.ledger.StepPostings;
import com.commerce.saga.orchestration.RetryPolicy;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.StepResult;
import com.commerce.saga.payment.GatewayRefund;
import com.commerce.saga.payment.GatewayTimeoutException;
import com.commerce.saga.payment.InsufficientFundsException;
import com.commerce.saga.payment.PaymentGateway;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Refund saga steps")
class RefundStepsTest {

    private static final UUID SAGA_ID = UUID.fromString("aaaaaaaa-aaaa-aaaa-aaaa-aaaaaaaaaaaa");
    private static final UUID REFUND_ID = UUID.fromString("bbbbbbbb-bbbb-bbbb-bbbb-bbbbbbbbbbbb");
    private static final UUID INVENTORY_ID = UUID.fromString("cccccccc-cccc-cccc-cccc-cccccccccccc");

    @Mock
    private StepPostings postings;

    @Mock
    private EventLog eventLog;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private InventoryGateway inventoryGateway;

    @Mock
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    private static RefundRequest request(UUID restockInventoryId, int restockQuantity) {
        return new RefundRequest(REFUND_ID, "order-1", "cust-1", "pay_1", new BigDecimal("50.00"), "USD",
                "damaged", restockInventoryId, restockQuantity);
    }

    private static SagaContext context(RefundRequest request, ObjectNode stepResults, int attempt) {
        return new SagaContext(SAGA_ID, RefundSagaConfig.SAGA_TYPE, "corr-1", "tenant", "agent-7",
                EventObjectMapper.instance().valueToTree(request), stepResults, attempt);
    }

    private static SagaContext context(RefundRequest request) {
        return context(request, EventObjectMapper.instance().createObjectNode(), 0);
    }

    private static StepPostings.Posting posting(String key, boolean created) {
        return new StepPostings.Posting(key, List.of(), created);
    }

    @Nested
    @DisplayName("record-refund-initiated")
    class RecordInitiatedTests {

        @Test
        @DisplayName("Should book the liability pair and announce the refund")
        @SuppressWarnings("unchecked")
        void shouldPostAndAnnounce() {
            // Arrange
            String key = SAGA_ID + ":" + RecordRefundInitiatedStep.STEP_ID;
            when(postings.post(eq(key), anyList())).thenReturn(posting(key, true));
            RecordRefundInitiatedStep step = new RecordRefundInitiatedStep(postings, eventLog, transactionTemplate);

            // Act
            StepResult result = step.execute(context(request(null, 0)));

            // Assert
            assertThat(result.isSuccess()).isTrue();
            ArgumentCaptor<List<LedgerEntryInput>> captor = ArgumentCaptor.forClass(List.class);
            verify(postings).post(eq(key), captor.capture());
            assertThat(captor.getValue()).extracting(LedgerEntryInput::accountType)
                    .containsExactly(AccountType.CUSTOMER, AccountType.PLATFORM);
            assertThat(captor.getValue()).extracting(LedgerEntryInput::createdBy).containsOnly("agent-7");
            verify(eventLog).appendNext(eq(AggregateTypes.REFUND), eq(REFUND_ID), eq(EventTypes.REFUND_CREATED),
                    any(), eq("corr-1"));
        }

        @Test
        @DisplayName("Should not announce the refund again when the posting already existed")
        void shouldNotAnnounceTwice() {
            // Arrange
            when(postings.post(anyString(), anyList())).thenReturn(posting("k", false));
            RecordRefundInitiatedStep step = new RecordRefundInitiatedStep(postings, eventLog, transactionTemplate);

            // Act
            step.execute(context(request(null, 0)));

            // Assert
            verifyNoInteractions(eventLog);
        }

        @Test
        @DisplayName("Should reverse its posting on compensation")
        void shouldReverseOnCompensation() {
            // Arrange
            RecordRefundInitiatedStep step = new RecordRefundInitiatedStep(postings, eventLog, transactionTemplate);

            // Act
            step.compensate(context(request(null, 0)));

            // Assert
            verify(postings).reverse(SAGA_ID + ":" + RecordRefundInitiatedStep.STEP_ID, "refund compensated",
                    "agent-7");
        }
    }

    @Nested
    @DisplayName("gateway-refund")
    class GatewayRefundTests {

        private GatewayRefundStep step;

        @BeforeEach
        void setUp() {
            step = new GatewayRefundStep(paymentGateway, new RetryPolicy(3, Duration.ofMinutes(1)));
        }

        @Test
        @DisplayName("Should pass the saga's idempotency key to the gateway")
        void shouldUseIdempotencyKey() {
            // Arrange
            GatewayRefund refund = new GatewayRefund("rfnd_1", "succeeded", new BigDecimal("1.45"));
            when(paymentGateway.refund(eq("pay_1"), argThat(amount -> amount.compareTo(new BigDecimal("50")) == 0),
                    eq("USD"), eq(SAGA_ID + ":" + GatewayRefundStep.STEP_ID))).thenReturn(refund);

            // Act
            StepResult result = step.execute(context(request(null, 0)));

            // Assert
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.data().get("gatewayRefundId").asText()).isEqualTo("rfnd_1");
        }

        @Test
        @DisplayName("Should ask for a retry with exponential backoff on timeouts")
        void shouldRetryTimeouts() {
            // Arrange
            when(paymentGateway.refund(anyString(), any(), anyString(), anyString()))
                    .thenThrow(new GatewayTimeoutException("slow"));

            // Act
            StepResult result = step.execute(context(request(null, 0), EventObjectMapper.instance().createObjectNode(), 2));

            // Assert
            assertThat(result.outcome()).isEqualTo(StepResult.Outcome.RETRY);
            assertThat(result.retryAfter()).isEqualTo(Duration.ofMinutes(4));
        }

        @Test
        @DisplayName("Should fail once retries are exhausted")
        void shouldFailAfterLastRetry() {
            // Arrange
            when(paymentGateway.refund(anyString(), any(), anyString(), anyString()))
                    .thenThrow(new GatewayTimeoutException("slow"));

            // Act
            StepResult result = step.execute(context(request(null, 0), EventObjectMapper.instance().createObjectNode(), 3));

            // Assert
            assertThat(result.outcome()).isEqualTo(StepResult.Outcome.FAILURE);
        }

        @Test
        @DisplayName("Should fail immediately on insufficient funds")
        void shouldFailOnBusinessError() {
            // Arrange
            when(paymentGateway.refund(anyString(), any(), anyString(), anyString()))
                    .thenThrow(new InsufficientFundsException("no funds"));

            // Act
            StepResult result = step.execute(context(request(null, 0)));

            // Assert
            assertThat(result.outcome()).isEqualTo(StepResult.Outcome.FAILURE);
            assertThat(result.error()).isEqualTo("no funds");
        }
    }

    @Nested
    @DisplayName("record-refund-processed")
    class RecordProcessedTests {

        @Test
        @DisplayName("Should book payout and fee from the gateway result and announce completion")
        @SuppressWarnings("unchecked")
        void shouldPostWithGatewayFee() {
            // Arrange
            ObjectNode results = EventObjectMapper.instance().createObjectNode();
            results.set(GatewayRefundStep.STEP_ID, EventObjectMapper.instance().valueToTree(
                    new GatewayRefund("rfnd_1", "succeeded", new BigDecimal("1.45"))));
            when(postings.post(anyString(), anyList())).thenReturn(posting("k", true));
            RecordRefundProcessedStep step = new RecordRefundProcessedStep(postings, eventLog, transactionTemplate);

            // Act
            step.execute(context(request(null, 0), results, 0));

            // Assert
            ArgumentCaptor<List<LedgerEntryInput>> captor = ArgumentCaptor.forClass(List.class);
            verify(postings).post(eq(SAGA_ID + ":" + RecordRefundProcessedStep.STEP_ID), captor.capture());
            assertThat(captor.getValue()).extracting(LedgerEntryInput::entryType).containsExactly(
                    EntryType.REFUND_PROCESSED, EntryType.REFUND_PROCESSED, EntryType.GATEWAY_FEE, EntryType.GATEWAY_FEE);
            assertThat(captor.getValue()).extracting(LedgerEntryInput::reference).containsOnly("rfnd_1");

            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            verify(eventLog).appendNext(eq(AggregateTypes.REFUND), eq(REFUND_ID), eq(EventTypes.REFUND_COMPLETED),
                    event.capture(), eq("corr-1"));
            assertThat(((RefundCompletedEvent) event.getValue()).gatewayFee()).isEqualByComparingTo("1.45");
        }
    }

    @Nested
    @DisplayName("restock")
    class RestockTests {

        @Test
        @DisplayName("Should skip inventory when no restock was requested")
        void shouldSkipWithoutRestock() {
            // Act
            StepResult result = new RestockStep(inventoryGateway).execute(context(request(null, 0)));

            // Assert
            assertThat(result.isSuccess()).isTrue();
            verifyNoInteractions(inventoryGateway);
        }

        @Test
        @DisplayName("Should add the returned units under a key derived from the refund")
        void shouldRestockOnce() {
            // Arrange
            RestockStep step = new RestockStep(inventoryGateway);

            // Act
            step.execute(context(request(INVENTORY_ID, 2)));

            // Assert
            verify(inventoryGateway).adjustQuantity(eq(INVENTORY_ID), eq(2), eq(REFUND_ID + ":restock"),
                    eq("agent-7"), anyString());
        }

        @Test
        @DisplayName("Should remove the units again on compensation")
        void shouldReverseRestock() {
            // Arrange
            RestockStep step = new RestockStep(inventoryGateway);

            // Act
            step.compensate(context(request(INVENTORY_ID, 2)));

            // Assert
            verify(inventoryGateway).adjustQuantity(eq(INVENTORY_ID), eq(-2), eq(REFUND_ID + ":restock:reversal"),
                    eq("agent-7"), anyString());
        }
    }
}
