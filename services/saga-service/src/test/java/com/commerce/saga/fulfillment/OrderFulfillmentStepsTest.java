package com.commerce.saga.fulfillment;

import com.commerce.core.error.InsufficientStockException;
import com.commerce.core.error.ValidationException;
import com.commerce.events.serde.EventObjectMapper;
import com.commerce.inventory.entity.InventoryReservation;
import com.commerce.inventory.entity.ReferenceType;
import com.commerce.inventory.service.ReservationService;
import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.service.LedgerEntryInput;
import com.commerce.saga.ledger.StepPostings;
import com.commerce.saga.orchestration.SagaContext;
import com.commerce.saga.orchestration.StepResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
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
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Order fulfillment saga steps")
class OrderFulfillmentStepsTest {

    private static final UUID SAGA_ID = UUID.fromString("aaaaaaaa-aaaa-aaaa-aaaa-aaaaaaaaaaaa");
    private static final UUID ORDER_ID = UUID.fromString("dddddddd-dddd-dddd-dddd-dddddddddddd");
    private static final UUID ITEM_1 = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID ITEM_2 = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final Duration TTL = Duration.ofMinutes(15);

    @Mock
    private ReservationService reservationService;

    @Mock
    private StepPostings postings;

    @Mock
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    private final OrderFulfillmentRequest request = new OrderFulfillmentRequest(ORDER_ID, "cust-1", "pay_1",
            new BigDecimal("120.00"), "USD",
            List.of(new OrderFulfillmentRequest.Line(ITEM_1, 2), new OrderFulfillmentRequest.Line(ITEM_2, 1)));

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        transactionTemplate = new TransactionTemplate(transactionManager);
    }

    private SagaContext context(ObjectNode stepResults) {
        return context(request, stepResults);
    }

    private static SagaContext context(OrderFulfillmentRequest order, ObjectNode stepResults) {
        return new SagaContext(SAGA_ID, OrderFulfillmentSagaConfig.SAGA_TYPE, "corr-1", null, null,
                EventObjectMapper.instance().valueToTree(order), stepResults, 0);
    }

    private static OrderFulfillmentRequest order(OrderFulfillmentRequest.Line... lines) {
        return new OrderFulfillmentRequest(ORDER_ID, "cust-1", "pay_1", new BigDecimal("50.00"), "USD", List.of(lines));
    }

    private static String key(UUID item) {
        return ReferenceType.ORDER.reservationKey(ORDER_ID + ":" + item);
    }

    private static InventoryReservation reservation(UUID item, int quantity) {
        return new InventoryReservation(UUID.randomUUID(), key(item), item, quantity, null, ReferenceType.ORDER,
                ORDER_ID + ":" + item, null, "saga", Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Should hold every line under a key derived from order and item")
    void shouldReserveEveryLine() {
        // Arrange
        String actor = "saga:" + SAGA_ID;
        when(reservationService.reserve(ITEM_1, 2, ReferenceType.ORDER, ORDER_ID + ":" + ITEM_1, TTL, actor))
                .thenReturn(reservation(ITEM_1, 2));
        when(reservationService.reserve(ITEM_2, 1, ReferenceType.ORDER, ORDER_ID + ":" + ITEM_2, TTL, actor))
                .thenReturn(reservation(ITEM_2, 1));
        ReserveStockStep step = new ReserveStockStep(reservationService, transactionTemplate, TTL);

        // Act
        StepResult result = step.execute(context(EventObjectMapper.instance().createObjectNode()));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        ReserveStockStep.ReservedStock reserved = EventObjectMapper.instance()
                .convertValue(result.data(), ReserveStockStep.ReservedStock.class);
        assertThat(reserved.reservationKeys()).containsExactly(key(ITEM_1), key(ITEM_2));
    }

    @Test
    @DisplayName("Should hold the summed quantity once when several lines name the same item")
    void shouldMergeLinesForSameItem() {
        // Arrange
        String actor = "saga:" + SAGA_ID;
        when(reservationService.reserve(ITEM_1, 5, ReferenceType.ORDER, ORDER_ID + ":" + ITEM_1, TTL, actor))
                .thenReturn(reservation(ITEM_1, 5));
        ReserveStockStep step = new ReserveStockStep(reservationService, transactionTemplate, TTL);
        OrderFulfillmentRequest repeated = order(
                new OrderFulfillmentRequest.Line(ITEM_1, 2), new OrderFulfillmentRequest.Line(ITEM_1, 3));

        // Act
        StepResult result = step.execute(context(repeated, EventObjectMapper.instance().createObjectNode()));

        // Assert
        ReserveStockStep.ReservedStock reserved = EventObjectMapper.instance()
                .convertValue(result.data(), ReserveStockStep.ReservedStock.class);
        assertThat(reserved.reservationKeys()).containsExactly(key(ITEM_1));
        verify(reservationService, times(1)).reserve(any(), anyInt(), any(), anyString(), any(), anyString());
    }

    @Test
    @DisplayName("Should reject an order without lines before reserving anything")
    void shouldRejectOrderWithoutLines() {
        // Arrange
        ReserveStockStep step = new ReserveStockStep(reservationService, transactionTemplate, TTL);

        // Act & Assert
        assertThatThrownBy(() -> step.execute(context(order(), EventObjectMapper.instance().createObjectNode())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no lines");
        verifyNoInteractions(reservationService, transactionManager);
    }

    @Test
    @DisplayName("Should reject a line with a non-positive quantity")
    void shouldRejectNonPositiveQuantity() {
        // Arrange
        ReserveStockStep step = new ReserveStockStep(reservationService, transactionTemplate, TTL);
        OrderFulfillmentRequest invalid = order(
                new OrderFulfillmentRequest.Line(ITEM_1, 2), new OrderFulfillmentRequest.Line(ITEM_2, 0));

        // Act & Assert
        assertThatThrownBy(() -> step.execute(context(invalid, EventObjectMapper.instance().createObjectNode())))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(reservationService);
    }

    @Test
    @DisplayName("Should roll the whole reservation back when one line lacks stock")
    void shouldRollBackOnInsufficientStock() {
        // Arrange
        when(reservationService.reserve(eq(ITEM_1), anyInt(), any(), anyString(), any(), anyString()))
                .thenReturn(reservation(ITEM_1, 2));
        when(reservationService.reserve(eq(ITEM_2), anyInt(), any(), anyString(), any(), anyString()))
                .thenThrow(new InsufficientStockException("Available: 0, Requested: 1"));
        ReserveStockStep step = new ReserveStockStep(reservationService, transactionTemplate, TTL);

        // Act & Assert
        assertThatThrownBy(() -> step.execute(context(EventObjectMapper.instance().createObjectNode())))
                .isInstanceOf(InsufficientStockException.class);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("Should release every line's hold on compensation")
    void shouldReleaseOnCompensation() {
        // Arrange
        ReserveStockStep step = new ReserveStockStep(reservationService, transactionTemplate, TTL);

        // Act
        step.compensate(context(EventObjectMapper.instance().createObjectNode()));

        // Assert
        verify(reservationService).release(eq(key(ITEM_1)), eq("saga:" + SAGA_ID), anyString());
        verify(reservationService).release(eq(key(ITEM_2)), eq("saga:" + SAGA_ID), anyString());
    }

    @Test
    @DisplayName("Should capture the order amount from customer into escrow")
    @SuppressWarnings("unchecked")
    void shouldCapturePayment() {
        // Arrange
        String postingKey = SAGA_ID + ":" + CapturePaymentStep.STEP_ID;
        when(postings.post(eq(postingKey), anyList()))
                .thenReturn(new StepPostings.Posting(postingKey, List.of(), true));
        CapturePaymentStep step = new CapturePaymentStep(postings, transactionTemplate);

        // Act
        StepResult result = step.execute(context(EventObjectMapper.instance().createObjectNode()));

        // Assert
        assertThat(result.data().get("postingKey").asText()).isEqualTo(postingKey);
        ArgumentCaptor<List<LedgerEntryInput>> captor = ArgumentCaptor.forClass(List.class);
        verify(postings).post(eq(postingKey), captor.capture());
        assertThat(captor.getValue()).extracting(LedgerEntryInput::accountType)
                .containsExactly(AccountType.CUSTOMER, AccountType.ESCROW);
        assertThat(captor.getValue()).extracting(LedgerEntryInput::subjectId).containsOnly(ORDER_ID.toString());
    }

    @Test
    @DisplayName("Should commit the holds recorded by the reserve step")
    void shouldCommitReservedKeys() {
        // Arrange
        ObjectNode results = EventObjectMapper.instance().createObjectNode();
        results.set(ReserveStockStep.STEP_ID, EventObjectMapper.instance().valueToTree(
                new ReserveStockStep.ReservedStock(List.of(key(ITEM_1), key(ITEM_2)))));
        CommitStockStep step = new CommitStockStep(reservationService, transactionTemplate);

        // Act
        StepResult result = step.execute(context(results));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        verify(reservationService).commit(eq(key(ITEM_1)), eq("saga:" + SAGA_ID), anyString());
        verify(reservationService).commit(eq(key(ITEM_2)), eq("saga:" + SAGA_ID), anyString());
    }
}
