/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.sagadispatch.unit.saga;

import org.fireflyframework.sagadispatch.core.exception.SagaTimeoutHandlerNotFoundException;
import org.fireflyframework.sagadispatch.core.observability.SagaDispatchEvents;
import org.fireflyframework.sagadispatch.fixtures.OrderMessages.*;
import org.fireflyframework.sagadispatch.fixtures.OrderSaga;
import org.fireflyframework.sagadispatch.fixtures.OrderSagaData;
import org.fireflyframework.sagadispatch.fixtures.RecordingBusContext;
import org.fireflyframework.sagadispatch.fixtures.RecordingSagaPersister;
import org.fireflyframework.sagadispatch.saga.builder.ReflectiveSagaInstanceBuilder;
import org.fireflyframework.sagadispatch.saga.builder.SagaDefinitionBuilder;
import org.fireflyframework.sagadispatch.saga.engine.SagaDispatchOrchestrator;
import org.fireflyframework.sagadispatch.saga.engine.SagaNotFoundFallback;
import org.fireflyframework.sagadispatch.saga.engine.SagaNotFoundHandler;
import org.fireflyframework.sagadispatch.saga.engine.SagaTimeoutDispatcher;
import org.fireflyframework.sagadispatch.saga.model.SagaMessage;
import org.fireflyframework.sagadispatch.saga.model.TimeoutMessage;
import org.fireflyframework.sagadispatch.saga.registry.DefaultSagaRegistry;
import org.fireflyframework.sagadispatch.saga.registry.SagaDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SagaDispatchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private RecordingSagaPersister persister;
    private RecordingBusContext bus;
    private SagaDispatchEvents events;
    private List<Object> unclaimed;
    private AtomicInteger generatedIds;
    private SagaDispatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        persister = new RecordingSagaPersister();
        bus = new RecordingBusContext();
        events = mock(SagaDispatchEvents.class);
        unclaimed = new CopyOnWriteArrayList<>();
        generatedIds = new AtomicInteger();
        orchestrator = orchestrator(OrderSaga.definition());
    }

    private SagaDispatchOrchestrator orchestrator(SagaDefinition definition) {
        DefaultSagaRegistry registry = DefaultSagaRegistry.builder(persister).register(definition).build();
        SagaNotFoundHandler recorder = message -> Mono.fromRunnable(() -> unclaimed.add(message));
        return new SagaDispatchOrchestrator(registry, persister, bus, new ReflectiveSagaInstanceBuilder(),
                () -> "generated-" + generatedIds.incrementAndGet(), new SagaTimeoutDispatcher(registry),
                new SagaNotFoundFallback(List.of(recorder), bus, events), events,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private OrderSagaData load(String id) {
        return persister.findById(OrderSagaData.class, id).block();
    }

    private void startOrder(String sagaId, String orderId) {
        StepVerifier.create(orchestrator.dispatch(new OrderPlaced(sagaId, orderId))).verifyComplete();
        persister.resetWrites();
    }

    // ── Relevance ────────────────────────────────────────────────

    @Test
    void irrelevantMessage_noPersistenceAndNoFallback() {
        StepVerifier.create(orchestrator.dispatch(new InventoryAdjusted())).verifyComplete();

        assertThat(persister.writes()).isEmpty();
        assertThat(unclaimed).isEmpty();
        verify(events).onMessageIgnored(InventoryAdjusted.class.getName(), "msg-1");
    }

    @Test
    void relevantMessageWithoutFinder_invokesFallbackOnce() {
        OrderNote note = new OrderNote("gift wrap");

        StepVerifier.create(orchestrator.dispatch(note)).verifyComplete();

        assertThat(unclaimed).containsExactly(note);
        assertThat(persister.writes()).isEmpty();
    }

    @Test
    void unregisteredSagaMessage_isStillHandledAndFallsBack() {
        class StrayMessage implements SagaMessage {
            @Override
            public String getSagaId() { return "stray"; }
        }
        StrayMessage stray = new StrayMessage();

        StepVerifier.create(orchestrator.dispatch(stray)).verifyComplete();

        assertThat(unclaimed).containsExactly(stray);
        verify(events, never()).onMessageIgnored(any(), any());
    }

    // ── Starting sagas ───────────────────────────────────────────

    @Test
    void startMessage_createsEntityWithCorrelationId() {
        StepVerifier.create(orchestrator.dispatch(new OrderPlaced("X", "order-1"))).verifyComplete();

        assertThat(persister.writes()).containsExactly("create:X");
        OrderSagaData data = load("X");
        assertThat(data.getOrderId()).isEqualTo("order-1");
        assertThat(data.getStatus()).isEqualTo("PLACED");
        assertThat(data.getOriginator()).isEqualTo(RecordingBusContext.REPLY_TO);
        assertThat(data.getOriginatingMessageId()).isEqualTo("msg-1");
        assertThat(unclaimed).isEmpty();
        verify(events).onSagaStarted(OrderSaga.class.getName(), "X", OrderPlaced.class.getName());
    }

    @Test
    void startMessageWithoutCorrelationId_usesGeneratedIds() {
        StepVerifier.create(orchestrator.dispatch(new OrderPlaced(null, "order-1"))
                        .then(orchestrator.dispatch(new OrderPlaced(" ", "order-2"))))
                .verifyComplete();

        assertThat(persister.writes()).containsExactly("create:generated-1", "create:generated-2");
        assertThat(load("generated-2").getOrderId()).isEqualTo("order-2");
    }

    @Test
    void twoFindersStartingSameSagaType_createOnlyOneEntity() {
        SagaDefinition def = SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderPlaced.class, OrderSaga::onOrderPlaced)
                .findWith(SagaMessage.class, message -> Mono.empty())
                .build();
        orchestrator = orchestrator(def);

        StepVerifier.create(orchestrator.dispatch(new OrderPlaced("X", "order-1"))).verifyComplete();

        assertThat(persister.writes()).containsExactly("create:X");
        verify(events, times(1)).onSagaStarted(any(), eq("X"), any());
    }

    @Test
    void entityReachedByTwoFinders_isInvokedOncePerDispatch() {
        SagaDefinition def = SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderPlaced.class, (saga, message) -> {
                    saga.getEntity().setPayments(saga.getEntity().getPayments() + 1);
                    return Mono.empty();
                })
                .findWith(SagaMessage.class, message -> persister.findById(OrderSagaData.class, message.getSagaId()))
                .build();
        orchestrator = orchestrator(def);

        StepVerifier.create(orchestrator.dispatch(new OrderPlaced("X", "order-1"))).verifyComplete();
        assertThat(load("X").getPayments()).isEqualTo(1);

        StepVerifier.create(orchestrator.dispatch(new OrderPlaced("X", "order-1"))).verifyComplete();
        assertThat(load("X").getPayments()).isEqualTo(2);
        assertThat(persister.writes()).containsExactly("create:X", "update:X");
    }

    // ── Existing sagas ───────────────────────────────────────────

    @Test
    void correlatedMessage_updatesExistingEntity() {
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(new PaymentReceived("order-1"))).verifyComplete();

        assertThat(persister.writes()).containsExactly("update:X");
        assertThat(load("X").getPayments()).isEqualTo(1);
        assertThat(load("X").getStatus()).isEqualTo("PAID");
    }

    @Test
    void startMessageForExistingSaga_updatesInsteadOfCreating() {
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(new OrderPlaced("X", "order-1b"))).verifyComplete();

        assertThat(persister.writes()).containsExactly("update:X");
        assertThat(load("X").getOrderId()).isEqualTo("order-1b");
    }

    @Test
    void uncorrelatedMessage_goesToFallback() {
        startOrder("X", "order-1");
        PaymentReceived payment = new PaymentReceived("order-unknown");

        StepVerifier.create(orchestrator.dispatch(payment)).verifyComplete();

        assertThat(unclaimed).containsExactly(payment);
        assertThat(persister.writes()).isEmpty();
        verify(events).onSagaNotFound(PaymentReceived.class.getName(), "msg-1");
    }

    // ── Completion ───────────────────────────────────────────────

    @Test
    void completion_completesEntityAndCancelsTimeouts() {
        startOrder("X", "order-1");
        StepVerifier.create(orchestrator.dispatch(new PaymentReceived("order-1"))
                        .then(orchestrator.dispatch(new PaymentReceived("order-1"))))
                .verifyComplete();

        StepVerifier.create(orchestrator.dispatch(new OrderShipped("X"))).verifyComplete();

        assertThat(persister.writes()).containsExactly("update:X", "update:X", "complete:X");
        assertThat(bus.cancelledTimeouts()).containsExactly("X");
        assertThat(persister.stored()).isZero();
        verify(events).onSagaCompleted(OrderSaga.class.getName(), "X");

        PaymentReceived late = new PaymentReceived("order-1");
        StepVerifier.create(orchestrator.dispatch(late)).verifyComplete();
        assertThat(unclaimed).containsExactly(late);
        StepVerifier.create(persister.findByProperty(OrderSagaData.class, "orderId", "order-1")).verifyComplete();
    }

    @Test
    void sagaCompletedWhileStarting_isNeverStoredButTimeoutsAreCancelled() {
        SagaDefinition def = SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderShipped.class, OrderSaga::onOrderShipped)
                .build();
        orchestrator = orchestrator(def);

        StepVerifier.create(orchestrator.dispatch(new OrderShipped("Y"))).verifyComplete();

        assertThat(persister.writes()).isEmpty();
        assertThat(bus.cancelledTimeouts()).containsExactly("Y");
    }

    // ── Timeouts ─────────────────────────────────────────────────

    @Test
    void unexpiredTimeout_isDeferredWithoutSideEffects() {
        startOrder("X", "order-1");
        TimeoutMessage<PaymentOverdue> timeout = TimeoutMessage.of("X", NOW.plus(Duration.ofHours(1)),
                PaymentOverdue.class, new PaymentOverdue("order-1"));

        StepVerifier.create(orchestrator.dispatch(timeout)).verifyComplete();

        assertThat(bus.deferrals()).isEqualTo(1);
        assertThat(persister.writes()).isEmpty();
        assertThat(unclaimed).isEmpty();
        assertThat(bus.cancelledTimeouts()).isEmpty();
        assertThat(load("X").getStatus()).isEqualTo("PLACED");
    }

    @Test
    void expiredTypedTimeout_isDeliveredToDeclaredHandler() {
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(TimeoutMessage.of("X", NOW, PaymentOverdue.class,
                new PaymentOverdue("order-1")))).verifyComplete();

        assertThat(load("X").getStatus()).isEqualTo("OVERDUE");
        assertThat(persister.writes()).containsExactly("update:X");
        assertThat(bus.deferrals()).isZero();
    }

    @Test
    void untypedTimeout_isResolvedAgainstSagaTimeoutMethod() {
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(TimeoutMessage.untyped("X", NOW.minusSeconds(5),
                new ShippingDelayed()))).verifyComplete();

        assertThat(load("X").getStatus()).isEqualTo("DELAYED");
    }

    @Test
    void selfDescribingTimeoutNotification_isCorrelatedBySagaId() {
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(new ReminderDue("X", NOW.minusSeconds(1)))).verifyComplete();

        assertThat(load("X").getReminders()).isEqualTo(1);
        assertThat(persister.writes()).containsExactly("update:X");
    }

    @Test
    void timeoutWithoutHandler_failsWithoutPersisting() {
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(TimeoutMessage.untyped("X", NOW.minusSeconds(5), new UnknownState())))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(SagaTimeoutHandlerNotFoundException.class);
                    assertThat(e.getMessage()).contains(UnknownState.class.getName()).contains(OrderSaga.class.getName());
                    SagaTimeoutHandlerNotFoundException ex = (SagaTimeoutHandlerNotFoundException) e;
                    assertThat(ex.getErrorCode()).isEqualTo("SAGA_TIMEOUT_HANDLER_NOT_FOUND");
                    assertThat(ex.getSagaType()).isEqualTo(OrderSaga.class);
                    assertThat(ex.getPayloadType()).isEqualTo(UnknownState.class);
                })
                .verify();

        assertThat(persister.writes()).isEmpty();
        verify(events).onDispatchFailed(eq(TimeoutMessage.class.getName()), eq("msg-1"),
                any(SagaTimeoutHandlerNotFoundException.class));
    }

    @Test
    void sagaWithoutTimeoutHandlers_stillReceivesTimeoutsThroughTimeoutMethod() {
        orchestrator = orchestrator(SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderPlaced.class, OrderSaga::onOrderPlaced)
                .build());
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(TimeoutMessage.untyped("X", Instant.EPOCH, new ShippingDelayed())))
                .verifyComplete();

        assertThat(load("X").getStatus()).isEqualTo("DELAYED");
        assertThat(persister.writes()).containsExactly("update:X");
        assertThat(unclaimed).isEmpty();
    }

    @Test
    void sagaWithoutTimeoutHandlers_failsOnUnknownTimeoutPayload() {
        orchestrator = orchestrator(SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderPlaced.class, OrderSaga::onOrderPlaced)
                .build());
        startOrder("X", "order-1");

        StepVerifier.create(orchestrator.dispatch(TimeoutMessage.untyped("X", Instant.EPOCH, new UnknownState())))
                .expectError(SagaTimeoutHandlerNotFoundException.class)
                .verify();

        assertThat(persister.writes()).isEmpty();
        assertThat(unclaimed).isEmpty();
    }

    @Test
    void timeoutForFinishedSaga_goesToFallback() {
        TimeoutMessage<PaymentOverdue> timeout = TimeoutMessage.of("gone", NOW, PaymentOverdue.class,
                new PaymentOverdue("order-1"));

        StepVerifier.create(orchestrator.dispatch(timeout)).verifyComplete();

        assertThat(unclaimed).containsExactly(timeout);
        assertThat(persister.writes()).isEmpty();
    }

    // ── Failures ─────────────────────────────────────────────────

    @Test
    void handlerFailure_propagatesWithoutPersisting() {
        SagaDefinition def = SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderPlaced.class, (saga, message) -> Mono.error(new IllegalStateException("boom")))
                .build();
        orchestrator = orchestrator(def);

        StepVerifier.create(orchestrator.dispatch(new OrderPlaced("X", "order-1")))
                .expectErrorMessage("boom")
                .verify();

        assertThat(persister.writes()).isEmpty();
        assertThat(unclaimed).isEmpty();
        verify(events).onDispatchFailed(eq(OrderPlaced.class.getName()), eq("msg-1"), any(IllegalStateException.class));
    }

    @Test
    void dispatchIsLazy() {
        Mono<Void> pending = orchestrator.dispatch(new OrderPlaced("X", "order-1"));

        assertThat(persister.writes()).isEmpty();
        StepVerifier.create(pending).verifyComplete();
        assertThat(persister.writes()).containsExactly("create:X");
    }
}
