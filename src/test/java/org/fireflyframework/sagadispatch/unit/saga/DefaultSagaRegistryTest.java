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

import org.fireflyframework.sagadispatch.core.exception.DuplicateDefinitionException;
import org.fireflyframework.sagadispatch.core.exception.SagaConfigurationException;
import org.fireflyframework.sagadispatch.core.persistence.InMemorySagaPersister;
import org.fireflyframework.sagadispatch.fixtures.OrderMessages.*;
import org.fireflyframework.sagadispatch.fixtures.OrderSaga;
import org.fireflyframework.sagadispatch.fixtures.OrderSagaData;
import org.fireflyframework.sagadispatch.saga.builder.SagaDefinitionBuilder;
import org.fireflyframework.sagadispatch.saga.model.SagaEntity;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.fireflyframework.sagadispatch.saga.model.TimeoutMessage;
import org.fireflyframework.sagadispatch.saga.registry.DefaultSagaRegistry;
import org.fireflyframework.sagadispatch.saga.registry.SagaFinderDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DefaultSagaRegistryTest {

    private DefaultSagaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DefaultSagaRegistry.builder(new InMemorySagaPersister())
                .register(OrderSaga.definition())
                .build();
    }

    // ── Finder wiring ────────────────────────────────────────────

    @Test
    void sagaMessageTypes_getIdFinder() {
        List<SagaFinderDefinition> finders = registry.findersFor(OrderShipped.class);

        assertThat(finders).singleElement().satisfies(f -> {
            assertThat(f.description()).isEqualTo("id");
            assertThat(f.entityType()).isEqualTo(OrderSagaData.class);
        });
    }

    @Test
    void correlatedTypes_getPropertyFinder() {
        assertThat(registry.findersFor(PaymentReceived.class))
                .extracting(SagaFinderDefinition::description)
                .containsExactly("property(orderId)");
    }

    @Test
    void timeouts_getIdFinders() {
        assertThat(registry.findersFor(TimeoutMessage.class)).extracting(SagaFinderDefinition::description)
                .containsExactly("id");
        assertThat(registry.findersFor(ReminderDue.class)).extracting(SagaFinderDefinition::description)
                .containsExactly("id");
    }

    @Test
    void sagaWithoutTimeoutHandlers_stillGetsTimeoutFinder() {
        DefaultSagaRegistry startOnly = DefaultSagaRegistry.builder(new InMemorySagaPersister())
                .register(SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                        .startedBy(OrderPlaced.class, OrderSaga::onOrderPlaced)
                        .build())
                .build();

        assertThat(startOnly.findersFor(TimeoutMessage.class)).extracting(SagaFinderDefinition::description)
                .containsExactly("id");
        assertThat(startOnly.findersFor(ReminderDue.class)).extracting(f -> f.entityType().getName())
                .containsExactly(OrderSagaData.class.getName());
    }

    @Test
    void uncorrelatedHandledType_hasNoFinder() {
        assertThat(registry.findersFor(OrderNote.class)).isEmpty();
        assertThat(registry.isSagaRelevant(OrderNote.class)).isTrue();
    }

    @Test
    void startOnlyType_getsNullFinder() {
        DefaultSagaRegistry startOnly = DefaultSagaRegistry.builder(new InMemorySagaPersister())
                .register(SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                        .startedBy(OrderNote.class, OrderSaga::onOrderNote)
                        .build())
                .build();

        assertThat(startOnly.findersFor(OrderNote.class)).singleElement()
                .satisfies(f -> assertThat(f.description()).isEqualTo("none"));
    }

    @Test
    void customFinder_winsOverCorrelation() {
        DefaultSagaRegistry custom = DefaultSagaRegistry.builder(new InMemorySagaPersister())
                .register(SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                        .handles(PaymentReceived.class, OrderSaga::onPaymentReceived)
                        .correlateBy(PaymentReceived.class, PaymentReceived::getOrderId, "orderId")
                        .findWith(PaymentReceived.class, message -> Mono.empty())
                        .build())
                .build();

        assertThat(custom.findersFor(PaymentReceived.class)).extracting(SagaFinderDefinition::description)
                .containsExactly("custom");
    }

    @Test
    void findersFor_honoursSubtypes() {
        class ExpressShipped extends OrderShipped {
            ExpressShipped() { super("X"); }
        }

        assertThat(registry.findersFor(ExpressShipped.class)).hasSize(1);
        assertThat(registry.handlerFor(OrderSaga.class, ExpressShipped.class)).isPresent();
    }

    // ── Lookups ──────────────────────────────────────────────────

    @Test
    void sagaTypeToStart_onlyForStartingMessages() {
        SagaFinderDefinition placedFinder = registry.findersFor(OrderPlaced.class).get(0);
        SagaFinderDefinition paymentFinder = registry.findersFor(PaymentReceived.class).get(0);

        assertThat(registry.sagaTypeToStart(OrderPlaced.class, placedFinder)).contains(OrderSaga.class);
        assertThat(registry.sagaTypeToStart(PaymentReceived.class, paymentFinder)).isEmpty();
    }

    @Test
    void entityAndSagaTypes_mapBothWays() {
        assertThat(registry.sagaEntityTypeFor(OrderSaga.class)).isEqualTo(OrderSagaData.class);
        assertThat(registry.sagaTypeForEntityType(OrderSagaData.class)).isEqualTo(OrderSaga.class);
    }

    @Test
    void timeoutHandlerFor_requiresExactType() {
        class LatePayment extends PaymentOverdue {
            LatePayment() { super("o-1"); }
        }

        assertThat(registry.timeoutHandlerFor(OrderSaga.class, PaymentOverdue.class)).isPresent();
        assertThat(registry.timeoutHandlerFor(OrderSaga.class, LatePayment.class)).isEmpty();
    }

    @Test
    void newEntity_isFreshAndIdentityless() {
        SagaEntity first = registry.newEntity(OrderSaga.class);
        SagaEntity second = registry.newEntity(OrderSaga.class);

        assertThat(first).isInstanceOf(OrderSagaData.class).isNotSameAs(second);
        assertThat(first.getId()).isNull();
    }

    @Test
    void unknownTypes_areConfigurationErrors() {
        assertThatThrownBy(() -> registry.handlerFor(String.class, OrderPlaced.class))
                .isInstanceOf(SagaConfigurationException.class)
                .hasMessageContaining("not registered");
        assertThatThrownBy(() -> registry.sagaTypeForEntityType(SagaEntity.class))
                .isInstanceOf(SagaConfigurationException.class);
    }

    @Test
    void irrelevantTypes_areReported() {
        assertThat(registry.isSagaRelevant(InventoryAdjusted.class)).isFalse();
        assertThat(registry.isSagaRelevant(OrderPlaced.class)).isTrue();
    }

    // ── Registration ─────────────────────────────────────────────

    @Test
    void duplicateSaga_isRejected() {
        DefaultSagaRegistry.Builder builder = DefaultSagaRegistry.builder(new InMemorySagaPersister())
                .register(OrderSaga.definition());

        assertThatThrownBy(() -> builder.register(OrderSaga.definition()))
                .isInstanceOf(DuplicateDefinitionException.class);
    }

    static class OtherOrderSaga extends SagaInstance<OrderSagaData> {
        public Mono<Void> on(OrderNote note) { return Mono.empty(); }
    }

    @Test
    void sharedEntityType_isRejected() {
        DefaultSagaRegistry.Builder builder = DefaultSagaRegistry.builder(new InMemorySagaPersister())
                .register(OrderSaga.definition())
                .register(SagaDefinitionBuilder.saga(OtherOrderSaga.class, OrderSagaData.class)
                        .startedBy(OrderNote.class, OtherOrderSaga::on)
                        .build());

        assertThatThrownBy(builder::build)
                .isInstanceOf(DuplicateDefinitionException.class)
                .hasMessageContaining(OrderSagaData.class.getName());
    }

    @Test
    void duplicateHandler_isRejectedByBuilder() {
        SagaDefinitionBuilder<OrderSaga, OrderSagaData> builder = SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .handles(OrderNote.class, OrderSaga::onOrderNote);

        assertThatThrownBy(() -> builder.startedBy(OrderNote.class, OrderSaga::onOrderNote))
                .isInstanceOf(DuplicateDefinitionException.class);
    }
}
