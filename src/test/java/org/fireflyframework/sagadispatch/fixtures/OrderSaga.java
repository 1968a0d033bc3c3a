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

package org.fireflyframework.sagadispatch.fixtures;

import org.fireflyframework.sagadispatch.fixtures.OrderMessages.*;
import org.fireflyframework.sagadispatch.saga.annotation.CorrelateBy;
import org.fireflyframework.sagadispatch.saga.annotation.Saga;
import org.fireflyframework.sagadispatch.saga.annotation.SagaHandler;
import org.fireflyframework.sagadispatch.saga.annotation.SagaTimeout;
import org.fireflyframework.sagadispatch.saga.annotation.StartedBy;
import org.fireflyframework.sagadispatch.saga.builder.SagaDefinitionBuilder;
import org.fireflyframework.sagadispatch.saga.model.SagaInstance;
import org.fireflyframework.sagadispatch.saga.registry.SagaDefinition;
import reactor.core.publisher.Mono;

@Saga(entity = OrderSagaData.class)
public class OrderSaga extends SagaInstance<OrderSagaData> {

    /**
     * The same saga declared through the fluent builder instead of annotations.
     */
    public static SagaDefinition definition() {
        return SagaDefinitionBuilder.saga(OrderSaga.class, OrderSagaData.class)
                .startedBy(OrderPlaced.class, OrderSaga::onOrderPlaced)
                .handles(PaymentReceived.class, OrderSaga::onPaymentReceived)
                .correlateBy(PaymentReceived.class, PaymentReceived::getOrderId, "orderId")
                .handles(OrderShipped.class, OrderSaga::onOrderShipped)
                .handles(OrderNote.class, OrderSaga::onOrderNote)
                .timeout(PaymentOverdue.class, OrderSaga::onPaymentOverdue)
                .timeout(ReminderDue.class, OrderSaga::onReminderDue)
                .build();
    }

    @StartedBy
    public Mono<Void> onOrderPlaced(OrderPlaced message) {
        getEntity().setOrderId(message.getOrderId());
        getEntity().setStatus("PLACED");
        return Mono.empty();
    }

    @SagaHandler
    @CorrelateBy(message = "orderId", entity = "orderId")
    public Mono<Void> onPaymentReceived(PaymentReceived message) {
        getEntity().setPayments(getEntity().getPayments() + 1);
        getEntity().setStatus("PAID");
        return Mono.empty();
    }

    @SagaHandler
    public Mono<Void> onOrderShipped(OrderShipped message) {
        getEntity().setStatus("SHIPPED");
        markAsComplete();
        return Mono.empty();
    }

    @SagaHandler
    public Mono<Void> onOrderNote(OrderNote message) {
        return Mono.empty();
    }

    @SagaTimeout
    public Mono<Void> onPaymentOverdue(PaymentOverdue state) {
        getEntity().setStatus("OVERDUE");
        return Mono.empty();
    }

    @SagaTimeout
    public Mono<Void> onReminderDue(ReminderDue reminder) {
        getEntity().setReminders(getEntity().getReminders() + 1);
        return Mono.empty();
    }

    public void timeout(ShippingDelayed state) {
        getEntity().setStatus("DELAYED");
    }
}
