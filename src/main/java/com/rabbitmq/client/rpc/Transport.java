// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.client.rpc;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Contract the RPC client expects from the messaging layer.
 *
 * <p>An implementation owns the broker connection: it declares the topology, publishes, consumes,
 * and takes care of reconnecting. It tells the RPC client about connection lifecycle changes with
 * {@link ConnectionEvent}s.
 *
 * <p>Implementations must be thread-safe.
 */
public interface Transport {

  /**
   * Declare a queue.
   *
   * @param name the queue name
   * @param durable whether the queue survives a broker restart
   * @param exclusive whether the queue is owned by the declaring connection
   * @param autoDelete whether the queue is deleted once its last consumer is gone
   * @param expires server-side expiry of the unused queue, null for no expiry
   * @return information on the declared queue
   */
  QueueInfo declareQueue(
      String name, boolean durable, boolean exclusive, boolean autoDelete, Duration expires);

  /**
   * Declare an exchange, if it does not exist already.
   *
   * @param name the exchange name
   * @param type the exchange type
   */
  void declareExchange(String name, ExchangeType type);

  /**
   * Publish a message.
   *
   * @param exchange the destination exchange, empty string for the default exchange
   * @param routingKey the routing key
   * @param mandatory whether the broker must return the message if it cannot route it
   * @param immediate whether the broker must return the message if it cannot deliver it
   * @param message the message
   */
  void publish(
      String exchange, String routingKey, boolean mandatory, boolean immediate, Message message);

  /**
   * Consume the first message delivered to a queue.
   *
   * <p>The returned future fails with a {@link java.util.concurrent.TimeoutException} if no
   * message arrives within the timeout.
   *
   * @param queue the queue
   * @param timeout how long to wait for a message
   * @return the message, as a {@link CompletableFuture}
   */
  CompletableFuture<Message> consumeOnce(QueueInfo queue, Duration timeout);

  /**
   * Consume all the messages delivered to a queue, until the subscription is closed.
   *
   * @param queue the queue
   * @param handler the callback for each message
   * @return the subscription
   */
  Subscription consume(QueueInfo queue, MessageHandler handler);

  /**
   * Register a listener for connection lifecycle events.
   *
   * @param listener the listener
   */
  void addConnectionListener(ConnectionListener listener);

  /**
   * Unregister a connection listener.
   *
   * @param listener the listener
   */
  void removeConnectionListener(ConnectionListener listener);

  /** Information on a declared queue. */
  interface QueueInfo {

    /**
     * The name of the queue.
     *
     * @return queue name
     */
    String name();

    /**
     * Whether the queue is exclusive.
     *
     * @return true if exclusive
     */
    boolean exclusive();
  }

  /** Callback for messages delivered to a continuous consumer. */
  @FunctionalInterface
  interface MessageHandler {

    /**
     * Process a message.
     *
     * @param message the message
     */
    void handle(Message message);
  }

  /** A running consumer, stopped with {@link #close()}. */
  interface Subscription extends AutoCloseable {

    /** Stop the consumer. Calling it several times has no effect. */
    @Override
    void close();
  }

  /** Listener for connection lifecycle changes. */
  @FunctionalInterface
  interface ConnectionListener {

    /**
     * Handle a connection event.
     *
     * @param event the event
     */
    void handle(ConnectionEvent event);
  }

  /** Connection lifecycle events. */
  enum ConnectionEvent {
    /** A connection has been (re-)created. */
    CREATED,
    /** The connection has been lost. */
    DISCONNECTED
  }

  /** Exchange types. */
  enum ExchangeType {
    /** Direct exchange type. */
    DIRECT,
    /** Fanout exchange type. */
    FANOUT,
    /** Topic exchange type. */
    TOPIC,
    /** Headers exchange type. */
    HEADERS
  }
}
