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
package com.rabbitmq.client.rpc.impl;

import com.rabbitmq.client.rpc.Message;
import com.rabbitmq.client.rpc.Transport;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Transport} that routes messages in memory, the way a broker would.
 *
 * <p>Messages published to the default exchange go to the queue named after the routing key.
 * Requests published with a routing key that has a {@link Responder} are answered to their reply-to
 * queue. Exclusive queues disappear on {@link #disconnect()}.
 */
final class InMemoryTransport implements Transport, AutoCloseable {

  private final Map<String, InMemoryQueue> queues = new ConcurrentHashMap<>();
  private final Map<String, Responder> responders = new ConcurrentHashMap<>();
  private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
  private final List<QueueDeclaration> declaredQueues = new CopyOnWriteArrayList<>();
  private final List<String> declaredExchanges = new CopyOnWriteArrayList<>();
  private final List<Published> published = new CopyOnWriteArrayList<>();
  private final AtomicReference<RuntimeException> publishFailure = new AtomicReference<>();
  private final AtomicReference<RuntimeException> declareFailure = new AtomicReference<>();
  private final AtomicInteger droppedMessages = new AtomicInteger();
  private final ScheduledExecutorService scheduledExecutorService =
      Executors.newSingleThreadScheduledExecutor();
  private final ExecutorService responderExecutor = Executors.newCachedThreadPool();
  private volatile boolean synchronousResponses = false;
  private volatile boolean connected = true;

  @Override
  public QueueInfo declareQueue(
      String name, boolean durable, boolean exclusive, boolean autoDelete, Duration expires) {
    checkConnected();
    RuntimeException failure = this.declareFailure.getAndSet(null);
    if (failure != null) {
      throw failure;
    }
    this.declaredQueues.add(new QueueDeclaration(name, durable, exclusive, autoDelete, expires));
    InMemoryQueue queue =
        this.queues.computeIfAbsent(name, n -> new InMemoryQueue(n, exclusive, autoDelete));
    return queue;
  }

  @Override
  public void declareExchange(String name, ExchangeType type) {
    checkConnected();
    this.declaredExchanges.add(name);
  }

  @Override
  public void publish(
      String exchange, String routingKey, boolean mandatory, boolean immediate, Message message) {
    checkConnected();
    RuntimeException failure = this.publishFailure.getAndSet(null);
    if (failure != null) {
      throw failure;
    }
    this.published.add(new Published(exchange, routingKey, message));
    Responder responder = this.responders.get(routingKey);
    if (responder != null) {
      if (this.synchronousResponses) {
        respond(responder, message);
      } else {
        this.responderExecutor.execute(() -> respond(responder, message));
      }
    } else if (exchange.isEmpty()) {
      deliver(routingKey, message);
    }
  }

  @Override
  public CompletableFuture<Message> consumeOnce(QueueInfo queueInfo, Duration timeout) {
    checkConnected();
    InMemoryQueue queue = queue(queueInfo.name());
    CompletableFuture<Message> result = new CompletableFuture<>();
    Message buffered;
    synchronized (queue) {
      buffered = queue.messages.poll();
      if (buffered == null) {
        queue.waiters.add(result);
      }
    }
    if (buffered == null) {
      this.scheduledExecutorService.schedule(
          () -> {
            boolean removed;
            synchronized (queue) {
              removed = queue.waiters.remove(result);
            }
            if (removed) {
              maybeDelete(queue);
              result.completeExceptionally(
                  new TimeoutException("No message in queue " + queue.name));
            }
          },
          timeout.toMillis(),
          TimeUnit.MILLISECONDS);
    } else {
      maybeDelete(queue);
      result.complete(buffered);
    }
    return result;
  }

  @Override
  public Subscription consume(QueueInfo queueInfo, MessageHandler handler) {
    checkConnected();
    InMemoryQueue queue = queue(queueInfo.name());
    List<Message> buffered;
    synchronized (queue) {
      queue.handler = handler;
      buffered = new ArrayList<>(queue.messages);
      queue.messages.clear();
    }
    buffered.forEach(handler::handle);
    return () -> {
      synchronized (queue) {
        if (queue.handler == handler) {
          queue.handler = null;
        }
      }
    };
  }

  @Override
  public void addConnectionListener(ConnectionListener listener) {
    this.listeners.add(listener);
  }

  @Override
  public void removeConnectionListener(ConnectionListener listener) {
    this.listeners.remove(listener);
  }

  void respondOn(String routingKey, Responder responder) {
    this.responders.put(routingKey, responder);
  }

  void synchronousResponses(boolean synchronousResponses) {
    this.synchronousResponses = synchronousResponses;
  }

  void failNextPublish(RuntimeException exception) {
    this.publishFailure.set(exception);
  }

  void failNextQueueDeclaration(RuntimeException exception) {
    this.declareFailure.set(exception);
  }

  /** Lose the connection: exclusive queues are deleted with their consumers. */
  void disconnect() {
    this.connected = false;
    List<InMemoryQueue> exclusiveQueues = new ArrayList<>();
    this.queues.values().removeIf(q -> q.exclusive && exclusiveQueues.add(q));
    for (InMemoryQueue queue : exclusiveQueues) {
      List<CompletableFuture<Message>> waiters;
      synchronized (queue) {
        queue.handler = null;
        waiters = new ArrayList<>(queue.waiters);
        queue.waiters.clear();
      }
      waiters.forEach(w -> w.completeExceptionally(new IllegalStateException("Connection lost")));
    }
    this.listeners.forEach(l -> l.handle(ConnectionEvent.DISCONNECTED));
  }

  void reconnect() {
    this.connected = true;
    this.listeners.forEach(l -> l.handle(ConnectionEvent.CREATED));
  }

  boolean hasQueue(String name) {
    return this.queues.containsKey(name);
  }

  int queueCount() {
    return this.queues.size();
  }

  boolean hasConsumer(String queueName) {
    InMemoryQueue queue = this.queues.get(queueName);
    if (queue == null) {
      return false;
    }
    synchronized (queue) {
      return queue.handler != null;
    }
  }

  int connectionListenerCount() {
    return this.listeners.size();
  }

  List<QueueDeclaration> declaredQueues() {
    return this.declaredQueues;
  }

  List<String> declaredExchanges() {
    return this.declaredExchanges;
  }

  List<Published> published() {
    return this.published;
  }

  int droppedMessages() {
    return this.droppedMessages.get();
  }

  @Override
  public void close() {
    this.scheduledExecutorService.shutdownNow();
    this.responderExecutor.shutdownNow();
  }

  private void respond(Responder responder, Message request) {
    Message reply = responder.respond(request);
    if (reply != null && request.replyTo() != null) {
      reply.correlationId(request.correlationId());
      if (this.connected) {
        deliver(request.replyTo(), reply);
      } else {
        this.droppedMessages.incrementAndGet();
      }
    }
  }

  private void deliver(String queueName, Message message) {
    InMemoryQueue queue = this.queues.get(queueName);
    if (queue == null) {
      this.droppedMessages.incrementAndGet();
      return;
    }
    MessageHandler handler;
    CompletableFuture<Message> waiter = null;
    synchronized (queue) {
      handler = queue.handler;
      if (handler == null) {
        waiter = queue.waiters.poll();
        if (waiter == null) {
          queue.messages.add(message);
        }
      }
    }
    if (handler != null) {
      handler.handle(message);
    } else if (waiter != null) {
      maybeDelete(queue);
      waiter.complete(message);
    }
  }

  private void maybeDelete(InMemoryQueue queue) {
    if (queue.autoDelete) {
      this.queues.remove(queue.name, queue);
    }
  }

  private InMemoryQueue queue(String name) {
    InMemoryQueue queue = this.queues.get(name);
    if (queue == null) {
      throw new IllegalStateException("Queue " + name + " does not exist");
    }
    return queue;
  }

  private void checkConnected() {
    if (!this.connected) {
      throw new IllegalStateException("Not connected");
    }
  }

  @FunctionalInterface
  interface Responder {

    /** Return the reply, null for no reply. */
    Message respond(Message request);
  }

  private static final class InMemoryQueue implements QueueInfo {

    private final String name;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Deque<Message> messages = new ArrayDeque<>();
    private final Deque<CompletableFuture<Message>> waiters = new ArrayDeque<>();
    private MessageHandler handler;

    private InMemoryQueue(String name, boolean exclusive, boolean autoDelete) {
      this.name = name;
      this.exclusive = exclusive;
      this.autoDelete = autoDelete;
    }

    @Override
    public String name() {
      return this.name;
    }

    @Override
    public boolean exclusive() {
      return this.exclusive;
    }
  }

  static final class QueueDeclaration {

    private final String name;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Duration expires;

    private QueueDeclaration(
        String name, boolean durable, boolean exclusive, boolean autoDelete, Duration expires) {
      this.name = name;
      this.durable = durable;
      this.exclusive = exclusive;
      this.autoDelete = autoDelete;
      this.expires = expires;
    }

    String name() {
      return this.name;
    }

    boolean durable() {
      return this.durable;
    }

    boolean exclusive() {
      return this.exclusive;
    }

    boolean autoDelete() {
      return this.autoDelete;
    }

    Duration expires() {
      return this.expires;
    }
  }

  static final class Published {

    private final String exchange;
    private final String routingKey;
    private final Message message;

    private Published(String exchange, String routingKey, Message message) {
      this.exchange = exchange;
      this.routingKey = routingKey;
      this.message = message;
    }

    String exchange() {
      return this.exchange;
    }

    String routingKey() {
      return this.routingKey;
    }

    Message message() {
      return this.message;
    }
  }
}
