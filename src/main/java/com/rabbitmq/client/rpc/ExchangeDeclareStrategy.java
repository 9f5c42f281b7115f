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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Contract to make sure the exchange a request is published to exists.
 *
 * <p>The broker default exchange (empty name) always exists, strategies must not declare it.
 */
@FunctionalInterface
public interface ExchangeDeclareStrategy {

  /**
   * Declare the exchange if needed.
   *
   * @param transport the transport to declare the exchange with
   * @param exchange the exchange name
   * @param type the exchange type
   */
  void declareExchange(Transport transport, String exchange, Transport.ExchangeType type);

  /**
   * Strategy that declares each exchange once and remembers it.
   *
   * @return caching strategy
   */
  static ExchangeDeclareStrategy caching() {
    return new CachingExchangeDeclareStrategy();
  }

  /**
   * Strategy that never declares anything, for topologies that exist beforehand.
   *
   * @return no-op strategy
   */
  static ExchangeDeclareStrategy noOp() {
    return (transport, exchange, type) -> {};
  }

  final class CachingExchangeDeclareStrategy implements ExchangeDeclareStrategy {

    private final Set<String> declaredExchanges = ConcurrentHashMap.newKeySet();

    private CachingExchangeDeclareStrategy() {}

    @Override
    public void declareExchange(Transport transport, String exchange, Transport.ExchangeType type) {
      if (exchange.isEmpty() || this.declaredExchanges.contains(exchange)) {
        return;
      }
      transport.declareExchange(exchange, type);
      this.declaredExchanges.add(exchange);
    }

    @Override
    public String toString() {
      return "CachingExchangeDeclareStrategy{" + "declaredExchanges=" + declaredExchanges + '}';
    }
  }
}
