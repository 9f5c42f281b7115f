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

import static com.rabbitmq.client.rpc.RpcClientBuilder.ResponseQueueStrategy.FRESH_QUEUE;
import static com.rabbitmq.client.rpc.RpcClientBuilder.ResponseQueueStrategy.REUSE_QUEUE;
import static com.rabbitmq.client.rpc.impl.Assertions.assertThat;
import static com.rabbitmq.client.rpc.impl.TestUtils.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.client.rpc.ExchangeDeclareStrategy;
import com.rabbitmq.client.rpc.Message;
import com.rabbitmq.client.rpc.RpcClient;
import com.rabbitmq.client.rpc.RpcException;
import com.rabbitmq.client.rpc.RpcHeaderKeys;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DefaultRpcClientBuilderTest {

  InMemoryTransport transport;

  @BeforeEach
  void init() {
    transport = new InMemoryTransport();
  }

  @AfterEach
  void tearDown() {
    transport.close();
  }

  @Test
  void reuseQueueIsTheDefaultStrategy() {
    DefaultRpcClientBuilder builder = new DefaultRpcClientBuilder(transport);
    assertThat(builder.strategy()).isEqualTo(REUSE_QUEUE);
    assertThat(builder.timeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(builder.headerKeys()).isEqualTo(RpcHeaderKeys.defaults());
    try (RpcClient client = builder.build()) {
      assertThat(client).isInstanceOf(ReuseQueueRpcClient.class);
    }
  }

  @Test
  void freshQueueStrategy() {
    try (RpcClient client = new DefaultRpcClientBuilder(transport).strategy(FRESH_QUEUE).build()) {
      assertThat(client).isInstanceOf(FreshQueueRpcClient.class);
      assertThat(transport.declaredQueues()).isEmpty();
    }
  }

  @Test
  void builderCanCreateSeveralClients() {
    DefaultRpcClientBuilder builder = new DefaultRpcClientBuilder(transport);
    try (RpcClient client1 = builder.build();
        RpcClient client2 = builder.build()) {
      assertThat(((ReuseQueueRpcClient) client1).responseQueueName())
          .isNotEqualTo(((ReuseQueueRpcClient) client2).responseQueueName());
    }
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThatThrownBy(() -> new DefaultRpcClientBuilder(null))
        .isInstanceOf(IllegalArgumentException.class);
    DefaultRpcClientBuilder builder = new DefaultRpcClientBuilder(transport);
    assertThatThrownBy(() -> builder.timeout(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.timeout(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.timeout(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.strategy(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.headerKeys(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.responseQueueName(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void customHeaderKeysAreUsedToDetectFaults() {
    transport.respondOn(
        "fail",
        request ->
            new RpcMessage().header("x-failed", true).header("x-error", TestUtils.bytes("boom")));
    try (RpcClient client =
        new DefaultRpcClientBuilder(transport)
            .headerKeys(RpcHeaderKeys.of("x-failed", "x-error"))
            .build()) {
      Throwable failure =
          TestUtils.failure(client.request("", "fail", false, false, null, client.message()));
      assertThat(failure).isInstanceOf(RpcException.RpcResponderException.class).hasMessage("boom");
    }
  }

  @Test
  void noOpExchangeDeclareStrategyDeclaresNothing() {
    transport.respondOn("upper", TestUtils.upperCase());
    try (RpcClient client =
        new DefaultRpcClientBuilder(transport)
            .exchangeDeclareStrategy(ExchangeDeclareStrategy.noOp())
            .build()) {
      Message reply =
          result(
              client.request(
                  "orders", "upper", false, false, null, client.message(TestUtils.bytes("a"))));
      assertThat(reply).hasBody("A");
      assertThat(transport.declaredExchanges()).isEmpty();
    }
  }

  @Test
  void eachClientHasItsOwnExchangeCache() {
    transport.respondOn("upper", TestUtils.upperCase());
    DefaultRpcClientBuilder builder = new DefaultRpcClientBuilder(transport);
    try (RpcClient client1 = builder.build();
        RpcClient client2 = builder.build()) {
      result(client1.request("orders", "upper", false, false, null, client1.message()));
      result(client2.request("orders", "upper", false, false, null, client2.message()));
      assertThat(transport.declaredExchanges()).containsExactly("orders", "orders");
    }
  }
}
