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

import static com.rabbitmq.client.rpc.impl.TestUtils.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.client.rpc.Message;
import java.util.Date;
import java.util.UUID;
import org.junit.jupiter.api.Test;

public class RpcMessageTest {

  @Test
  void nullBodyIsEmpty() {
    assertThat(new RpcMessage(null).body()).isEmpty();
    assertThat(new RpcMessage().body()).isEmpty();
  }

  @Test
  void noHeadersByDefault() {
    Message message = new RpcMessage(bytes("hello"));
    assertThat(message.hasHeaders()).isFalse();
    assertThat(message.headers()).isEmpty();
    assertThat(message.header("foo")).isNull();
  }

  @Test
  void supportedHeaderTypes() {
    Message message =
        new RpcMessage()
            .header("string", "value")
            .header("bytes", bytes("value"))
            .header("boolean", true)
            .header("byte", (byte) 1)
            .header("int", 42)
            .header("long", 42L)
            .header("null", null);
    assertThat(message.hasHeaders()).isTrue();
    assertThat(message.headers())
        .hasSize(7)
        .containsEntry("string", "value")
        .containsEntry("int", 42);
  }

  @Test
  void unsupportedHeaderTypeIsRejected() {
    Message message = new RpcMessage();
    assertThatThrownBy(() -> message.header("uuid", UUID.randomUUID()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("uuid");
    assertThatThrownBy(() -> message.header("date", new Date()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> message.header(null, "value"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void headersViewIsReadOnly() {
    Message message = new RpcMessage().header("foo", "bar");
    assertThatThrownBy(() -> message.headers().put("bar", "baz"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void propertiesAreSet() {
    Message message =
        new RpcMessage()
            .contentType("text/plain")
            .correlationId("abc-1")
            .replyTo("replies")
            .expiration("1000");
    assertThat(message.contentType()).isEqualTo("text/plain");
    assertThat(message.correlationId()).isEqualTo("abc-1");
    assertThat(message.replyTo()).isEqualTo("replies");
    assertThat(message.expiration()).isEqualTo("1000");
  }
}
