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
package com.rabbitmq.client.rpc.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new {@link com.rabbitmq.client.rpc.RpcClient} is opened. */
  void openClient();

  /** Called when a {@link com.rabbitmq.client.rpc.RpcClient} is closed. */
  void closeClient();

  /** Called when a request is published. */
  void request();

  /**
   * Called when a request completes.
   *
   * @param outcome outcome of the request
   */
  void outcome(RequestOutcome outcome);

  /** Called when a reply arrives for a request that is no longer outstanding. */
  void lateReply();

  /** The outcomes of a request. */
  enum RequestOutcome {
    /** The reply arrived. */
    SUCCEEDED,
    /** The reply arrived and reports a responder failure. */
    FAULTED,
    /** No reply arrived within the timeout. */
    TIMED_OUT,
    /** The connection was lost while the request was outstanding. */
    CONNECTION_LOST,
    /** The client was closed while the request was outstanding. */
    CLOSED,
    /** The transport failed to send the request or to receive the reply. */
    FAILED
  }
}
