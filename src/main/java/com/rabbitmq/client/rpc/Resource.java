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

/**
 * Something with a lifecycle driven by the broker connection, like an {@link RpcClient}.
 *
 * <p>A client is open once its reply path is ready. It is recovering between the loss of the
 * connection and the re-creation of its response queue, and closed once the application closed it.
 * Applications can register {@link StateListener}s to hold off sending requests while the client
 * is recovering.
 *
 * @see RpcClientBuilder#listeners(StateListener...)
 */
public interface Resource {

  /**
   * Callback for lifecycle transitions, registered with the builder.
   *
   * <p>It runs on the thread that triggers the transition, e.g. the transport thread that reports
   * the connection event. Exceptions it throws are logged and ignored.
   *
   * @see RpcClientBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Called on each transition.
     *
     * @param context the transition
     */
    void handle(Context context);
  }

  /** A lifecycle transition. */
  interface Context {

    /**
     * The resource that changed state.
     *
     * @return the resource
     */
    Resource resource();

    /**
     * What made the transition fail, e.g. the error from the response queue re-declaration.
     *
     * @return the failure, or null
     */
    Throwable failureCause();

    /**
     * The state before the transition, null for the first one.
     *
     * @return the state before
     */
    State previousState();

    /**
     * The state after the transition.
     *
     * @return the state after
     */
    State currentState();
  }

  /** Lifecycle states. */
  enum State {
    /** Declaring the reply path. */
    OPENING,
    /** Ready to send requests and receive replies. */
    OPEN,
    /** The connection is gone, the reply path is re-created with the next connection. */
    RECOVERING,
    /** Failing outstanding requests and releasing resources. */
    CLOSING,
    /** Requests are rejected. */
    CLOSED
  }
}
