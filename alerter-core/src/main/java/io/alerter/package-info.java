/*
 * package-info.java
 *
 * This source file is part of the alerter open source project
 *
 * Copyright 2023 The alerter Authors
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

/**
 * A small structured alerting API.
 *
 * <p>
 * Applications write through {@link io.alerter.Alerter} handles, which are cheap immutable values. Each handle
 * forwards to an {@link io.alerter.AlerterSink}, the pluggable backend that decides what is written and where.
 * Handles compose: {@link io.alerter.Alerter#withLevel(int)} raises the verbosity level,
 * {@link io.alerter.Alerter#withValues(Object...)} adds context and {@link io.alerter.Alerter#withName(String)}
 * extends the name. Values may implement {@link io.alerter.AlertMarshaler} to choose how they are rendered.
 * </p>
 */
package io.alerter;
