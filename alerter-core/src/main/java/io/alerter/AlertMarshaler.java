/*
 * AlertMarshaler.java
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

package io.alerter;

import io.alerter.annotation.API;

import javax.annotation.Nullable;

/**
 * An optional interface for values passed to an {@link Alerter} as context. Sinks that produce structured output
 * render the object returned by {@link #marshalAlert()} in place of the value itself.
 *
 * <p>
 * Typical uses:
 * </p>
 * <ul>
 *     <li>stop a value from being rendered through its {@link Object#toString()}: return a map or list of its
 *     parts instead</li>
 *     <li>render only some of the fields of a large object: return a smaller object</li>
 *     <li>render state that is not otherwise exposed: return an object that exposes it</li>
 * </ul>
 *
 * <p>
 * Sinks substitute once. If the returned object is itself an {@code AlertMarshaler}, it is rendered as it is.
 * </p>
 */
@API(API.Status.STABLE)
@FunctionalInterface
public interface AlertMarshaler {
    /**
     * Get the representation of this value to alert instead of the value itself.
     *
     * @return the substitute representation, of any type
     */
    @Nullable
    Object marshalAlert();
}
