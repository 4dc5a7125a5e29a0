/*
 * DiscardSink.java
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

package io.alerter.sinks;

import io.alerter.AlerterSink;
import io.alerter.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A sink that is never enabled and drops everything written to it.
 *
 * @see io.alerter.Alerter#discard()
 */
@API(API.Status.STABLE)
public final class DiscardSink implements AlerterSink {
    private static final DiscardSink INSTANCE = new DiscardSink();

    private DiscardSink() {
    }

    @Nonnull
    public static DiscardSink instance() {
        return INSTANCE;
    }

    @Override
    public boolean isEnabled(int level) {
        return false;
    }

    @Override
    public void info(int level, @Nonnull String msg, @Nullable Object... keysAndValues) {
        // discarded
    }

    @Override
    public void error(@Nullable Throwable err, @Nonnull String msg, @Nullable Object... keysAndValues) {
        // discarded
    }

    @Nonnull
    @Override
    public AlerterSink withValues(@Nullable Object... keysAndValues) {
        return this;
    }

    @Nonnull
    @Override
    public AlerterSink withName(@Nonnull String name) {
        return this;
    }

    @Override
    public String toString() {
        return "DiscardSink";
    }
}
