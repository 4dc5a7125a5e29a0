/*
 * MarshalingTest.java
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

package io.alerter.format;

import io.alerter.AlertMarshaler;
import io.alerter.test.LogAppenderRule;
import io.alerter.util.KeyValue;
import io.alerter.util.KeysAndValues;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import javax.annotation.Nullable;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests for {@link Marshaling}.
 */
public class MarshalingTest {
    @RegisterExtension
    final LogAppenderRule logs = new LogAppenderRule(Marshaling.class.getName(), Level.WARN);

    @Test
    public void plainValuesPassThrough() {
        Object value = new Object();
        assertSame(value, Marshaling.marshal(value));
        assertNull(Marshaling.marshal(null));
        assertThat(logs.getLogEvents(), empty());
    }

    @Test
    public void substituteIsNotMarshaledAgain() {
        AlertMarshaler inner = () -> "inner";
        AlertMarshaler outer = () -> inner;
        assertSame(inner, Marshaling.marshal(outer));
    }

    @Test
    public void nullSubstitute() {
        AlertMarshaler nothing = () -> null;
        assertNull(Marshaling.marshal(nothing));
    }

    @Test
    public void failingMarshalerIsMarked() {
        assertEquals("<marshal-error: java.lang.IllegalStateException: no representation>",
                Marshaling.marshal(new BrokenMarshaler()));
    }

    @Test
    public void failingMarshalerIsReported() {
        Marshaling.marshal(new BrokenMarshaler());

        assertThat(logs.getLogEvents(), hasSize(1));
        LogEvent event = logs.getLastLogEvent();
        assertEquals(Level.WARN, event.getLevel());
        assertEquals("alert marshaler failed valueType=\"" + BrokenMarshaler.class.getName() + "\"",
                logs.getLastLogEventMessage());
        assertThat(event.getThrown(), instanceOf(IllegalStateException.class));
        assertEquals("no representation", event.getThrown().getMessage());
    }

    @Test
    public void marshalValuesKeepsKeys() {
        AlertMarshaler marshaler = () -> 42;
        KeysAndValues marshaled = Marshaling.marshalValues(KeysAndValues.of("a", marshaler, "b", "plain"));
        assertThat(marshaled.asList(), contains(new KeyValue("a", 42), new KeyValue("b", "plain")));
    }

    private static class BrokenMarshaler implements AlertMarshaler {
        @Nullable
        @Override
        public Object marshalAlert() {
            throw new IllegalStateException("no representation");
        }
    }
}
