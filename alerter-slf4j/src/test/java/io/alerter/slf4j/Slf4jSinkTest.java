/*
 * Slf4jSinkTest.java
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

package io.alerter.slf4j;

import io.alerter.AlertMarshaler;
import io.alerter.Alerter;
import io.alerter.sinks.SinkOptions;
import io.alerter.test.LogAppenderRule;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Slf4jSink}.
 */
public class Slf4jSinkTest {
    private static final String ROOT = "io.alerter.test.Store";

    @RegisterExtension
    final LogAppenderRule logs = new LogAppenderRule(ROOT, Level.DEBUG);

    private static SinkOptions verbosity(int verbosity) {
        return SinkOptions.newBuilder().setVerbosity(verbosity).build();
    }

    @Test
    public void levelZeroIsInfo() {
        Alerter alerter = Slf4jSink.newAlerter(ROOT, verbosity(0));
        alerter.info("Opened", "path", "/tmp/store", "size", 12);

        LogEvent event = logs.getLastLogEvent();
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(event.getLoggerName()).isEqualTo(ROOT);
        assertThat(logs.getLastLogEventMessage()).isEqualTo("level=0 msg=\"Opened\" path=\"/tmp/store\" size=12");
    }

    @Test
    public void higherLevelsAreDebug() {
        Alerter alerter = Slf4jSink.newAlerter(ROOT, verbosity(2));
        alerter.withLevel(1).info("one");
        alerter.withLevel(2).info("two");
        alerter.withLevel(3).info("three");

        List<LogEvent> events = logs.getLogEvents();
        assertThat(events).hasSize(2);
        assertThat(events).extracting(LogEvent::getLevel).containsExactly(Level.DEBUG, Level.DEBUG);
        assertThat(events.get(1).getMessage().getFormattedMessage()).isEqualTo("level=2 msg=\"two\"");
    }

    @Test
    public void thresholdScenario() {
        Alerter root = Slf4jSink.newAlerter(ROOT, verbosity(1));
        root.withLevel(1).info("x");
        root.withLevel(2).info("x");
        root.withLevel(2).error(null, "y");

        List<LogEvent> events = logs.getLogEvents();
        assertThat(events).extracting(LogEvent::getLevel).containsExactly(Level.DEBUG, Level.ERROR);
        assertThat(events.get(1).getMessage().getFormattedMessage()).isEqualTo("msg=\"y\" error=null");
        assertThat(events.get(1).getThrown()).isNull();
    }

    @Test
    public void backendLevelGatesDebug() {
        Alerter alerter = Slf4jSink.newAlerter("io.alerter.test.Quiet", verbosity(5));
        assertThat(alerter.isEnabled()).isTrue();
        assertThat(alerter.withLevel(1).isEnabled()).isFalse();
    }

    @Test
    public void errorsCarryCause() {
        Alerter alerter = Slf4jSink.newAlerter(ROOT, verbosity(0)).withLevel(4);
        IllegalStateException cause = new IllegalStateException("closed");
        alerter.error(cause, "write failed", "table", "users");

        LogEvent event = logs.getLastLogEvent();
        assertThat(event.getLevel()).isEqualTo(Level.ERROR);
        assertThat(event.getThrown()).isSameAs(cause);
        assertThat(logs.getLastLogEventMessage())
                .isEqualTo("msg=\"write failed\" error=\"java.lang.IllegalStateException: closed\" table=\"users\"");
    }

    @Test
    public void namesExtendLoggerName() {
        Alerter alerter = Slf4jSink.newAlerter(ROOT, verbosity(0)).withName("compactor").withName("level-1");
        assertThat(((Slf4jSink)alerter.getSink()).getLoggerName()).isEqualTo(ROOT + ".compactor.level-1");

        alerter.info("compacted");
        assertThat(logs.getLastLogEvent().getLoggerName()).isEqualTo(ROOT + ".compactor.level-1");
    }

    @Test
    public void classFactoryUsesClassName() {
        Alerter alerter = Slf4jSink.newAlerter(Slf4jSinkTest.class, SinkOptions.defaults());
        assertThat(((Slf4jSink)alerter.getSink()).getLoggerName()).isEqualTo(Slf4jSinkTest.class.getName());
    }

    @Test
    public void systemPropertiesConfigureVerbosity() {
        String previous = System.setProperty(SinkOptions.VERBOSITY_PROPERTY, "3");
        try {
            Alerter alerter = Slf4jSink.newAlerter(Slf4jSinkTest.class);
            assertThat(((Slf4jSink)alerter.getSink()).getOptions().getVerbosity()).isEqualTo(3);
            assertThat(alerter.withLevel(4).isEnabled()).isFalse();
        } finally {
            if (previous == null) {
                System.clearProperty(SinkOptions.VERBOSITY_PROPERTY);
            } else {
                System.setProperty(SinkOptions.VERBOSITY_PROPERTY, previous);
            }
        }
    }

    @Test
    public void valuesDoNotLeakToParent() {
        Alerter root = Slf4jSink.newAlerter(ROOT, verbosity(0)).withValues("store", "primary");
        Alerter child = root.withValues("request", 7);
        child.info("child");
        root.info("root");

        List<LogEvent> events = logs.getLogEvents();
        assertThat(events.get(0).getMessage().getFormattedMessage())
                .isEqualTo("level=0 msg=\"child\" store=\"primary\" request=7");
        assertThat(events.get(1).getMessage().getFormattedMessage())
                .isEqualTo("level=0 msg=\"root\" store=\"primary\"");
    }

    @Test
    public void marshaledValues() {
        AlertMarshaler credentials = () -> Map.of("user", "alice");
        Slf4jSink.newAlerter(ROOT, verbosity(0)).info("login", "credentials", credentials);
        assertThat(logs.getLastLogEventMessage()).isEqualTo("level=0 msg=\"login\" credentials={\"user\":\"alice\"}");
    }

    @Test
    public void renderFailureIsReported() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new UnsupportedOperationException("no string form");
            }
        };
        Slf4jSink.newAlerter(ROOT, verbosity(0)).info("bad", "value", broken);

        LogEvent event = logs.getLastLogEvent();
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getThrown()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(logs.getLastLogEventMessage()).isEqualTo("alert could not be rendered msg=\"bad\"");
    }
}
