/*
 * API.java
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

package io.alerter.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public alerter type, constructor, method or field is for code outside this project.
 *
 * <p>
 * Members inherit the status of their enclosing type unless they carry their own {@code API} annotation. Sink
 * authors in particular should check the status of {@code io.alerter.AlerterSink} and of the helpers they build on
 * before depending on them.
 * </p>
 *
 * <p>
 * A status may move towards {@link Status#STABLE} at any time. Moving away from it only happens with a minor
 * release (for {@link Status#EXPERIMENTAL} and {@link Status#UNSTABLE} elements) or a major release (for
 * {@link Status#STABLE} elements).
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another alerter module can reach it. Not for use by applications or third-party
         * sinks; may change in any release.
         */
        INTERNAL,

        /**
         * Kept for compatibility and scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. May change or disappear in any release.
         */
        EXPERIMENTAL,

        /**
         * Will not change before the next minor release.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release.
         */
        STABLE
    }
}
