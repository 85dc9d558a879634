/*
 * Copyright 2026 Netflix, Inc.
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

package io.cloudman.api.cluster.model;

import java.util.Map;

import com.google.common.base.Strings;

/**
 * Helper functions for building scale signals from alert notifications.
 */
public final class ScaleSignals {

    /**
     * Alert label carrying the availability zone the alert was raised for.
     */
    public static final String AVAILABILITY_ZONE_LABEL = "availability_zone";

    private ScaleSignals() {
    }

    /**
     * Build a signal from the labels common to all alerts of a notification. The zone is taken from the
     * {@link #AVAILABILITY_ZONE_LABEL} label, and is not set if the label is missing or blank.
     */
    public static ScaleSignal fromAlertLabels(ScaleDirection direction, Map<String, String> commonLabels) {
        String zone = commonLabels == null ? null : Strings.emptyToNull(Strings.nullToEmpty(commonLabels.get(AVAILABILITY_ZONE_LABEL)).trim());
        return new ScaleSignal(direction, zone);
    }
}
