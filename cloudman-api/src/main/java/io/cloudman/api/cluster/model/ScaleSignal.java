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

import java.util.Objects;
import java.util.Optional;

/**
 * Request to add or remove one node, optionally scoped to an availability zone.
 */
public class ScaleSignal {

    private final ScaleDirection direction;
    private final String zone;

    public ScaleSignal(ScaleDirection direction, String zone) {
        this.direction = direction;
        this.zone = zone;
    }

    public ScaleDirection getDirection() {
        return direction;
    }

    public Optional<String> getZone() {
        return Optional.ofNullable(zone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ScaleSignal that = (ScaleSignal) o;
        return direction == that.direction && Objects.equals(zone, that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, zone);
    }

    @Override
    public String toString() {
        return "ScaleSignal{" +
                "direction=" + direction +
                ", zone='" + zone + '\'' +
                '}';
    }

    public static ScaleSignal up(String zone) {
        return new ScaleSignal(ScaleDirection.Up, zone);
    }

    public static ScaleSignal down(String zone) {
        return new ScaleSignal(ScaleDirection.Down, zone);
    }
}
