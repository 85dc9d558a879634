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

package io.cloudman.common.util.rx;

import java.util.Collection;
import java.util.function.Supplier;

import rx.Observable;

/**
 * Supplementary Rx operators.
 */
public class ObservableExt {

    /**
     * Emit collection content on subscribe.
     */
    public static <T> Observable<T> fromCallable(Supplier<Collection<T>> supplier) {
        return Observable.fromCallable(supplier::get).flatMapIterable(v -> v);
    }
}
