/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.tracebridge.agent.util;

import java.util.function.Supplier;

/**
 * A value which is computed at most once, on first access.
 * <p>
 * Concurrent first accesses are safe: only one thread invokes the supplier, the others wait for its result.
 * The supplier reference is dropped after the value has been computed.
 * </p>
 * <p>
 * The monitor of this instance is held while the supplier runs, including any call it makes into foreign code.
 * Running the supplier at most once requires that exclusion. Suppliers must therefore not block for long and must not
 * access the same {@link Lazy} again. Once computed, reads don't lock.
 * </p>
 *
 * @param <T> the type of the computed value
 */
public final class Lazy<T> implements Supplier<T> {

    private volatile Supplier<? extends T> supplier;
    private volatile boolean computed;
    private T value;

    private Lazy(Supplier<? extends T> supplier) {
        this.supplier = supplier;
    }

    public static <T> Lazy<T> of(Supplier<? extends T> supplier) {
        return new Lazy<>(supplier);
    }

    @Override
    public T get() {
        if (!computed) {
            synchronized (this) {
                if (!computed) {
                    value = supplier.get();
                    computed = true;
                    supplier = null;
                }
            }
        }
        return value;
    }

    public boolean isComputed() {
        return computed;
    }
}
