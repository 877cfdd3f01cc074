package io.nosqlbench.spinpop.backend;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
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

import java.util.function.IntConsumer;

/// Single-threaded [ArrayBackend].
///
/// Stateless, so one shared instance serves every caller.
public final class ScalarArrayBackend extends AbstractArrayBackend {

    private static final ScalarArrayBackend INSTANCE = new ScalarArrayBackend();

    private ScalarArrayBackend() {
    }

    public static ScalarArrayBackend instance() {
        return INSTANCE;
    }

    @Override
    public BackendMode mode() {
        return BackendMode.SCALAR;
    }

    @Override
    protected void forEachIndex(int count, IntConsumer body) {
        for (int i = 0; i < count; i++) {
            body.accept(i);
        }
    }
}
