package io.nosqlbench.spinpop;

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

import java.util.Collection;
import java.util.TreeSet;

/// Thrown when a density model reads a dataset column or hyperparameter that
/// was not supplied.
public class MissingParameterException extends IllegalArgumentException {

    private final String parameterName;

    public MissingParameterException(String parameterName, String message) {
        super(message);
        this.parameterName = parameterName;
    }

    static MissingParameterException datasetKey(String name, Collection<String> available) {
        return new MissingParameterException(name,
            "Dataset has no column '" + name + "' (available: " + new TreeSet<>(available) + ")");
    }

    static MissingParameterException hyperparameter(String name, Collection<String> available) {
        return new MissingParameterException(name,
            "No value for hyperparameter '" + name + "' (available: " + new TreeSet<>(available) + ")");
    }

    /// Returns the name of the missing column or hyperparameter.
    public String getParameterName() {
        return parameterName;
    }
}
