package io.percell.command.common;

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


import picocli.CommandLine;

/// Thread count for commands that process independent inputs concurrently.
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Process cell directories in parallel (uses all but one CPU core)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of directories to process concurrently (default: 1, or auto with --parallel)"
    )
    private Integer explicitThreads;

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Calculates the thread count to use.
     * An explicit --threads wins; --parallel leaves one core free; otherwise 1.
     *
     * @return the thread count, at least 1
     */
    public int getOptimalThreadCount() {
        int availableCores = Runtime.getRuntime().availableProcessors();
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        } else if (parallel) {
            return Math.max(1, availableCores - 1);
        } else {
            return 1;
        }
    }

    public boolean isEffectivelyParallel() {
        return getOptimalThreadCount() > 1;
    }
}
