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

package io.percell.cellgroups;

import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.scan.CellDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/// Runs the grouping engine over many cell directories.
///
/// Each directory is an independent task on a fixed thread pool; with one
/// thread the directories run one after another in the given order. A task
/// that throws is logged and recorded as a failed directory.
public class BatchGroupingRunner {

    private static final Logger logger = LogManager.getLogger(BatchGroupingRunner.class);

    private final GroupingConfig config;
    private final int threads;

    public BatchGroupingRunner(GroupingConfig config, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        this.config = config.copy().validate();
        this.threads = threads;
    }

    /// Groups every directory and waits for all of them.
    ///
    /// @param directories directories to process
    /// @param outputRoot root of the output tree
    /// @return per-directory results in the order given
    public BatchSummary run(List<CellDirectory> directories, Path outputRoot) throws InterruptedException {
        logger.info("Grouping {} cell directories with {} thread(s)", directories.size(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, directories.size())));
        List<Future<DirectoryGroupingResult>> futures = new ArrayList<>(directories.size());
        try {
            for (CellDirectory directory : directories) {
                // every task gets its own engine; nothing mutable is shared
                futures.add(pool.submit(() -> new CellGroupingEngine(config)
                    .processDirectory(directory.directory(), outputRoot)));
            }

            List<DirectoryGroupingResult> results = new ArrayList<>(directories.size());
            for (int i = 0; i < futures.size(); i++) {
                Path dir = directories.get(i).directory();
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Unexpected failure grouping {}: {}", dir, e.getCause().toString(), e.getCause());
                    results.add(DirectoryGroupingResult.failure(dir,
                        CellGroupingEngine.outputDirectoryFor(dir, outputRoot), 0, 0, e.getCause().toString()));
                }
            }
            BatchSummary summary = new BatchSummary(results);
            logger.info("Successfully processed {} out of {} cell directories", summary.succeeded(), summary.total());
            return summary;
        } finally {
            pool.shutdown();
            if (!pool.awaitTermination(1, TimeUnit.HOURS)) {
                logger.warn("Grouping pool did not terminate in time");
            }
        }
    }
}
