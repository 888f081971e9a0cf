package io.percell.command.cellgroups;

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


import io.percell.command.cellgroups.subcommands.CMD_cellgroups_features;
import io.percell.command.cellgroups.subcommands.CMD_cellgroups_group;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Group single-cell images into ordered intensity bins
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "cellgroups",
    header = "Group single-cell images into ordered intensity bins",
    description = "Clusters cells by intensity and writes one composite image per bin",
    subcommands = {
        CMD_cellgroups_group.class,
        CMD_cellgroups_features.class,
        CommandLine.HelpCommand.class
    })
public class CMD_cellgroups implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_cellgroups.class);

    /// Create the CMD_cellgroups command
    public CMD_cellgroups() {}

    /// Creates the configured command line, shared by main and tests
    /// @return the command line
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_cellgroups()).setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Run a cellgroups command
    /// @param args Command line arguments
    public static void main(String[] args) {
        logger.debug("executing commandline");
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}
