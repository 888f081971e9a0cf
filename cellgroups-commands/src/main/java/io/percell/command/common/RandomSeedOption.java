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

/// Seed for the seeded clustering initializations.
public class RandomSeedOption {

    /**
     * Picocli type converter for seed values.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Long> {

        @Override
        public Long convert(String value) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer."
                );
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for clustering initializations (default: from config, else 0)",
        converter = SeedConverter.class
    )
    private Long seed;

    /**
     * Checks if a seed was explicitly specified by the user.
     */
    public boolean isSeedSpecified() {
        return seed != null;
    }

    /**
     * Gets the seed, or the fallback when none was given.
     */
    public long getSeedOr(long fallback) {
        return seed != null ? seed : fallback;
    }

    @Override
    public String toString() {
        return seed != null ? String.valueOf(seed) : "default";
    }
}
