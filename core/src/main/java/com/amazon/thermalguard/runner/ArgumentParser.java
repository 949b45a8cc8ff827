/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.thermalguard.runner;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.thermalguard.anomalydetection.IsolationForestDetector;
import com.amazon.thermalguard.anomalydetection.OneClassSvmDetector;
import com.amazon.thermalguard.config.AnalysisFocus;
import com.amazon.thermalguard.spatial.SpatialConsensus;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/thermalguard-serialization-json-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument focus;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument sampleSize;
    private final DoubleArgument contamination;
    private final DoubleArgument nu;
    private final DoubleArgument clusterDistance;
    private final LongArgument randomSeed;

    /**
     * Create a new ArgumentParser. The runner class and runner description will be
     * used in help text.
     * 
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        focus = new StringArgument("-f", "--focus",
                "Analysis focus (HSE, ENERGY, MAINTENANCE, DIAGNOSTIC); overrides the focus of the request.", null);
        addArgument(focus);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees in the isolation forest.",
                IsolationForestDetector.DEFAULT_NUMBER_OF_TREES,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));
        addArgument(numberOfTrees);

        sampleSize = new IntegerArgument("-s", "--sample-size", "Maximum number of points each tree is grown on.",
                IsolationForestDetector.DEFAULT_SAMPLE_SIZE,
                n -> checkArgument(n > 0, "sample size should be greater than 0"));
        addArgument(sampleSize);

        contamination = new DoubleArgument("-c", "--contamination",
                "Expected fraction of anomalies for the isolation forest.",
                IsolationForestDetector.DEFAULT_CONTAMINATION,
                n -> checkArgument(n > 0.0 && n <= 0.5, "contamination should be in (0, 0.5]"));
        addArgument(contamination);

        nu = new DoubleArgument(null, "--nu", "Bound on the fraction of points outside the one-class SVM boundary.",
                OneClassSvmDetector.DEFAULT_NU, n -> checkArgument(n > 0.0 && n <= 1.0, "nu should be in (0, 1]"));
        addArgument(nu);

        clusterDistance = new DoubleArgument("-d", "--cluster-distance",
                "Distance below which two anomalous sensors confirm a cluster.",
                SpatialConsensus.DEFAULT_DISTANCE_THRESHOLD,
                n -> checkArgument(n > 0.0, "cluster distance should be greater than 0"));
        addArgument(clusterDistance);

        randomSeed = new LongArgument(null, "--random-seed", "Random seed to use in the isolation forest",
                IsolationForestDetector.DEFAULT_RANDOM_SEED);
        addArgument(randomSeed);
    }

    /**
     * Add a new argument to this argument parser.
     * 
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     * 
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDERR; STDOUT is reserved for results.
     */
    public void printUsage() {
        System.err.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file",
                ARCHIVE_NAME, runnerClass));
        System.err.println();
        System.err.println(runnerDescription);
        System.err.println();
        System.err.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.err.println("\t" + msg));

        System.err.println();
        System.err.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     * 
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the focus given on the command line, which takes precedence over the
     *         focus of the request
     */
    public Optional<AnalysisFocus> getFocus() {
        return Optional.ofNullable(focus.getValue()).map(AnalysisFocus::parse);
    }

    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    public int getSampleSize() {
        return sampleSize.getValue();
    }

    public double getContamination() {
        return contamination.getValue();
    }

    public double getNu() {
        return nu.getValue();
    }

    public double getClusterDistance() {
        return clusterDistance.getValue();
    }

    public long getRandomSeed() {
        return randomSeed.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class LongArgument extends Argument<Long> {
        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
