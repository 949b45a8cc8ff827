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

package com.amazon.thermalguard.serialize.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import lombok.extern.slf4j.Slf4j;

import com.amazon.thermalguard.model.AnalysisRequest;
import com.amazon.thermalguard.runner.ArgumentParser;
import com.amazon.thermalguard.serialize.AnalysisRequestMapper;
import com.amazon.thermalguard.serialize.MalformedInputException;

/**
 * A command-line application that parses command-line arguments, reads one JSON
 * snapshot from STDIN and writes a single result line to STDOUT. Diagnostics go
 * to STDERR so that STDOUT carries only the result.
 */
@Slf4j
public abstract class SnapshotRunner {

    public static final int EXIT_MALFORMED_INPUT = 1;

    protected final ArgumentParser argumentParser;
    protected final AnalysisRequestMapper mapper;

    /**
     * Create a new SnapshotRunner.
     *
     * @param argumentParser An argument parser that will be used by this runner
     *                       to parse command-line arguments.
     * @param mapper         The mapper used to read the snapshot.
     */
    protected SnapshotRunner(ArgumentParser argumentParser, AnalysisRequestMapper mapper) {
        this.argumentParser = argumentParser;
        this.mapper = mapper;
    }

    /**
     * Parse the given command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Read the whole snapshot from an input stream, process it, and write the
     * result line to an output stream.
     *
     * @param in  An input stream holding one JSON snapshot.
     * @param out An output stream where the result line will be written.
     * @throws IOException             if IO errors are encountered during reading
     *                                 or writing.
     * @throws MalformedInputException if the snapshot cannot be read as a request.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        StringBuilder json = new StringBuilder();
        String line;
        while ((line = in.readLine()) != null) {
            json.append(line).append('\n');
        }

        AnalysisRequest request = mapper.parse(json.toString());
        out.println(process(request));
        out.flush();
    }

    /**
     * Like {@link #run} but reports malformed input instead of throwing.
     *
     * @return the process exit status
     */
    public int execute(BufferedReader in, PrintWriter out) throws IOException {
        try {
            run(in, out);
            return 0;
        } catch (MalformedInputException e) {
            log.error("Malformed input: {}", e.getMessage());
            return EXIT_MALFORMED_INPUT;
        }
    }

    /**
     * @param request the parsed snapshot
     * @return the single line written to the output
     */
    protected abstract String process(AnalysisRequest request);

    protected static int runMain(SnapshotRunner runner, String... args) throws IOException {
        runner.parse(args);
        return runner.execute(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }
}
