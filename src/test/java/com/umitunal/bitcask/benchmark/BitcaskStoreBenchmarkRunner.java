/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.umitunal.bitcask.benchmark;

import org.junit.jupiter.api.Test;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.concurrent.TimeUnit;

/**
 * Runner class for BitcaskStore benchmarks. It can be executed directly from an IDE
 * or through {@link #main(String[])}; the class name keeps it out of the regular test run.
 */
public class BitcaskStoreBenchmarkRunner {

    /**
     * Runs a quick benchmark pass from the IDE's JUnit launcher.
     *
     * @throws RunnerException If an error occurs during benchmark execution
     */
    @Test
    public void runBenchmarks() throws RunnerException {
        System.out.println("Starting BitcaskStore benchmarks...");
        runBenchmarks(1, 1, 1, "bitcask-store-quick-benchmark-results.txt");
        System.out.println("BitcaskStore benchmarks completed.");
    }

    public static void main(String[] args) throws RunnerException {
        runBenchmarks(3, 5, 1, "bitcask-store-benchmark-results.txt");
    }

    /**
     * Run the benchmarks with custom options.
     *
     * @param warmupIterations Number of warmup iterations
     * @param measurementIterations Number of measurement iterations
     * @param forks Number of JVM forks
     * @param resultFile File to save results to
     * @throws RunnerException If an error occurs during benchmark execution
     */
    public static void runBenchmarks(int warmupIterations, int measurementIterations,
                                     int forks, String resultFile) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(BitcaskStoreBenchmark.class.getSimpleName())
            .warmupIterations(warmupIterations)
            .warmupTime(TimeValue.seconds(1))
            .measurementIterations(measurementIterations)
            .measurementTime(TimeValue.seconds(1))
            .forks(forks)
            .jvmArgs("-Xms1G", "-Xmx1G")
            .shouldDoGC(true)
            .shouldFailOnError(true)
            .resultFormat(ResultFormatType.TEXT)
            .result(resultFile)
            .timeUnit(TimeUnit.MICROSECONDS)
            .build();

        new Runner(options).run();

        System.out.println("Benchmark completed. Results saved to " + resultFile);
    }
}
