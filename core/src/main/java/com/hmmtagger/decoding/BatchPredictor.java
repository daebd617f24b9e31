/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.hmmtagger.decoding;

import com.hmmtagger.util.StopWatch;
import com.hmmtagger.util.exceptions.HmmTaggerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Decodes many observation sequences with the same decoder. With more than one thread the
 * sequences are decoded concurrently, the predictions are still returned in input order. The
 * first failing sequence (in input order) fails the whole batch.
 */
public class BatchPredictor {
    private static final Logger logger = LoggerFactory.getLogger(BatchPredictor.class);

    private final ViterbiDecoder decoder;
    private final int threads;

    public BatchPredictor(ViterbiDecoder decoder, int threads) {
        if (threads < 1)
            throw new IllegalArgumentException("threads must be at least 1 but was " + threads);
        this.decoder = decoder;
        this.threads = threads;
    }

    public List<int[]> predict(List<int[]> testCases) {
        StopWatch sw = new StopWatch().start();
        List<int[]> paths = threads == 1 || testCases.size() < 2 ? predictSequentially(testCases) : predictConcurrently(testCases);
        logger.info("decoded {} test cases with {} thread(s), took {}ms", testCases.size(), threads, sw.stop().getMillis());
        return paths;
    }

    private List<int[]> predictSequentially(List<int[]> testCases) {
        List<int[]> paths = new ArrayList<>(testCases.size());
        for (int[] observations : testCases) {
            paths.add(decoder.decode(observations));
        }
        return paths;
    }

    private List<int[]> predictConcurrently(List<int[]> testCases) {
        ExecutorService threadPool = Executors.newFixedThreadPool(Math.min(threads, testCases.size()));
        try {
            List<Future<int[]>> futures = new ArrayList<>(testCases.size());
            for (final int[] observations : testCases) {
                futures.add(threadPool.submit(() -> decoder.decode(observations)));
            }

            List<int[]> paths = new ArrayList<>(testCases.size());
            for (Future<int[]> future : futures) {
                paths.add(future.get());
            }
            return paths;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HmmTaggerException("Interrupted while decoding", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException)
                throw (RuntimeException) ex.getCause();
            throw new HmmTaggerException("Decoding failed", ex.getCause());
        } finally {
            threadPool.shutdownNow();
        }
    }
}
