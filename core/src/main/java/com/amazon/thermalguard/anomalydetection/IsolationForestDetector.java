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

package com.amazon.thermalguard.anomalydetection;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import com.amazon.thermalguard.tree.IsolationTree;

/**
 * Isolation forest outlier detection. Every tree is grown on a random
 * subsample of the points by recursive random partitioning; a point that is
 * isolated after few cuts on average is scored as anomalous. The verdict
 * threshold is the score quantile that matches the expected contamination.
 *
 * Randomness is fixed by the random seed: the same points and seed always give
 * the same scores.
 */
public class IsolationForestDetector implements IOutlierDetector {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    /**
     * upper bound on the number of points each tree is grown on
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * expected fraction of anomalies in a batch
     */
    public static final double DEFAULT_CONTAMINATION = 0.05;

    public static final long DEFAULT_RANDOM_SEED = 42L;

    private final int numberOfTrees;

    private final int sampleSize;

    private final double contamination;

    private final long randomSeed;

    protected IsolationForestDetector(Builder builder) {
        checkArgument(builder.numberOfTrees > 0, "number of trees should be greater than 0");
        checkArgument(builder.sampleSize > 0, "sample size should be greater than 0");
        checkArgument(builder.contamination > 0 && builder.contamination <= 0.5,
                "contamination should be in (0, 0.5]");
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        contamination = builder.contamination;
        randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Scores the points with a forest grown on them. Scores are negative; lower
     * means more anomalous, and a score near -1 is a clear outlier.
     *
     * @param points rows of equal length
     * @return one score per row
     */
    public double[] getScores(double[][] points) {
        checkNotNull(points, "points must not be null");
        checkArgument(points.length > 1, "at least two points are required");
        int subsample = Math.min(sampleSize, points.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(subsample, 2)) / Math.log(2.0));

        double[] pathLengthSum = new double[points.length];
        Random random = new Random(randomSeed);
        for (int t = 0; t < numberOfTrees; t++) {
            Random treeRandom = new Random(random.nextLong());
            List<Integer> sample = sampleIndices(points.length, subsample, treeRandom);
            IsolationTree tree = new IsolationTree(maxDepth);
            tree.makeTree(points, sample, treeRandom.nextInt());
            for (int i = 0; i < points.length; i++) {
                pathLengthSum[i] += tree.getPathLength(points[i]);
            }
        }

        double normalizer = IsolationTree.averagePathLength(subsample);
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = -Math.pow(2.0, -(pathLengthSum[i] / numberOfTrees) / normalizer);
        }
        return scores;
    }

    @Override
    public boolean[] detect(double[][] points) {
        double[] scores = getScores(points);
        double threshold = percentile(scores, contamination);
        boolean[] answer = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            answer[i] = scores[i] < threshold;
        }
        return answer;
    }

    /**
     * linearly interpolated quantile
     *
     * @param values   a non-empty array; not modified
     * @param fraction quantile in [0, 1]
     * @return the interpolated value at rank fraction * (n - 1)
     */
    static double percentile(double[] values, double fraction) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double rank = fraction * (sorted.length - 1);
        int low = (int) Math.floor(rank);
        int high = Math.min(low + 1, sorted.length - 1);
        return sorted[low] + (sorted[high] - sorted[low]) * (rank - low);
    }

    /**
     * draws size distinct indices out of total via a partial Fisher-Yates shuffle
     */
    static List<Integer> sampleIndices(int total, int size, Random random) {
        int[] indices = new int[total];
        for (int i = 0; i < total; i++) {
            indices[i] = i;
        }
        List<Integer> answer = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(total - i);
            int t = indices[i];
            indices[i] = indices[j];
            indices[j] = t;
            answer.add(indices[i]);
        }
        return answer;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public static class Builder {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private long randomSeed = DEFAULT_RANDOM_SEED;

        public Builder numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder contamination(double contamination) {
            this.contamination = contamination;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public IsolationForestDetector build() {
            return new IsolationForestDetector(this);
        }
    }
}
