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

package com.amazon.thermalguard.tree;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;
import static com.amazon.thermalguard.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

/**
 * A tree built in one pass over a fixed batch of points by recursive random
 * partitioning. Each internal node holds a {@link Cut}; each leaf holds the
 * number of sample points that reached it. Points that are easy to separate
 * from the rest end up in shallow leaves.
 *
 * The dimension of a cut is drawn with probabilities proportional to the
 * separation vector of the node's bounding box, and the cut value is uniform
 * inside the box along that dimension.
 */
public class IsolationTree {

    public static final int Null = -1;

    /**
     * Euler-Mascheroni constant, used in the harmonic number approximation
     */
    public static final double EULER_CONSTANT = 0.5772156649;

    private final int maxDepth;

    private final Function<BoundingBox, double[]> separation;

    private final List<Cut> cuts;

    private final List<Integer> leftIndex;

    private final List<Integer> rightIndex;

    private final List<Integer> mass;

    private int root;

    public IsolationTree(int maxDepth, Function<BoundingBox, double[]> separation) {
        checkArgument(maxDepth >= 0, "maximum depth cannot be negative");
        this.maxDepth = maxDepth;
        this.separation = checkNotNull(separation, "separation function must not be null");
        cuts = new ArrayList<>();
        leftIndex = new ArrayList<>();
        rightIndex = new ArrayList<>();
        mass = new ArrayList<>();
        root = Null;
    }

    public IsolationTree(int maxDepth) {
        this(maxDepth, IsolationTree::uniformSeparation);
    }

    /**
     * every dimension with a positive range is equally likely to be cut
     *
     * @param box the bounding box of a node
     * @return the unnormalized probability of cutting each dimension
     */
    public static double[] uniformSeparation(BoundingBox box) {
        double[] answer = new double[box.getDimensions()];
        for (int i = 0; i < box.getDimensions(); i++) {
            if (box.getRange(i) > 0) {
                answer[i] = 1.0;
            }
        }
        return answer;
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * of n points; used to normalize depths and to account for the unbuilt
     * subtree below a leaf holding several points.
     *
     * @param n number of points
     * @return the expected path length
     */
    public static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        } else if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_CONSTANT) - 2.0 * (n - 1.0) / n;
    }

    /**
     * Grows the tree over the given subset of points, replacing any previous
     * structure.
     *
     * @param points     all points, indexed by the sample
     * @param sample     indices of the points this tree is grown on
     * @param randomSeed seed that fixes every cut
     */
    public void makeTree(double[][] points, List<Integer> sample, int randomSeed) {
        checkNotNull(points, "points must not be null");
        checkArgument(sample.size() > 0, "cannot build a tree over an empty sample");
        cuts.clear();
        leftIndex.clear();
        rightIndex.clear();
        mass.clear();
        root = makeTreeInt(points, sample, randomSeed, 0);
    }

    private int makeTreeInt(double[][] points, List<Integer> pointList, int seed, int depth) {
        BoundingBox thisBox = new BoundingBox(points[pointList.get(0)]);
        for (int i = 1; i < pointList.size(); i++) {
            thisBox.addPoint(points[pointList.get(i)]);
        }
        if (depth >= maxDepth || pointList.size() == 1 || thisBox.getRangeSum() <= 0) {
            return addNode(null, pointList.size());
        }

        Random ring = new Random(seed);
        int leftSeed = ring.nextInt();
        int rightSeed = ring.nextInt();
        Cut cut = getCut(thisBox, ring);

        List<Integer> leftList = new ArrayList<>();
        List<Integer> rightList = new ArrayList<>();
        for (int j = 0; j < pointList.size(); j++) {
            if (Cut.isLeftOf(points[pointList.get(j)], cut)) {
                leftList.add(pointList.get(j));
            } else {
                rightList.add(pointList.get(j));
            }
        }
        checkState(leftList.size() > 0 && rightList.size() > 0, "cut failed to separate points");

        int node = addNode(cut, pointList.size());
        int left = makeTreeInt(points, leftList, leftSeed, depth + 1);
        int right = makeTreeInt(points, rightList, rightSeed, depth + 1);
        leftIndex.set(node, left);
        rightIndex.set(node, right);
        return node;
    }

    private int addNode(Cut cut, int nodeMass) {
        cuts.add(cut);
        leftIndex.add(Null);
        rightIndex.add(Null);
        mass.add(nodeMass);
        return cuts.size() - 1;
    }

    private Cut getCut(BoundingBox box, Random ring) {
        Random rng = new Random(ring.nextInt());
        double cutf = rng.nextDouble();
        double dimf = rng.nextDouble();
        int td = -1;
        double rangeSum = 0;
        double[] vector = separation.apply(box);
        for (int i = 0; i < box.getDimensions(); i++) {
            if (box.getRange(i) <= 0) {
                vector[i] = 0;
            }
            rangeSum += vector[i];
        }

        double breakPoint = dimf * rangeSum;
        int lastPositive = -1;
        for (int i = 0; i < box.getDimensions() && td == -1; i++) {
            double range = vector[i];
            if (range > 0) {
                lastPositive = i;
                if (breakPoint <= range) {
                    td = i;
                }
                breakPoint -= range;
            }
        }
        // rounding in the running subtraction can overshoot the final dimension
        if (td == -1) {
            td = lastPositive;
        }

        checkArgument(td != -1, "Pivot selection failed.");
        double cutValue = box.getMinValue(td) + box.getRange(td) * cutf;
        if (cutValue >= box.getMaxValue(td)) {
            cutValue = box.getMinValue(td);
        }
        return new Cut(td, cutValue);
    }

    /**
     * The isolation depth of a point: the depth of the leaf it reaches plus the
     * expected depth of the subtree that was not grown below that leaf.
     *
     * @param point a point of the same dimension as the tree
     * @return the path length
     */
    public double getPathLength(double[] point) {
        checkState(root != Null, "tree has not been built");
        int node = root;
        int depth = 0;
        while (cuts.get(node) != null) {
            node = Cut.isLeftOf(point, cuts.get(node)) ? leftIndex.get(node) : rightIndex.get(node);
            ++depth;
        }
        return depth + averagePathLength(mass.get(node));
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getNumberOfNodes() {
        return cuts.size();
    }

    public int getMass() {
        return (root == Null) ? 0 : mass.get(root);
    }
}
