package com.healthsentinel.core.detection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over dense feature rows.
 *
 * <p>
 * Each tree is grown on a random sub-sample by picking a random feature and a
 * random split value between the node's minimum and maximum, until a point is
 * isolated, the node's values are all equal, or the height limit
 * {@code ceil(log2(sampleSize))} is reached. The anomaly score of a point is
 * {@code 2^(-E[h(x)] / c(n))}; values near 1 are easy to isolate.
 * </p>
 *
 * <p>
 * Training is fully determined by the data and the seed. Instances are
 * immutable after {@link #train} and safe to score from several threads.
 * </p>
 *
 * @since 1.0.0
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649;

    private final List<Node> trees;
    private final int sampleSize;

    private IsolationForest(List<Node> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       training rows, each row a feature vector
     * @param numTrees   number of trees
     * @param sampleSize sub-sample size per tree
     * @param seed       random seed
     * @return the trained forest
     */
    static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero rows");
        }
        int effectiveSample = Math.min(sampleSize, data.length);
        int heightLimit = Math.max(1, (int) Math.ceil(Math.log(effectiveSample) / Math.log(2)));
        Random random = new Random(seed);

        List<Node> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, effectiveSample, random);
            trees.add(grow(sample, 0, heightLimit, random));
        }
        return new IsolationForest(trees, effectiveSample);
    }

    /**
     * @param point feature vector
     * @return anomaly score in {@code (0, 1]}
     */
    double score(double[] point) {
        double c = averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.5;
        }
        double total = 0.0;
        for (Node tree : trees) {
            total += tree.pathLength(point, 0);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of {@code n} points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    // ---------------------------------------------------------------
    // Tree construction
    // ---------------------------------------------------------------

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private static Node grow(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int dimensions = rows[0].length;
        // start at a random feature and take the first one that still varies
        int offset = random.nextInt(dimensions);
        for (int k = 0; k < dimensions; k++) {
            int feature = (offset + k) % dimensions;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min = Math.min(min, row[feature]);
                max = Math.max(max, row[feature]);
            }
            if (min == max) {
                continue;
            }
            double split = min + random.nextDouble() * (max - min);
            List<double[]> left = new ArrayList<>();
            List<double[]> right = new ArrayList<>();
            for (double[] row : rows) {
                (row[feature] < split ? left : right).add(row);
            }
            if (left.isEmpty() || right.isEmpty()) {
                // split landed exactly on min; retry on the next feature
                continue;
            }
            return Node.split(feature, split,
                    grow(left.toArray(new double[0][]), depth + 1, heightLimit, random),
                    grow(right.toArray(new double[0][]), depth + 1, heightLimit, random));
        }
        return Node.leaf(rows.length);
    }

    private static final class Node {
        private final int feature;
        private final double split;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, 0);
        }

        double pathLength(double[] point, int depth) {
            if (left == null) {
                return depth + averagePathLength(size);
            }
            return (point[feature] < split ? left : right).pathLength(point, depth + 1);
        }
    }
}
