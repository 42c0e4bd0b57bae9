package com.oapce.sentinel.detection;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;

/**
 * Isolation forest over dense feature vectors (Liu, Ting and Zhou, 2008).
 *
 * <p>Each tree is grown on a random sub-sample by splitting a random feature at a uniformly drawn
 * threshold until every sample is isolated or the height limit {@code ceil(log2(maxSamples))} is
 * reached. Points that are isolated after few splits are anomalous. {@link #scoreSamples} returns
 * the negated anomaly score {@code -2^(-E[h(x)]/c(maxSamples))}, so lower means more abnormal.
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329d;

    private final List<Node> trees;
    private final int maxSamples;

    private IsolationForest(List<Node> trees, int maxSamples) {
        this.trees = trees;
        this.maxSamples = maxSamples;
    }

    static IsolationForest fit(double[][] data, int nEstimators, int maxSamples, double maxFeatures,
                               RandomGenerator random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("data must not be empty");
        }
        int featureCount = data[0].length;
        int sampleSize = Math.min(maxSamples, data.length);
        int featuresPerTree = Math.max(1, (int) Math.round(maxFeatures * featureCount));
        int heightLimit = (int) Math.ceil(log2(Math.max(sampleSize, 2)));

        int[] rowIndices = MathArrays.natural(data.length);
        int[] featureIndices = MathArrays.natural(featureCount);
        List<Node> trees = new ArrayList<>(nEstimators);
        for (int t = 0; t < nEstimators; t++) {
            MathArrays.shuffle(rowIndices, random);
            int[] sample = new int[sampleSize];
            System.arraycopy(rowIndices, 0, sample, 0, sampleSize);

            MathArrays.shuffle(featureIndices, random);
            int[] features = new int[featuresPerTree];
            System.arraycopy(featureIndices, 0, features, 0, featuresPerTree);

            trees.add(grow(data, sample, features, 0, heightLimit, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    double[] scoreSamples(double[][] data) {
        double normalizer = averagePathLength(maxSamples);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double totalPath = 0d;
            for (Node tree : trees) {
                totalPath += pathLength(tree, data[i]);
            }
            double meanPath = totalPath / trees.size();
            scores[i] = -Math.pow(2d, -meanPath / normalizer);
        }
        return scores;
    }

    int treeCount() {
        return trees.size();
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree of {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0d;
        }
        if (n == 2) {
            return 1d;
        }
        return 2d * (Math.log(n - 1d) + EULER_GAMMA) - 2d * (n - 1d) / n;
    }

    private static Node grow(double[][] data, int[] rows, int[] features, int depth, int heightLimit,
                             RandomGenerator random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int[] candidates = splittableFeatures(data, rows, features);
        if (candidates.length == 0) {
            return Node.leaf(rows.length);
        }
        int feature = candidates[random.nextInt(candidates.length)];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int row : rows) {
            min = Math.min(min, data[row][feature]);
            max = Math.max(max, data[row][feature]);
        }
        double threshold = min + random.nextDouble() * (max - min);
        if (threshold >= max) {
            threshold = min;
        }
        int leftCount = 0;
        for (int row : rows) {
            if (data[row][feature] <= threshold) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (data[row][feature] <= threshold) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        return Node.split(feature, threshold,
                grow(data, left, features, depth + 1, heightLimit, random),
                grow(data, right, features, depth + 1, heightLimit, random));
    }

    private static int[] splittableFeatures(double[][] data, int[] rows, int[] features) {
        int[] splittable = new int[features.length];
        int count = 0;
        for (int feature : features) {
            double first = data[rows[0]][feature];
            for (int row : rows) {
                if (data[row][feature] != first) {
                    splittable[count++] = feature;
                    break;
                }
            }
        }
        int[] result = new int[count];
        System.arraycopy(splittable, 0, result, 0, count);
        return result;
    }

    private static double pathLength(Node node, double[] point) {
        int edges = 0;
        Node current = node;
        while (!current.isLeaf()) {
            current = point[current.feature] <= current.threshold ? current.left : current.right;
            edges++;
        }
        return edges + averagePathLength(current.size);
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2d);
    }

    private static final class Node {
        private final int feature;
        private final double threshold;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int feature, double threshold, Node left, Node right, int size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, left.size + right.size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
