package com.smurthy.ai.newsintel.clustering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;

/**
 * Hierarchical density-based clustering (HDBSCAN) with GLOSH outlier scores.
 *
 * Steps:
 * 1. Core distance: distance to the min_samples-th nearest point, the point itself counted
 * 2. Minimum spanning tree over mutual reachability max(core(a), core(b), d(a, b))
 * 3. Single-linkage hierarchy from the sorted tree edges
 * 4. Condensed tree: splits smaller than min_cluster_size are points falling out of their
 *    parent cluster, not new clusters
 * 5. Flat clusters: excess-of-mass over cluster stabilities, or the leaves of the condensed
 *    tree, then the optional epsilon merge
 *
 * Runs in O(n^2) time and O(n) extra memory, which suits batches of a few thousand articles.
 */
public class HdbscanBackend implements ClusterBackend {

    private static final Logger log = LoggerFactory.getLogger(HdbscanBackend.class);

    // Zero distances (duplicate embeddings) would give infinite lambda values
    private static final double MIN_DISTANCE = 1e-12;

    private final int minClusterSize;
    private final int minSamples;
    private final double clusterSelectionEpsilon;
    private final SelectionMethod selectionMethod;
    private final boolean allowSingleCluster;

    public HdbscanBackend(int minClusterSize, int minSamples, double clusterSelectionEpsilon, boolean allowSingleCluster) {
        this(minClusterSize, minSamples, clusterSelectionEpsilon, SelectionMethod.EOM, allowSingleCluster);
    }

    public HdbscanBackend(int minClusterSize, int minSamples, double clusterSelectionEpsilon,
                          SelectionMethod selectionMethod, boolean allowSingleCluster) {
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2, got " + minClusterSize);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, got " + minSamples);
        }
        if (clusterSelectionEpsilon < 0) {
            throw new IllegalArgumentException("clusterSelectionEpsilon must be >= 0, got " + clusterSelectionEpsilon);
        }
        this.minClusterSize = minClusterSize;
        this.minSamples = minSamples;
        this.clusterSelectionEpsilon = clusterSelectionEpsilon;
        this.selectionMethod = selectionMethod == null ? SelectionMethod.EOM : selectionMethod;
        this.allowSingleCluster = allowSingleCluster;
    }

    @Override
    public String name() {
        return "hdbscan";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ClusteringResult cluster(float[][] points) {
        int n = points.length;
        if (n < 2) {
            return ClusteringResult.singleCluster(n, name());
        }

        long startTime = System.currentTimeMillis();

        double[] coreDistances = coreDistances(points);
        SpanningTree mst = minimumSpanningTree(points, coreDistances);
        Linkage linkage = singleLinkage(n, mst);
        CondensedTree tree = condense(linkage, n);
        boolean[] selected = selectClusters(tree);
        ClusteringResult result = label(tree, selected, n);

        log.debug("HDBSCAN ({}) over {} points: {} condensed clusters, {} selected, {} noise in {}ms",
                selectionMethod, n, tree.clusterCount, result.clusterCount(), result.noiseCount(),
                System.currentTimeMillis() - startTime);
        return result;
    }

    private double[] coreDistances(float[][] points) {
        int n = points.length;
        int k = Math.min(minSamples, n) - 1;
        double[] core = new double[n];
        double[] distances = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                distances[j] = i == j ? 0.0 : VectorMath.euclidean(points[i], points[j]);
            }
            double[] sorted = distances.clone();
            Arrays.sort(sorted);
            core[i] = sorted[k];
        }
        return core;
    }

    // Prim's algorithm on the implicit complete mutual-reachability graph
    private SpanningTree minimumSpanningTree(float[][] points, double[] core) {
        int n = points.length;
        boolean[] inTree = new boolean[n];
        double[] best = new double[n];
        int[] bestFrom = new int[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);

        int[] from = new int[n - 1];
        int[] to = new int[n - 1];
        double[] weight = new double[n - 1];

        int current = 0;
        inTree[0] = true;
        for (int edge = 0; edge < n - 1; edge++) {
            int next = -1;
            for (int j = 0; j < n; j++) {
                if (inTree[j]) {
                    continue;
                }
                double reach = Math.max(Math.max(core[current], core[j]),
                        VectorMath.euclidean(points[current], points[j]));
                if (reach < best[j]) {
                    best[j] = reach;
                    bestFrom[j] = current;
                }
                if (next == -1 || best[j] < best[next]) {
                    next = j;
                }
            }
            from[edge] = bestFrom[next];
            to[edge] = next;
            weight[edge] = best[next];
            inTree[next] = true;
            current = next;
        }
        return new SpanningTree(from, to, weight);
    }

    private Linkage singleLinkage(int n, SpanningTree mst) {
        Integer[] order = new Integer[n - 1];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> mst.weight()[i]));

        int total = 2 * n - 1;
        int[] parent = new int[total];
        int[] size = new int[total];
        for (int i = 0; i < total; i++) {
            parent[i] = i;
            size[i] = i < n ? 1 : 0;
        }

        int[] left = new int[n - 1];
        int[] right = new int[n - 1];
        double[] height = new double[n - 1];
        for (int k = 0; k < n - 1; k++) {
            int e = order[k];
            int a = find(parent, mst.from()[e]);
            int b = find(parent, mst.to()[e]);
            int node = n + k;
            left[k] = a;
            right[k] = b;
            height[k] = mst.weight()[e];
            size[node] = size[a] + size[b];
            parent[a] = node;
            parent[b] = node;
        }
        return new Linkage(left, right, height, size);
    }

    private CondensedTree condense(Linkage linkage, int n) {
        int root = 2 * n - 2;
        int[] relabel = new int[2 * n - 1];
        boolean[] ignore = new boolean[2 * n - 1];
        relabel[root] = n;
        int nextLabel = n + 1;

        CondensedTree tree = new CondensedTree(n, 2 * n);

        for (int node : breadthFirst(linkage, root, n)) {
            if (node < n || ignore[node]) {
                continue;
            }
            int k = node - n;
            int left = linkage.left()[k];
            int right = linkage.right()[k];
            double lambda = 1.0 / Math.max(linkage.height()[k], MIN_DISTANCE);
            int leftCount = linkage.size()[left];
            int rightCount = linkage.size()[right];

            if (leftCount >= minClusterSize && rightCount >= minClusterSize) {
                relabel[left] = nextLabel++;
                tree.add(relabel[node], relabel[left], lambda, leftCount);
                relabel[right] = nextLabel++;
                tree.add(relabel[node], relabel[right], lambda, rightCount);
            } else if (leftCount < minClusterSize && rightCount < minClusterSize) {
                fallOut(linkage, left, relabel[node], lambda, n, ignore, tree);
                fallOut(linkage, right, relabel[node], lambda, n, ignore, tree);
            } else if (leftCount < minClusterSize) {
                relabel[right] = relabel[node];
                fallOut(linkage, left, relabel[node], lambda, n, ignore, tree);
            } else {
                relabel[left] = relabel[node];
                fallOut(linkage, right, relabel[node], lambda, n, ignore, tree);
            }
        }

        tree.finish(nextLabel - n);
        return tree;
    }

    private void fallOut(Linkage linkage, int subtreeRoot, int clusterLabel, double lambda,
                         int n, boolean[] ignore, CondensedTree tree) {
        for (int sub : breadthFirst(linkage, subtreeRoot, n)) {
            if (sub < n) {
                tree.add(clusterLabel, sub, lambda, 1);
            }
            ignore[sub] = true;
        }
    }

    private List<Integer> breadthFirst(Linkage linkage, int start, int n) {
        List<Integer> order = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            order.add(node);
            if (node >= n) {
                queue.add(linkage.left()[node - n]);
                queue.add(linkage.right()[node - n]);
            }
        }
        return order;
    }

    /**
     * Excess-of-mass selection: keep a cluster when it is more stable than its
     * children combined, otherwise pass the children's stability up.
     */
    private boolean[] selectClusters(CondensedTree tree) {
        if (selectionMethod == SelectionMethod.LEAF) {
            return selectLeaves(tree);
        }
        int clusters = tree.clusterCount;
        double[] stability = tree.stability();
        boolean[] isCluster = new boolean[clusters];

        int lowest = allowSingleCluster ? 0 : 1;
        for (int c = clusters - 1; c >= lowest; c--) {
            isCluster[c] = true;
        }
        for (int c = clusters - 1; c >= lowest; c--) {
            double subtreeStability = 0.0;
            for (int child : tree.children.get(c)) {
                subtreeStability += stability[child];
            }
            if (subtreeStability > stability[c]) {
                isCluster[c] = false;
                stability[c] = subtreeStability;
            } else {
                for (int descendant : tree.descendants(c)) {
                    isCluster[descendant] = false;
                }
            }
        }

        if (clusterSelectionEpsilon != 0.0 && clusters > 1) {
            List<Integer> eomClusters = new ArrayList<>();
            for (int c = 0; c < clusters; c++) {
                if (isCluster[c]) {
                    eomClusters.add(c);
                }
            }
            boolean[] selected = new boolean[clusters];
            if (eomClusters.size() == 1 && eomClusters.get(0) == 0) {
                selected[0] = allowSingleCluster;
            } else {
                for (int c : epsilonSearch(tree, eomClusters)) {
                    selected[c] = true;
                }
            }
            return selected;
        }
        return isCluster;
    }

    /**
     * Leaf selection: every cluster of the condensed tree that never split again.
     */
    private boolean[] selectLeaves(CondensedTree tree) {
        boolean[] selected = new boolean[tree.clusterCount];
        List<Integer> leaves = new ArrayList<>();
        for (int c = 1; c < tree.clusterCount; c++) {
            if (tree.children.get(c).isEmpty()) {
                leaves.add(c);
            }
        }

        // No split reached minClusterSize, the root is the only leaf
        if (leaves.isEmpty()) {
            selected[0] = allowSingleCluster;
            return selected;
        }

        Collection<Integer> chosen = clusterSelectionEpsilon != 0.0 ? epsilonSearch(tree, leaves) : leaves;
        for (int c : chosen) {
            selected[c] = true;
        }
        return selected;
    }

    /**
     * Replace clusters born below the epsilon distance by the closest ancestor born above it.
     */
    private TreeSet<Integer> epsilonSearch(CondensedTree tree, List<Integer> leaves) {
        TreeSet<Integer> selected = new TreeSet<>();
        boolean[] processed = new boolean[tree.clusterCount];

        for (int leaf : leaves) {
            double leafEpsilon = 1.0 / tree.birth[leaf];
            if (leafEpsilon < clusterSelectionEpsilon) {
                if (!processed[leaf]) {
                    int ancestor = traverseUpwards(tree, leaf);
                    selected.add(ancestor);
                    for (int descendant : tree.descendants(ancestor)) {
                        processed[descendant] = true;
                    }
                }
            } else {
                selected.add(leaf);
            }
        }

        // a leaf kept before its ancestor was chosen is covered by that ancestor
        selected.removeIf(c -> {
            for (int p = tree.clusterParent[c]; p >= 0; p = tree.clusterParent[p]) {
                if (selected.contains(p)) {
                    return true;
                }
            }
            return false;
        });
        return selected;
    }

    private int traverseUpwards(CondensedTree tree, int leaf) {
        int parent = tree.clusterParent[leaf];
        if (parent == 0) {
            return allowSingleCluster ? parent : leaf;
        }
        double parentEpsilon = 1.0 / tree.birth[parent];
        if (parentEpsilon > clusterSelectionEpsilon) {
            return parent;
        }
        return traverseUpwards(tree, parent);
    }

    private ClusteringResult label(CondensedTree tree, boolean[] selected, int n) {
        int clusters = tree.clusterCount;
        int[] labelOf = new int[clusters];
        int nextLabel = 0;
        for (int c = 0; c < clusters; c++) {
            labelOf[c] = selected[c] ? nextLabel++ : ClusteringResult.NOISE;
        }

        double[] directDeaths = new double[clusters];
        double rootMaxLambda = 0.0;
        for (int e = 0; e < tree.size; e++) {
            int p = tree.parent[e] - n;
            directDeaths[p] = Math.max(directDeaths[p], tree.lambda[e]);
            if (p == 0) {
                rootMaxLambda = Math.max(rootMaxLambda, tree.lambda[e]);
            }
        }
        double[] subtreeDeaths = directDeaths.clone();
        for (int c = clusters - 1; c >= 1; c--) {
            int p = tree.clusterParent[c];
            subtreeDeaths[p] = Math.max(subtreeDeaths[p], subtreeDeaths[c]);
        }

        int[] labels = new int[n];
        double[] probabilities = new double[n];
        double[] outlierScores = new double[n];

        for (int point = 0; point < n; point++) {
            int c = tree.pointParent[point];
            double lambda = tree.pointLambda[point];

            double maxLambda = subtreeDeaths[c];
            outlierScores[point] = maxLambda == 0.0 ? 0.0 : (maxLambda - lambda) / maxLambda;

            while (!selected[c] && c != 0) {
                c = tree.clusterParent[c];
            }

            int label = ClusteringResult.NOISE;
            if (selected[c]) {
                if (c == 0) {
                    double threshold = clusterSelectionEpsilon != 0.0 ? 1.0 / clusterSelectionEpsilon : rootMaxLambda;
                    label = lambda >= threshold ? labelOf[0] : ClusteringResult.NOISE;
                } else {
                    label = labelOf[c];
                }
            }
            labels[point] = label;

            if (label != ClusteringResult.NOISE) {
                double death = directDeaths[c];
                probabilities[point] = death == 0.0 ? 1.0 : Math.min(lambda, death) / death;
            }
        }

        return new ClusteringResult(labels, probabilities, outlierScores, name());
    }

    private static int find(int[] parent, int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    private record SpanningTree(int[] from, int[] to, double[] weight) {}

    private record Linkage(int[] left, int[] right, double[] height, int[] size) {}

    /**
     * Condensed cluster tree. Cluster labels are stored relative to the point count,
     * so cluster index 0 is the root.
     */
    private static final class CondensedTree {
        private final int pointCount;
        private final int[] parent;
        private final int[] child;
        private final double[] lambda;
        private final int[] childSize;
        private int size;

        private int clusterCount;
        private int[] clusterParent;
        private double[] birth;
        private List<List<Integer>> children;
        private int[] pointParent;
        private double[] pointLambda;

        CondensedTree(int pointCount, int capacity) {
            this.pointCount = pointCount;
            this.parent = new int[capacity];
            this.child = new int[capacity];
            this.lambda = new double[capacity];
            this.childSize = new int[capacity];
        }

        void add(int parentLabel, int childLabel, double lambdaValue, int count) {
            parent[size] = parentLabel;
            child[size] = childLabel;
            lambda[size] = lambdaValue;
            childSize[size] = count;
            size++;
        }

        void finish(int clusters) {
            clusterCount = clusters;
            clusterParent = new int[clusters];
            birth = new double[clusters];
            children = new ArrayList<>(clusters);
            for (int c = 0; c < clusters; c++) {
                children.add(new ArrayList<>());
            }
            pointParent = new int[pointCount];
            pointLambda = new double[pointCount];
            clusterParent[0] = -1;

            for (int e = 0; e < size; e++) {
                int p = parent[e] - pointCount;
                if (child[e] >= pointCount) {
                    int c = child[e] - pointCount;
                    clusterParent[c] = p;
                    birth[c] = lambda[e];
                    children.get(p).add(c);
                } else {
                    pointParent[child[e]] = p;
                    pointLambda[child[e]] = lambda[e];
                }
            }
        }

        double[] stability() {
            double[] stability = new double[clusterCount];
            for (int e = 0; e < size; e++) {
                int p = parent[e] - pointCount;
                stability[p] += (lambda[e] - birth[p]) * childSize[e];
            }
            return stability;
        }

        List<Integer> descendants(int cluster) {
            List<Integer> result = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>(children.get(cluster));
            while (!queue.isEmpty()) {
                int c = queue.poll();
                result.add(c);
                queue.addAll(children.get(c));
            }
            return result;
        }
    }
}
