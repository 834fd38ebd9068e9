package com.fintech.recurringcharges.service.clustering;

import com.fintech.recurringcharges.model.Cluster;
import com.fintech.recurringcharges.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Density-based clustering over feature rows (DBSCAN, Euclidean distance).
 * <p>
 * A row is a core point when at least {@code minSamples} rows, itself included, lie within
 * {@code eps}. Clusters are labelled 0..k-1 in discovery order, which follows row order, so
 * identical input always yields identical labels. Unclustered rows are labelled {@link #NOISE}.
 */
@Slf4j
@Component
public class DensityClusteringEngine {

    public static final int NOISE = -1;

    public int[] cluster(double[][] rows, double eps, int minSamples) {
        if (eps <= 0) {
            throw new IllegalArgumentException("eps must be positive, was " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1, was " + minSamples);
        }

        int[] labels = new int[rows.length];
        Arrays.fill(labels, NOISE);
        if (rows.length == 0) {
            return labels;
        }

        List<IndexedPoint> points = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {
            points.add(new IndexedPoint(i, rows[i]));
        }

        // The clusterer counts neighbours excluding the point itself
        DBSCANClusterer<IndexedPoint> clusterer =
                new DBSCANClusterer<>(eps, minSamples - 1, new EuclideanDistance());
        List<org.apache.commons.math3.ml.clustering.Cluster<IndexedPoint>> found = clusterer.cluster(points);

        for (int label = 0; label < found.size(); label++) {
            for (IndexedPoint point : found.get(label).getPoints()) {
                labels[point.index] = label;
            }
        }

        log.debug("Clustered {} rows into {} clusters (eps={}, minSamples={})",
                rows.length, found.size(), eps, minSamples);
        return labels;
    }

    /**
     * Groups rows by label, dropping noise and clusters smaller than {@code minOccurrences}.
     *
     * @param transactions transactions aligned with {@code rows}
     */
    public List<Cluster> formClusters(List<Transaction> transactions, double[][] rows, int[] labels,
                                      int minOccurrences) {
        Map<Integer, List<Integer>> members = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != NOISE) {
                members.computeIfAbsent(labels[i], k -> new ArrayList<>()).add(i);
            }
        }

        List<Cluster> clusters = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : members.entrySet()) {
            List<Integer> indices = entry.getValue();
            if (indices.size() < minOccurrences) {
                log.debug("Discarding cluster {} with {} members (< {})", entry.getKey(), indices.size(), minOccurrences);
                continue;
            }
            List<Transaction> clusterTransactions = new ArrayList<>(indices.size());
            List<double[]> clusterRows = new ArrayList<>(indices.size());
            for (int index : indices) {
                clusterTransactions.add(transactions.get(index));
                clusterRows.add(rows[index]);
            }
            clusters.add(Cluster.of(entry.getKey(), clusterTransactions, clusterRows));
        }
        return clusters;
    }

    /**
     * Identity-based wrapper so rows with equal values stay distinct points.
     */
    private static final class IndexedPoint implements Clusterable {
        private final int index;
        private final double[] point;

        private IndexedPoint(int index, double[] point) {
            this.index = index;
            this.point = point;
        }

        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
