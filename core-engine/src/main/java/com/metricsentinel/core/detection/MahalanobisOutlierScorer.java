package com.metricsentinel.core.detection;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.util.Objects;

/**
 * Scores points by their Mahalanobis distance from the history's centroid.
 *
 * <p>
 * The squared distance d² is mapped to {@code [0, 1]} through the χ²
 * cumulative distribution with one degree of freedom per feature, which is the
 * distribution d² follows for Gaussian data. A small ridge is added to the
 * covariance diagonal so that features that never varied in the history still
 * yield a finite, very large distance for any departure.
 * </p>
 *
 * @since 1.0.0
 */
public class MahalanobisOutlierScorer implements OutlierScorer {

    /** Ridge relative to the mean feature variance. */
    static final double RIDGE_FACTOR = 1e-6;

    @Override
    public Model fit(double[][] training) {
        Objects.requireNonNull(training, "training must not be null");
        if (training.length < 2) {
            throw new IllegalArgumentException("Need at least 2 training rows, got " + training.length);
        }
        int k = training[0].length;
        RealMatrix data = MatrixUtils.createRealMatrix(training);
        double[] centroid = new double[k];
        for (int c = 0; c < k; c++) {
            centroid[c] = SeriesMath.mean(data.getColumn(c));
        }

        RealMatrix covariance = new Covariance(data, false).getCovarianceMatrix();
        double ridge = RIDGE_FACTOR * Math.max(covariance.getTrace() / k, 1.0);
        for (int c = 0; c < k; c++) {
            covariance.addToEntry(c, c, ridge);
        }
        RealMatrix precision = new LUDecomposition(covariance).getSolver().getInverse();
        return new MahalanobisModel(MatrixUtils.createRealVector(centroid), precision,
                new ChiSquaredDistribution(k));
    }

    private static final class MahalanobisModel implements Model {

        private final RealVector centroid;
        private final RealMatrix precision;
        private final ChiSquaredDistribution chiSquared;

        MahalanobisModel(RealVector centroid, RealMatrix precision, ChiSquaredDistribution chiSquared) {
            this.centroid = centroid;
            this.precision = precision;
            this.chiSquared = chiSquared;
        }

        @Override
        public double score(double[] features) {
            RealVector delta = MatrixUtils.createRealVector(features).subtract(centroid);
            double squaredDistance = Math.max(0.0, delta.dotProduct(precision.operate(delta)));
            double score = chiSquared.cumulativeProbability(squaredDistance);
            return Double.isNaN(score) ? 1.0 : Math.min(Math.max(score, 0.0), 1.0);
        }
    }
}
