package com.metricsentinel.core.detection;

/**
 * Unsupervised outlier model behind {@link OutlierClassifierDetector}.
 *
 * <p>
 * {@link #fit(double[][])} trains on the feature vectors of a series' history
 * and returns a model that maps a feature vector to a normalised score in
 * {@code [0, 1]}, higher meaning more unusual. Alternative models plug in here
 * without touching the detector.
 * </p>
 *
 * @since 1.0.0
 */
public interface OutlierScorer {

    /**
     * @param training one row per history point, all rows of equal length
     * @return the fitted model
     * @throws IllegalArgumentException if the training data cannot be fitted
     */
    Model fit(double[][] training);

    /**
     * A fitted outlier model.
     */
    interface Model {

        /**
         * @param features feature vector of the point to score
         * @return score in {@code [0, 1]}
         */
        double score(double[] features);
    }
}
