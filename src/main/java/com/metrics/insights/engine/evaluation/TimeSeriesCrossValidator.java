package com.metrics.insights.engine.evaluation;

import com.metrics.insights.model.CrossValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Rolling-origin cross-validation. Fold i trains on data[0, testStart) and
 * scores the prediction of data[testStart, testStart + testSize) by R², where
 * testSize = n / folds and testStart = minTrainSize + i * testSize.
 */
public class TimeSeriesCrossValidator {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesCrossValidator.class);

    public static final int DEFAULT_FOLDS = 5;
    static final double DEFAULT_MIN_TRAIN_FRACTION = 0.3;

    /**
     * @param minTrainSize null or non-positive means 30% of the data
     */
    public <M> CrossValidationResult<M> crossValidate(double[] data,
                                                      Function<double[], M> trainer,
                                                      BiFunction<M, Integer, double[]> predictor,
                                                      int folds,
                                                      Integer minTrainSize) {
        if (folds < 1) {
            throw new IllegalArgumentException("folds must be >= 1, was " + folds);
        }
        int n = data.length;
        int testSize = n / folds;
        int minTrain = minTrainSize != null && minTrainSize > 0
                ? minTrainSize
                : (int) Math.floor(n * DEFAULT_MIN_TRAIN_FRACTION);

        List<Double> scores = new ArrayList<>();
        double bestScore = Double.NEGATIVE_INFINITY;
        M bestModel = null;

        for (int i = 0; i < folds; i++) {
            int testStart = minTrain + i * testSize;
            int testEnd = Math.min(testStart + testSize, n);
            if (testStart >= n) break;
            if (testStart < minTrain || testEnd <= testStart) continue;

            double[] train = Arrays.copyOfRange(data, 0, testStart);
            double[] test = Arrays.copyOfRange(data, testStart, testEnd);
            try {
                M model = trainer.apply(train);
                double[] predictions = predictor.apply(model, test.length);
                double r2 = ModelMetricsCalculator.calculate(test, predictions).getR2();
                scores.add(r2);
                if (r2 > bestScore) {
                    bestScore = r2;
                    bestModel = model;
                }
            } catch (RuntimeException e) {
                log.warn("Cross-validation fold {} failed: {}", i, e.getMessage());
            }
        }

        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double std = 0.0;
        if (scores.size() > 1) {
            double sumSq = 0.0;
            for (double s : scores) sumSq += (s - mean) * (s - mean);
            std = Math.sqrt(sumSq / (scores.size() - 1));
        }

        return CrossValidationResult.<M>builder()
                .scores(List.copyOf(scores))
                .meanScore(mean)
                .stdScore(std)
                .bestModel(bestModel)
                .build();
    }
}
