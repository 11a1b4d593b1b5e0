package uk.gegc.knowledgeqa.features.history.application;

import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.features.evaluation.domain.model.EvaluationStatus;
import uk.gegc.knowledgeqa.features.history.domain.model.EvaluationStatistics;
import uk.gegc.knowledgeqa.features.history.domain.model.QaRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class EvaluationStatisticsCalculator {

    static final List<String> SCORE_BUCKETS = List.of("9-10", "8-8.9", "7-7.9", "6-6.9", "5-5.9", "0-4.9");

    public EvaluationStatistics calculate(List<QaRecord> records) {
        Map<String, Integer> scoreDistribution = new LinkedHashMap<>();
        SCORE_BUCKETS.forEach(bucket -> scoreDistribution.put(bucket, 0));
        Map<String, Integer> statusDistribution = new LinkedHashMap<>();
        for (EvaluationStatus status : EvaluationStatus.values()) {
            statusDistribution.put(status.name(), 0);
        }

        if (records == null || records.isEmpty()) {
            return new EvaluationStatistics(0, 0, 0.0, 0.0, scoreDistribution, statusDistribution);
        }

        int correct = 0;
        int evaluated = 0;
        double scoreSum = 0.0;
        for (QaRecord record : records) {
            statusDistribution.merge(record.status().name(), 1, Integer::sum);
            if (record.evaluation().correct()) {
                correct++;
            }
            if (record.status() == EvaluationStatus.EVALUATED) {
                evaluated++;
                scoreSum += record.evaluation().score();
                scoreDistribution.merge(bucketOf(record.evaluation().score()), 1, Integer::sum);
            }
        }

        double accuracyRate = round(correct * 100.0 / records.size());
        double averageScore = evaluated == 0 ? 0.0 : round(scoreSum / evaluated);
        return new EvaluationStatistics(records.size(), correct, accuracyRate, averageScore,
                scoreDistribution, statusDistribution);
    }

    static String bucketOf(double score) {
        if (score >= 9.0) {
            return "9-10";
        } else if (score >= 8.0) {
            return "8-8.9";
        } else if (score >= 7.0) {
            return "7-7.9";
        } else if (score >= 6.0) {
            return "6-6.9";
        } else if (score >= 5.0) {
            return "5-5.9";
        }
        return "0-4.9";
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
