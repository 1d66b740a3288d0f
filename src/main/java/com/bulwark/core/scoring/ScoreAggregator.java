package com.bulwark.core.scoring;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.ScoreSummary;
import com.bulwark.core.model.StatusBand;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Sums check scores into an overall percentage and status band.
 */
@Service
public class ScoreAggregator {

    public ScoreSummary aggregate(Collection<CheckResult> results) {
        int total = 0;
        for (CheckResult result : results) {
            total += result.score();
        }
        int max = CheckResult.MAX_SCORE * results.size();
        double percentage = max == 0 ? 0.0 : 100.0 * total / max;
        return new ScoreSummary(total, max, percentage, StatusBand.forPercentage(percentage));
    }
}
