package com.chambua.qualifiers.service;

import com.chambua.qualifiers.model.GoalDiffBucket;
import com.chambua.qualifiers.model.PpgBucket;
import com.chambua.qualifiers.model.RankBucket;
import com.chambua.qualifiers.model.StandingBuckets;
import com.chambua.qualifiers.model.StandingRow;
import org.springframework.stereotype.Component;

/**
 * Maps a standing onto the ordinal buckets used as historical lookup keys.
 * Stateless; an unranked row lands in "6+" and a row with no games has no ppg bucket.
 */
@Component
public class StandingBucketizer {

    public StandingBuckets bucket(StandingRow row) {
        return bucket(row.rank(), row.points(), row.played(), row.goalDiff());
    }

    public StandingBuckets bucket(Integer rank, int points, int played, int goalDiff) {
        return new StandingBuckets(
                RankBucket.of(rank),
                PpgBucket.of(points, played),
                GoalDiffBucket.of(goalDiff));
    }
}
