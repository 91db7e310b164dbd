package com.nationrank.api.repository.readonly;

import com.nationrank.api.model.readonly.MatchDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Read-only repository for matches.
 * Note: Write operations will fail with MongoDB authorization error.
 */
@Repository
public interface MatchReadRepository extends MongoRepository<MatchDocument, String> {

    /**
     * Matches started in {@code [start, end)}.
     */
    @Query("{ 'startTime': { $gte: ?0, $lt: ?1 } }")
    List<MatchDocument> findByStartTimeWindow(Instant start, Instant end);
}
