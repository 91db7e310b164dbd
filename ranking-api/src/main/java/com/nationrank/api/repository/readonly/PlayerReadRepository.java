package com.nationrank.api.repository.readonly;

import com.nationrank.api.model.readonly.PlayerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PlayerReadRepository extends MongoRepository<PlayerDocument, String> {

    List<PlayerDocument> findByUserIdIn(Collection<String> userIds);
}
