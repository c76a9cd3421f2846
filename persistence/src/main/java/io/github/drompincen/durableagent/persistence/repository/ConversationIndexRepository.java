package io.github.drompincen.durableagent.persistence.repository;

import io.github.drompincen.durableagent.persistence.document.ConversationIndexDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ConversationIndexRepository extends MongoRepository<ConversationIndexDocument, String> {
    long countByUserId(String userId);
    long countByUserIdAndResolvedTrue(String userId);
}
