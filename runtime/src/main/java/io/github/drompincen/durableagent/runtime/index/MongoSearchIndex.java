package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.persistence.document.ConversationIndexDocument;
import io.github.drompincen.durableagent.persistence.repository.ConversationIndexRepository;
import io.github.drompincen.durableagent.protocol.api.UserStatisticsDto;
import io.github.drompincen.durableagent.runtime.graph.TurnRecord;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.TextIndexDefinition;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.TextCriteria;
import org.springframework.data.mongodb.core.query.TextQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Search index on the {@code conversation_index} collection. Text matching uses Mongo's text index
 * on the concatenated message text, with each query term as its own phrase so that all terms must
 * be present.
 */
public class MongoSearchIndex implements SearchIndex {

    private static final Logger log = LoggerFactory.getLogger(MongoSearchIndex.class);

    private final ConversationIndexRepository repository;
    private final MongoTemplate mongoTemplate;

    public MongoSearchIndex(ConversationIndexRepository repository, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void upsert(SearchDocument doc) {
        repository.save(toDocument(doc));
        log.debug("Indexed thread {}", doc.threadId());
    }

    @Override
    public List<SearchDocument> search(String query, SearchFilter filter, int limit) {
        try {
            Query q = buildQuery(query, filter, limit);
            List<SearchDocument> hits = mongoTemplate.find(q, ConversationIndexDocument.class).stream()
                    .map(MongoSearchIndex::fromDocument)
                    .toList();
            log.info("Search '{}' found {} result(s)", query, hits.size());
            return hits;
        } catch (RuntimeException e) {
            log.error("Conversation search failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    static Query buildQuery(String query, SearchFilter filter, int limit) {
        Query q;
        if (query != null && !query.isBlank()) {
            TextCriteria text = TextCriteria.forDefaultLanguage();
            for (String term : query.trim().split("\\s+")) {
                text.matchingPhrase(term);
            }
            q = TextQuery.queryText(text);
        } else {
            q = new Query();
        }
        if (filter.userId() != null) {
            q.addCriteria(Criteria.where("userId").is(filter.userId()));
        }
        if (filter.intent() != null) {
            q.addCriteria(Criteria.where("intent").is(filter.intent()));
        }
        if (filter.resolved() != null) {
            q.addCriteria(Criteria.where("resolved").is(filter.resolved()));
        }
        return q.with(Sort.by(Sort.Direction.DESC, "timestamp")).limit(limit);
    }

    @Override
    public UserStatisticsDto aggregate(String userId) {
        try {
            long total = repository.countByUserId(userId);
            long resolved = repository.countByUserIdAndResolvedTrue(userId);
            Aggregation byIntent = Aggregation.newAggregation(
                    Aggregation.match(Criteria.where("userId").is(userId).and("intent").ne(null)),
                    Aggregation.group("intent").count().as("count"),
                    Aggregation.sort(Sort.by(Sort.Direction.DESC, "count")));
            List<UserStatisticsDto.IntentCount> intents = new ArrayList<>();
            for (Document bucket : mongoTemplate.aggregate(byIntent, ConversationIndexDocument.class, Document.class)) {
                intents.add(new UserStatisticsDto.IntentCount(bucket.getString("_id"),
                        ((Number) bucket.get("count")).longValue()));
            }
            return new UserStatisticsDto(userId, total, resolved, intents);
        } catch (RuntimeException e) {
            log.error("Failed to compute statistics for user {}: {}", userId, e.getMessage());
            return UserStatisticsDto.empty(userId);
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void setup() {
        var indexOps = mongoTemplate.indexOps(ConversationIndexDocument.class);
        indexOps.ensureIndex(new TextIndexDefinition.TextIndexDefinitionBuilder()
                .onField("messages")
                .named("messages_text")
                .build());
        indexOps.ensureIndex(new Index().on("userId", Sort.Direction.ASC));
        indexOps.ensureIndex(new Index().on("timestamp", Sort.Direction.DESC));
        log.info("Conversation index ready");
    }

    static ConversationIndexDocument toDocument(SearchDocument doc) {
        ConversationIndexDocument d = new ConversationIndexDocument();
        d.setThreadId(doc.threadId());
        d.setSessionId(doc.sessionId());
        d.setUserId(doc.userId());
        d.setIntent(doc.intent());
        d.setOrderId(doc.orderId());
        d.setResolved(doc.resolved());
        d.setAwaitingHumanInput(doc.awaitingExternalInput());
        d.setMessages(doc.messages());
        d.setConversationHistory(doc.turns().stream()
                .map(t -> new ConversationIndexDocument.HistoryEntry(t.getRole(), t.getContent(), t.getTimestamp()))
                .toList());
        d.setTimestamp(doc.timestamp());
        d.setTraceId(doc.traceId());
        return d;
    }

    static SearchDocument fromDocument(ConversationIndexDocument d) {
        List<TurnRecord> turns = d.getConversationHistory() == null ? List.of()
                : d.getConversationHistory().stream()
                        .map(h -> new TurnRecord(h.getRole(), h.getContent(), h.getTimestamp()))
                        .toList();
        return new SearchDocument(d.getThreadId(), d.getSessionId(), d.getUserId(), d.getIntent(),
                d.getOrderId(), d.isResolved(), d.isAwaitingHumanInput(), d.getMessages(), turns,
                d.getTimestamp(), d.getTraceId());
    }
}
