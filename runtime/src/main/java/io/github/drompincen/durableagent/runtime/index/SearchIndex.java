package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.protocol.api.UserStatisticsDto;

import java.util.List;

/**
 * Secondary, searchable copy of completed conversations. Never a source of truth: documents are
 * overwritten on every upsert and may lag behind the checkpoint store.
 */
public interface SearchIndex {

    /** Inserts or replaces the document of {@code doc.threadId()}. Failures propagate to the caller. */
    void upsert(SearchDocument doc);

    /**
     * Conversations whose text contains every term of {@code query} (all conversations when the query
     * is blank), newest first. Returns an empty list when the index cannot be queried.
     */
    List<SearchDocument> search(String query, SearchFilter filter, int limit);

    UserStatisticsDto aggregate(String userId);

    boolean isAvailable();

    void setup();
}
