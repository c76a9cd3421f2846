package io.github.drompincen.durableagent.runtime.index;

import io.github.drompincen.durableagent.protocol.api.UserStatisticsDto;

import java.util.List;

/** Stands in when search is switched off or its backing store is unreachable. */
public class DisabledSearchIndex implements SearchIndex {

    @Override
    public void upsert(SearchDocument doc) {
    }

    @Override
    public List<SearchDocument> search(String query, SearchFilter filter, int limit) {
        return List.of();
    }

    @Override
    public UserStatisticsDto aggregate(String userId) {
        return UserStatisticsDto.empty(userId);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public void setup() {
    }
}
