package io.github.drompincen.durableagent.runtime.index;

/** Optional equality filters for a search; a null component does not filter. */
public record SearchFilter(String userId, String intent, Boolean resolved) {

    public static SearchFilter none() {
        return new SearchFilter(null, null, null);
    }

    public static SearchFilter forUser(String userId) {
        return new SearchFilter(userId, null, null);
    }
}
