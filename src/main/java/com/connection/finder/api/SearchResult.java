package com.connection.finder.api;

import com.connection.finder.core.model.CanonicalPerson;
import com.connection.finder.core.model.PersonCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ranked people for a search, highest confidence first, with the statistics of the run.
 */
public class SearchResult {

    private final SearchRequest request;
    private final List<CanonicalPerson> people;
    private final SearchStats stats;

    public SearchResult(SearchRequest request, List<CanonicalPerson> people, SearchStats stats) {
        this.request = Objects.requireNonNull(request, "request is required");
        this.people = Collections.unmodifiableList(new ArrayList<>(people));
        this.stats = Objects.requireNonNull(stats, "stats is required");
    }

    public SearchRequest getRequest() {
        return request;
    }

    public List<CanonicalPerson> getPeople() {
        return people;
    }

    public SearchStats getStats() {
        return stats;
    }

    public int size() {
        return people.size();
    }

    public boolean isEmpty() {
        return people.isEmpty();
    }

    public boolean isPartial() {
        return stats.partial();
    }

    public boolean isFromCache() {
        return stats.fromCache();
    }

    /**
     * Groups the ranked people by category, keeping rank order within each group.
     * Every category is present, possibly with an empty list.
     */
    public Map<PersonCategory, List<CanonicalPerson>> byCategory() {
        Map<PersonCategory, List<CanonicalPerson>> grouped = new EnumMap<>(PersonCategory.class);
        for (PersonCategory category : PersonCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }
        for (CanonicalPerson person : people) {
            grouped.get(person.getCategory()).add(person);
        }
        grouped.replaceAll((category, list) -> Collections.unmodifiableList(list));
        return Collections.unmodifiableMap(grouped);
    }

    /**
     * Returns an independent copy whose people can be mutated without affecting this result.
     */
    public SearchResult copy() {
        return new SearchResult(request, copyPeople(), stats);
    }

    /**
     * Returns a copy flagged as served from the cache, answering {@code servedRequest}
     * rather than the search that populated the entry.
     */
    public SearchResult asCachedFor(SearchRequest servedRequest) {
        return new SearchResult(servedRequest, copyPeople(), stats.withFromCache(true));
    }

    private List<CanonicalPerson> copyPeople() {
        List<CanonicalPerson> copies = new ArrayList<>(people.size());
        for (CanonicalPerson person : people) {
            copies.add(person.copy());
        }
        return copies;
    }

    @Override
    public String toString() {
        return "SearchResult{" +
                "company='" + request.company() + '\'' +
                ", people=" + people.size() +
                ", totalUnique=" + stats.totalUnique() +
                ", partial=" + stats.partial() +
                ", fromCache=" + stats.fromCache() +
                '}';
    }
}
