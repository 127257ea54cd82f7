package com.sqlgrader.dto;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Question index to raw SQL text, ordered by index.
 */
public class QuerySet {
    private final SortedMap<Integer, String> queries;

    public QuerySet(Map<Integer, String> queries) {
        this.queries = Collections.unmodifiableSortedMap(new TreeMap<>(queries));
    }

    public SortedMap<Integer, String> getQueries() {
        return queries;
    }

    public String get(int index) {
        return queries.get(index);
    }

    public boolean contains(int index) {
        return queries.containsKey(index);
    }

    public int size() {
        return queries.size();
    }
}
