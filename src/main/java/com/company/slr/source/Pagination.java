package com.company.slr.source;

import lombok.Value;

@Value
public class Pagination {

    int page;
    int perPage;

    // Total number of items (stored rows, or backend buckets) in the requested window
    long total;

    // Null on the last page
    Integer nextNum;

    public static Pagination of(int page, int perPage, long total) {
        Integer next = (long) page * perPage < total ? page + 1 : null;
        return new Pagination(page, perPage, total, next);
    }

    public boolean hasNext() {
        return nextNum != null;
    }
}
