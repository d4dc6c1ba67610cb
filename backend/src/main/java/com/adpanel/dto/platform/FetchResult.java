package com.adpanel.dto.platform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulated rows of a paged fetch. An aborted loop keeps the rows collected so far and carries
 * the error marker; an empty, error-free result is a valid terminal state.
 */
public final class FetchResult<T> {

    private final List<T> items = new ArrayList<>();
    private int pagesFetched;
    private int skipped;
    private boolean ceilingHit;
    private String errorMessage;
    private RuntimeException error;

    public static <T> FetchResult<T> empty() {
        return new FetchResult<>();
    }

    public List<T> getItems() {
        return Collections.unmodifiableList(items);
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    /** Rows dropped at parse time because an id was missing */
    public int getSkipped() {
        return skipped;
    }

    public boolean isCeilingHit() {
        return ceilingHit;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public RuntimeException getError() {
        return error;
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    /** No error and every page was read */
    public boolean isComplete() {
        return !hasError() && !ceilingHit;
    }

    public void add(T item) {
        items.add(item);
    }

    public void pageFetched() {
        pagesFetched++;
    }

    public void skip() {
        skipped++;
    }

    public void markCeilingHit() {
        this.ceilingHit = true;
    }

    public void fail(String message, RuntimeException cause) {
        this.errorMessage = message;
        this.error = cause;
    }

    /** Appends another batch's rows and carries over its markers. */
    public void merge(FetchResult<T> other) {
        items.addAll(other.items);
        pagesFetched += other.pagesFetched;
        skipped += other.skipped;
        ceilingHit |= other.ceilingHit;
        if (other.hasError()) {
            fail(other.errorMessage, other.error);
        }
    }

    @Override
    public String toString() {
        return "FetchResult{items="
                + items.size()
                + ", pages="
                + pagesFetched
                + ", skipped="
                + skipped
                + ", ceilingHit="
                + ceilingHit
                + ", error="
                + errorMessage
                + "}";
    }
}
