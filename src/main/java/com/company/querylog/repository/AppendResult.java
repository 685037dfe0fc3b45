package com.company.querylog.repository;

import com.company.querylog.domain.QueryEvent;

import java.util.List;

/**
 * The appended event (carrying its assigned id) and whatever the append evicted, oldest first.
 */
public record AppendResult(QueryEvent event, List<QueryEvent> evicted) {

    public long eventId() {
        return event.getId();
    }
}
