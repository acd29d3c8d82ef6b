package com.cinegraph.collab.store;

import com.cinegraph.collab.model.Credit;
import com.cinegraph.collab.model.Work;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the upstream catalog this service builds from.
 */
public interface CreditFeed {

    Optional<Work> findWork(long workId);

    List<Credit> creditsFor(long workId);

    /** Every work eligible for edge generation, ascending. */
    List<Long> allWorkIds();

    boolean personExists(long personId);
}
