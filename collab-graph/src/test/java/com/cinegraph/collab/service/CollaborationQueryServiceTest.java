package com.cinegraph.collab.service;

import com.cinegraph.collab.config.TestProperties;
import com.cinegraph.collab.model.CollaborationFilter;
import com.cinegraph.collab.model.CollaborationPair;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.Collaborator;
import com.cinegraph.collab.model.PathResult;
import com.cinegraph.collab.model.PersonPair;
import com.cinegraph.collab.store.AggregateStore;
import com.cinegraph.collab.store.CreditFeed;
import com.cinegraph.collab.store.GraphReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CollaborationQueryServiceTest {

    @Mock
    private AggregateStore aggregateStore;

    @Mock
    private GraphReader graphReader;

    @Mock
    private PathFinder pathFinder;

    @Mock
    private TrendEngine trendEngine;

    @Mock
    private CreditFeed creditFeed;

    private CollaborationQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new CollaborationQueryService(aggregateStore, graphReader, pathFinder, trendEngine,
                creditFeed, TestProperties.defaults());
    }

    @Test
    void pairStatsLooksUpTheCanonicalPair() {
        when(aggregateStore.findPair(new PersonPair(3, 9))).thenReturn(Optional.empty());

        assertThat(queryService.pairStats(9, 3)).isEmpty();
        verify(aggregateStore).findPair(new PersonPair(3, 9));
    }

    @Test
    void pairStatsForOnePersonIsInvalid() {
        assertThatThrownBy(() -> queryService.pairStats(4, 4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void similarCollaborationsStartFromTheStoredPair() {
        CollaborationPair reference = CollaborationPair.builder().id(5L).personLowId(3).personHighId(9).build();
        CollaborationPair similar = CollaborationPair.builder().id(6L).personLowId(4).personHighId(8).build();
        when(aggregateStore.findPair(new PersonPair(3, 9))).thenReturn(Optional.of(reference));
        when(graphReader.similarPairs(reference, 10)).thenReturn(List.of(similar));

        assertThat(queryService.similarCollaborations(9, 3, 10)).containsExactly(similar);
    }

    @Test
    void similarCollaborationsOfStrangersAreEmpty() {
        when(aggregateStore.findPair(new PersonPair(3, 9))).thenReturn(Optional.empty());

        assertThat(queryService.similarCollaborations(3, 9, 10)).isEmpty();
        verify(graphReader, never()).similarPairs(any(), anyInt());
    }

    @Test
    void topCollaboratorsPassesTheFilterThrough() {
        CollaborationFilter filter = new CollaborationFilter(CollaborationType.PERFORMER_DIRECTOR, "Director", 2);
        when(creditFeed.personExists(7)).thenReturn(true);
        when(graphReader.topCollaborators(7, filter, 5)).thenReturn(List.of(new Collaborator(12, 4)));

        List<Collaborator> top = queryService.topCollaborators(7, filter, 5);

        assertThat(top).containsExactly(new Collaborator(12, 4));
        assertThat(filter.subjectRole()).isEqualTo("director");
    }

    @Test
    void topCollaboratorsWithoutFilterCountsEverything() {
        when(creditFeed.personExists(7)).thenReturn(true);
        when(graphReader.topCollaborators(7, CollaborationFilter.none(), 10)).thenReturn(List.of());

        assertThat(queryService.topCollaborators(7, null, 10)).isEmpty();
    }

    @Test
    void topCollaboratorsOfUnknownPersonIsNotFound() {
        when(creditFeed.personExists(7)).thenReturn(false);

        assertThatThrownBy(() -> queryService.topCollaborators(7, null, 10))
                .isInstanceOf(UnknownPersonException.class);
        verify(graphReader, never()).topCollaborators(anyLong(), any(), anyInt());
    }

    @Test
    void topCollaboratorsNeedsAPositiveLimit() {
        assertThatThrownBy(() -> queryService.topCollaborators(7, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shortestPathUsesTheConfiguredDefaultDepth() {
        PathResult none = PathResult.noPath(1, 2, 6);
        when(pathFinder.shortestPath(1, 2, 6)).thenReturn(none);

        assertThat(queryService.shortestPath(1, 2, null)).isSameAs(none);
    }

    @Test
    void shortestPathHonoursAnExplicitDepth() {
        PathResult none = PathResult.noPath(1, 2, 3);
        when(pathFinder.shortestPath(1, 2, 3)).thenReturn(none);

        assertThat(queryService.shortestPath(1, 2, 3)).isSameAs(none);
    }

    @Test
    void timelineOfUnknownPersonIsNotFound() {
        when(creditFeed.personExists(5)).thenReturn(false);

        assertThatThrownBy(() -> queryService.personTimeline(5)).isInstanceOf(UnknownPersonException.class);
    }
}
