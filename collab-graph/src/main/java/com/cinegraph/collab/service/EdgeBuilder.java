package com.cinegraph.collab.service;

import com.cinegraph.collab.config.CollabGraphProperties;
import com.cinegraph.collab.model.CollaborationType;
import com.cinegraph.collab.model.Credit;
import com.cinegraph.collab.model.EdgeBuildResult;
import com.cinegraph.collab.model.PairCandidate;
import com.cinegraph.collab.model.PersonPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns one work's credit list into canonical person-pair candidates.
 *
 * Only billed performers, directors and allow-listed key crew take part:
 *  - performer/performer  billing order within performerPerformerCap
 *  - performer/director   billing order within performerDirectorCap, every director
 *  - director/director    all directors
 *  - crew/crew and director/crew for allow-listed crew roles
 *
 * The candidate count therefore depends on the caps and the director/crew
 * counts, never on the size of the full credit list. A work with a thousand
 * extras produces the same edges as one without them.
 */
@Component
@Slf4j
public class EdgeBuilder {

    private final int performerPerformerCap;
    private final int performerDirectorCap;
    private final Set<String> keyCrewRoles;

    public EdgeBuilder(CollabGraphProperties properties) {
        CollabGraphProperties.Edges edges = properties.getEdges();
        if (edges.getPerformerPerformerCap() < 0 || edges.getPerformerDirectorCap() < 0) {
            throw new IllegalStateException("Billing caps must not be negative");
        }
        if (edges.getKeyCrewRoles() == null || edges.getKeyCrewRoles().isEmpty()) {
            throw new IllegalStateException("collab-graph.edges.key-crew-roles must list at least one crew role");
        }
        this.performerPerformerCap = edges.getPerformerPerformerCap();
        this.performerDirectorCap = edges.getPerformerDirectorCap();
        this.keyCrewRoles = edges.getKeyCrewRoles().stream()
                .map(EdgeBuilder::normaliseRole)
                .filter(r -> r != null && !r.equals(Credit.PERFORMER) && !r.equals(Credit.DIRECTOR))
                .collect(Collectors.toUnmodifiableSet());
        log.info("Edge policy: performer/performer <= {}, performer/director <= {}, key crew {}",
                performerPerformerCap, performerDirectorCap, keyCrewRoles);
    }

    public EdgeBuildResult build(long workId, List<Credit> credits) {
        Map<Long, Integer> performers = new TreeMap<>();
        Set<Long> directors = new TreeSet<>();
        Map<Long, String> crew = new TreeMap<>();
        int skipped = 0;

        for (Credit credit : credits) {
            if (credit == null || credit.getPersonId() == null) {
                skipped++;
                log.warn("Work {}: skipping credit without person id: {}", workId, credit);
                continue;
            }
            String role = normaliseRole(credit.getRoleKind());
            if (role == null) {
                skipped++;
                log.warn("Work {}: skipping credit for person {} without role", workId, credit.getPersonId());
                continue;
            }

            long personId = credit.getPersonId();
            if (role.equals(Credit.PERFORMER)) {
                if (credit.getBillingOrder() == null) {
                    skipped++;
                    log.warn("Work {}: skipping performer credit for person {} without billing order", workId, personId);
                    continue;
                }
                performers.merge(personId, credit.getBillingOrder(), Math::min);
            } else if (role.equals(Credit.DIRECTOR)) {
                directors.add(personId);
            } else if (keyCrewRoles.contains(role)) {
                crew.merge(personId, role, (a, b) -> a.compareTo(b) <= 0 ? a : b);
            }
        }

        List<Long> leadCast = billedWithin(performers, performerPerformerCap);
        List<Long> directedCast = billedWithin(performers, performerDirectorCap);
        List<Long> directorIds = new ArrayList<>(directors);
        List<Long> crewIds = new ArrayList<>(crew.keySet());

        Candidates out = new Candidates(workId);

        for (int i = 0; i < leadCast.size(); i++) {
            for (int j = i + 1; j < leadCast.size(); j++) {
                out.offer(leadCast.get(i), Credit.PERFORMER, leadCast.get(j), Credit.PERFORMER,
                        CollaborationType.PERFORMER_PERFORMER);
            }
        }
        for (Long performer : directedCast) {
            for (Long director : directorIds) {
                out.offer(performer, Credit.PERFORMER, director, Credit.DIRECTOR,
                        CollaborationType.PERFORMER_DIRECTOR);
            }
        }
        for (int i = 0; i < directorIds.size(); i++) {
            for (int j = i + 1; j < directorIds.size(); j++) {
                out.offer(directorIds.get(i), Credit.DIRECTOR, directorIds.get(j), Credit.DIRECTOR,
                        CollaborationType.DIRECTOR_DIRECTOR);
            }
        }
        for (int i = 0; i < crewIds.size(); i++) {
            for (int j = i + 1; j < crewIds.size(); j++) {
                out.offer(crewIds.get(i), crew.get(crewIds.get(i)), crewIds.get(j), crew.get(crewIds.get(j)),
                        CollaborationType.CREW_CREW);
            }
        }
        for (Long director : directorIds) {
            for (Long member : crewIds) {
                out.offer(director, Credit.DIRECTOR, member, crew.get(member), CollaborationType.DIRECTOR_CREW);
            }
        }

        List<PairCandidate> candidates = List.copyOf(out.byPair.values());
        log.debug("Work {}: {} credits -> {} candidate pairs ({} skipped, {} self-pairs rejected)",
                workId, credits.size(), candidates.size(), skipped, out.rejectedSelfPairs);
        return new EdgeBuildResult(workId, candidates, skipped, out.rejectedSelfPairs);
    }

    static String normaliseRole(String role) {
        if (role == null || role.isBlank()) return null;
        return role.trim().toLowerCase(Locale.ROOT);
    }

    private List<Long> billedWithin(Map<Long, Integer> performers, int cap) {
        return performers.entrySet().stream()
                .filter(e -> e.getValue() <= cap)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /** One candidate per pair; the higher-precedence type wins. */
    private static final class Candidates {

        private final long workId;
        private final Map<PersonPair, PairCandidate> byPair = new TreeMap<>();
        private int rejectedSelfPairs;

        private Candidates(long workId) {
            this.workId = workId;
        }

        private void offer(long a, String roleA, long b, String roleB, CollaborationType type) {
            if (a == b) {
                rejectedSelfPairs++;
                log.debug("Work {}: rejected self-pair for person {} ({} / {})", workId, a, roleA, roleB);
                return;
            }
            PersonPair pair = PersonPair.of(a, b);
            PairCandidate candidate = a < b
                    ? new PairCandidate(pair, type, roleA, roleB)
                    : new PairCandidate(pair, type, roleB, roleA);
            byPair.merge(pair, candidate,
                    (existing, offered) -> offered.type().ordinal() < existing.type().ordinal() ? offered : existing);
        }
    }
}
