package eu.nebulouscloud.deployr.model;

import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * The outcome of {@link Matcher#match}: a maximum matching between
 * requested instances and hosts.  Only a complete result, i.e., one that
 * pairs every requested instance, may be turned into a {@link Deployment}.
 */
@Getter
@ToString
public final class MatchResult {

    /** Number of instances in the request. */
    private final int requestedCount;
    /** Pairings of the maximum matching, in request order of instances. */
    private final List<Pairing> pairings;

    public MatchResult(int requestedCount, List<Pairing> pairings) {
        this.requestedCount = requestedCount;
        this.pairings = List.copyOf(pairings);
    }

    public int getMatchedCount() {
        return pairings.size();
    }

    public boolean isComplete() {
        return pairings.size() == requestedCount;
    }
}
