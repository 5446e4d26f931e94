package edu.stanford.futuredata.tallyserve.query;

import edu.stanford.futuredata.tallyserve.index.InvertedIndex;
import edu.stanford.futuredata.tallyserve.index.ScoreRange;

import java.util.Objects;

/**
 * The index an expression resolved to, how exactly it matches the expression, and an optional score range that
 * narrows its candidates further.
 */
public final class Resolution {

    private final InvertedIndex index;
    private final Exactness exactness;
    private final ScoreRange scoreRange;

    public Resolution(InvertedIndex index, Exactness exactness, ScoreRange scoreRange) {
        this.index = Objects.requireNonNull(index);
        this.exactness = Objects.requireNonNull(exactness);
        this.scoreRange = scoreRange != null && index.isOrderedBy(scoreRange.getColumn()) ? scoreRange : null;
    }

    public InvertedIndex getIndex() {
        return index;
    }

    public Exactness getExactness() {
        return exactness;
    }

    /** A range over the index's scores that contains every match, or null. */
    public ScoreRange getScoreRange() {
        return scoreRange;
    }

    @Override
    public String toString() {
        return String.format("%s %s%s", index, exactness, scoreRange == null ? "" : " " + scoreRange);
    }
}
