package org.pathrace.search;

/**
 * One immutable frontier entry.
 *
 * @param score priority score; lower is extracted first.
 * @param sequence insertion sequence number, used as the stable tie-breaker.
 * @param item dense node index.
 */
public record FrontierEntry(double score, long sequence, int item) implements Comparable<FrontierEntry> {

    /**
     * Orders by score, then by insertion sequence (earlier first).
     */
    @Override
    public int compareTo(FrontierEntry other) {
        int scoreCompare = Double.compare(this.score, other.score);
        if (scoreCompare != 0) {
            return scoreCompare;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
