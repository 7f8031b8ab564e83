package io.github.amadeusitgroup.chunkedtransfer;

import java.util.Collections;
import java.util.List;

/**
 * Point-in-time health of a running transfer.
 */
public class HealthSnapshot {

    public enum Status {
        EXCELLENT,
        GOOD,
        FAIR,
        POOR,
        CRITICAL;

        public static Status fromScore(int score) {
            if (score >= 90) return EXCELLENT;
            if (score >= 75) return GOOD;
            if (score >= 60) return FAIR;
            if (score >= 40) return POOR;
            return CRITICAL;
        }
    }

    private final int score;
    private final Status status;
    private final List<String> issues;
    private final List<String> recommendations;
    private final long timestamp;

    public HealthSnapshot(int score, List<String> issues, List<String> recommendations, long timestamp) {
        this.score = Math.max(0, Math.min(100, score));
        this.status = Status.fromScore(this.score);
        this.issues = Collections.unmodifiableList(issues);
        this.recommendations = Collections.unmodifiableList(recommendations);
        this.timestamp = timestamp;
    }

    public int getScore() { return score; }
    public Status getStatus() { return status; }
    public List<String> getIssues() { return issues; }
    public List<String> getRecommendations() { return recommendations; }
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("HealthSnapshot{score=%d, status=%s, issues=%s}", score, status, issues);
    }
}
