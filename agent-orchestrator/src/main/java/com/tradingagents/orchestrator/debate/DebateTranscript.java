package com.tradingagents.orchestrator.debate;

import com.tradingagents.common.model.DebateRole;
import com.tradingagents.common.model.DebateTurn;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered record of one debate. Turns are appended while {@link TranscriptStatus#OPEN};
 * the full transcript is readable only once the debate is {@link TranscriptStatus#COMPLETE}.
 */
public class DebateTranscript {

    private final List<DebateRole> roles;
    private final int maxRounds;
    private final List<DebateTurn> turns = new CopyOnWriteArrayList<>();
    private volatile TranscriptStatus status = TranscriptStatus.OPEN;

    public DebateTranscript(List<DebateRole> roles, int maxRounds) {
        this.roles = List.copyOf(roles);
        this.maxRounds = maxRounds;
    }

    public List<DebateRole> roles() { return roles; }

    public int maxRounds() { return maxRounds; }

    public TranscriptStatus status() { return status; }

    void append(DebateTurn turn) {
        if (status != TranscriptStatus.OPEN) {
            throw new IllegalStateException("Cannot append to a " + status + " transcript");
        }
        turns.add(turn);
    }

    void complete() {
        status = TranscriptStatus.COMPLETE;
    }

    void cancel() {
        status = TranscriptStatus.CANCELLED;
    }

    /**
     * @throws IllegalStateException unless the debate completed
     */
    public List<DebateTurn> turns() {
        if (status != TranscriptStatus.COMPLETE) {
            throw new IllegalStateException("Transcript is " + status + "; use partialTurns()");
        }
        return List.copyOf(turns);
    }

    /** Turns recorded so far, whatever the status. */
    public List<DebateTurn> partialTurns() {
        return List.copyOf(turns);
    }

    /**
     * Finished transcript as plain text, one "Speaker: argument" paragraph per turn.
     *
     * @throws IllegalStateException unless the debate completed
     */
    public String render() {
        return format(turns());
    }

    /** History handed to the next speaker while the debate is still running. */
    String renderSoFar() {
        return format(partialTurns());
    }

    private static String format(List<DebateTurn> turns) {
        StringBuilder sb = new StringBuilder();
        for (DebateTurn turn : turns) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(turn.role().displayName()).append(" (round ").append(turn.round()).append("): ")
                .append(turn.text());
        }
        return sb.toString();
    }
}
