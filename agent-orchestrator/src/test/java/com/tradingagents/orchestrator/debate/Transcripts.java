package com.tradingagents.orchestrator.debate;

import com.tradingagents.common.model.DebateRole;
import com.tradingagents.common.model.DebateTurn;

import java.util.List;

/** Builds transcripts for tests outside the debate package. */
public final class Transcripts {

    private Transcripts() {}

    public static DebateTranscript completed(List<DebateRole> roles, List<DebateTurn> turns) {
        DebateTranscript transcript = new DebateTranscript(roles, 1);
        turns.forEach(transcript::append);
        transcript.complete();
        return transcript;
    }

    /** A transcript whose debate is still running. */
    public static DebateTranscript open(List<DebateRole> roles, List<DebateTurn> turns) {
        DebateTranscript transcript = new DebateTranscript(roles, 2);
        turns.forEach(transcript::append);
        return transcript;
    }
}
