package com.tradingagents.orchestrator.memory;

import com.tradingagents.common.memory.MemoryRecord;
import com.tradingagents.common.model.MemoryCandidate;
import com.tradingagents.common.model.PipelineStage;
import com.tradingagents.orchestrator.graph.TradingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a completed run's memory candidates into reflections once the realized outcome
 * is known. This is the only write path into the memory stores.
 */
@Service
public class ReflectionService {

    private static final Logger log = LoggerFactory.getLogger(ReflectionService.class);

    private final MemoryBank memoryBank;

    public ReflectionService(MemoryBank memoryBank) {
        this.memoryBank = memoryBank;
    }

    /**
     * @param outcome realized result, e.g. "+4.2% over 5 days"
     * @param notes   optional lesson; when blank a reflection is derived from the outcome
     * @throws IllegalArgumentException when {@code outcome} is blank
     * @throws IllegalStateException    when the run is not complete or was already reflected on
     */
    public List<MemoryRecord> recordOutcome(TradingState state, String outcome, String notes) {
        if (outcome == null || outcome.isBlank()) {
            throw new IllegalArgumentException("outcome is required");
        }
        if (state.stage() != PipelineStage.COMPLETE) {
            throw new IllegalStateException("Run " + state.runId() + " is " + state.stage() + ", not COMPLETE");
        }
        if (!state.markOutcomeRecorded()) {
            throw new IllegalStateException("Outcome already recorded for run " + state.runId());
        }

        List<MemoryRecord> written = new ArrayList<>();
        for (MemoryCandidate candidate : state.memoryCandidates()) {
            String reflection = notes != null && !notes.isBlank()
                ? notes.strip()
                : "Decided " + candidate.verdict() + " and the outcome was " + outcome.strip()
                    + ". Reasoning at the time: " + candidate.rationale();
            written.add(memoryBank.store(candidate.scope()).add(candidate.situation(), reflection, outcome.strip()));
        }
        log.info("[ReflectionService] Outcome recorded. runId={} records={} outcome={}",
            state.runId(), written.size(), outcome);
        return written;
    }
}
