package com.tradingagents.orchestrator.graph;

import com.tradingagents.common.model.AnalystKind;
import com.tradingagents.common.model.AnalystReport;
import com.tradingagents.common.model.Decision;
import com.tradingagents.common.model.DebateTurn;
import com.tradingagents.common.model.MemoryCandidate;
import com.tradingagents.common.model.PipelineStage;
import com.tradingagents.common.model.RunTrace;
import com.tradingagents.orchestrator.debate.DebateTranscript;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one pipeline run.
 *
 * <p>Each field has a single writer: the stage that produces it. Stages run strictly in
 * order, so writes are sequential; readers on other threads (status queries, cancellation)
 * only ever see published values or an immutable {@link #trace()} snapshot.
 */
public class TradingState {

    private final String runId;
    private final String symbol;
    private final LocalDate tradeDate;

    private volatile PipelineStage stage = PipelineStage.CREATED;
    private volatile Map<AnalystKind, AnalystReport> analystReports = Map.of();
    private volatile DebateTranscript researchDebate;
    private volatile Decision researchDecision;
    private volatile Decision traderDecision;
    private volatile DebateTranscript riskDebate;
    private volatile Decision finalDecision;
    private volatile String failure;
    private final List<MemoryCandidate> memoryCandidates = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicBoolean outcomeRecorded = new AtomicBoolean();

    public TradingState(String runId, String symbol, LocalDate tradeDate) {
        this.runId = runId;
        this.symbol = symbol;
        this.tradeDate = tradeDate;
    }

    public String runId() { return runId; }

    public String symbol() { return symbol; }

    public LocalDate tradeDate() { return tradeDate; }

    public PipelineStage stage() { return stage; }

    public Map<AnalystKind, AnalystReport> analystReports() { return analystReports; }

    public Collection<AnalystReport> reports() { return analystReports.values(); }

    public DebateTranscript researchDebate() { return researchDebate; }

    public Decision researchDecision() { return researchDecision; }

    public Decision traderDecision() { return traderDecision; }

    public DebateTranscript riskDebate() { return riskDebate; }

    public Decision finalDecision() { return finalDecision; }

    public List<MemoryCandidate> memoryCandidates() {
        return Collections.unmodifiableList(memoryCandidates);
    }

    public void addMemoryCandidate(MemoryCandidate candidate) {
        memoryCandidates.add(candidate);
    }

    /**
     * Combined analyst findings; used as the situation key for memory retrieval
     * and for the memory candidates written by decision stages.
     */
    public String situationSummary() {
        StringBuilder sb = new StringBuilder();
        for (AnalystReport report : analystReports.values()) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(report.text());
        }
        return sb.toString();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * @return false once the final decision is being synthesized or the run has ended;
     *         an accepted request always ends the run {@code CANCELLED}
     */
    public synchronized boolean requestCancel() {
        if (stage == PipelineStage.FINAL_DECISION || stage.isTerminal()) return false;
        cancelRequested.set(true);
        return true;
    }

    /** @return true the first time only */
    public boolean markOutcomeRecorded() {
        return outcomeRecorded.compareAndSet(false, true);
    }

    /** Snapshot excluding the run id, so identical runs compare equal. */
    public RunTrace trace() {
        return new RunTrace(symbol, tradeDate, stage, analystReports,
            researchDebate == null ? List.of() : researchDebate.partialTurns(),
            researchDecision, traderDecision,
            riskDebate == null ? List.<DebateTurn>of() : riskDebate.partialTurns(),
            finalDecision, List.copyOf(memoryCandidates), failure);
    }

    synchronized void advanceTo(PipelineStage next) {
        this.stage = next;
    }

    void putReports(List<AnalystReport> reports) {
        Map<AnalystKind, AnalystReport> byKind = new EnumMap<>(AnalystKind.class);
        for (AnalystReport r : reports) byKind.put(r.kind(), r);
        this.analystReports = Collections.unmodifiableMap(byKind);
    }

    void setResearchDebate(DebateTranscript transcript) { this.researchDebate = transcript; }

    void setResearchDecision(Decision decision) { this.researchDecision = decision; }

    void setTraderDecision(Decision decision) { this.traderDecision = decision; }

    void setRiskDebate(DebateTranscript transcript) { this.riskDebate = transcript; }

    void setFinalDecision(Decision decision) { this.finalDecision = decision; }

    void fail(String reason) { this.failure = reason; }
}
