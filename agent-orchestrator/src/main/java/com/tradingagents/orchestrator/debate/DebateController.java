package com.tradingagents.orchestrator.debate;

import com.tradingagents.common.config.PipelineConfig;
import com.tradingagents.common.llm.LanguageModelClient;
import com.tradingagents.common.llm.ModelRequest;
import com.tradingagents.common.llm.ModelTier;
import com.tradingagents.common.memory.MemoryStore;
import com.tradingagents.common.memory.ScoredMemory;
import com.tradingagents.common.model.DebateRole;
import com.tradingagents.common.model.DebateTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs a fixed-length, turn-based debate between ordered roles.
 *
 * <p>Every debate runs exactly {@code maxRounds} full rounds; there is no early exit on
 * agreement. Within a round roles speak in the given order, strictly one at a time, and each
 * speaker sees the whole transcript so far plus up to {@code memoryTopK} reflections from
 * similar past situations. A turn that fails to generate is recorded as a placeholder and the
 * debate continues.
 */
@Component
public class DebateController {

    private static final Logger log = LoggerFactory.getLogger(DebateController.class);

    public static final List<DebateRole> RESEARCH_ROLES = List.of(DebateRole.BULL, DebateRole.BEAR);
    public static final List<DebateRole> RISK_ROLES = List.of(DebateRole.RISKY, DebateRole.SAFE, DebateRole.NEUTRAL);

    private static final int MAX_TURN_TOKENS = 1024;

    private final LanguageModelClient model;
    private final PipelineConfig config;
    private final Clock clock;

    public DebateController(LanguageModelClient model, PipelineConfig config, Clock clock) {
        this.model = model;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param cancelled polled before every turn; once true no further turns are taken and the
     *                  transcript is returned {@link TranscriptStatus#CANCELLED}
     */
    public Mono<DebateTranscript> run(List<DebateRole> roles, int maxRounds, DebateContext ctx,
                                      MemoryStore memory, BooleanSupplier cancelled) {
        if (roles.isEmpty()) {
            return Mono.error(new IllegalArgumentException("a debate needs at least one role"));
        }
        DebateTranscript transcript = new DebateTranscript(roles, maxRounds);
        log.info("[DebateController] Starting debate roles={} rounds={} symbol={}", roles, maxRounds, ctx.symbol());

        return Flux.range(1, maxRounds)
            .concatMap(round -> Flux.fromIterable(roles).map(role -> new Slot(round, role)))
            .concatMap(slot -> Mono.defer(() -> cancelled.getAsBoolean()
                ? Mono.<DebateTurn>empty()
                : takeTurn(slot, ctx, transcript, memory)))
            .doOnNext(transcript::append)
            .then(Mono.fromSupplier(() -> {
                if (cancelled.getAsBoolean() && transcript.partialTurns().size() < roles.size() * maxRounds) {
                    transcript.cancel();
                    log.info("[DebateController] Debate cancelled. turns={}", transcript.partialTurns().size());
                } else {
                    transcript.complete();
                    log.info("[DebateController] Debate complete. turns={}", transcript.partialTurns().size());
                }
                return transcript;
            }));
    }

    private Mono<DebateTurn> takeTurn(Slot slot, DebateContext ctx, DebateTranscript transcript, MemoryStore memory) {
        List<ScoredMemory> reflections = memory.retrieve(ctx.situation(), config.memoryTopK());
        ModelRequest request = ModelRequest.simple(slot.role().displayName(), ModelTier.QUICK,
            DebatePrompts.system(slot.role(), ctx),
            DebatePrompts.user(slot.role(), slot.round(), ctx, transcript.renderSoFar(), reflections),
            MAX_TURN_TOKENS);

        return model.generate(request)
            .timeout(config.generationTimeout())
            .map(reply -> {
                String text = reply.text().strip();
                if (text.isEmpty()) {
                    log.warn("[DebateController] Blank argument. role={} round={}", slot.role(), slot.round());
                    return DebateTurn.placeholder(slot.role(), slot.round(), "empty response", clock.instant());
                }
                return DebateTurn.of(slot.role(), slot.round(), text, clock.instant());
            })
            .onErrorResume(e -> {
                log.warn("[DebateController] Turn failed. role={} round={} reason={}",
                    slot.role(), slot.round(), e.getMessage());
                return Mono.just(DebateTurn.placeholder(slot.role(), slot.round(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), clock.instant()));
            });
    }

    private record Slot(int round, DebateRole role) {}
}
