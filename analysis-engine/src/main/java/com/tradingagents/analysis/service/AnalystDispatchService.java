package com.tradingagents.analysis.service;

import com.tradingagents.analysis.agent.AnalystAgent;
import com.tradingagents.common.model.AnalystKind;
import com.tradingagents.common.model.AnalystReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fans the enabled analysts out in parallel and waits for every one to settle.
 * A failing analyst contributes an "analysis unavailable" placeholder instead of
 * failing the batch.
 */
@Service
public class AnalystDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AnalystDispatchService.class);
    private final Map<AnalystKind, AnalystAgent> agents = new EnumMap<>(AnalystKind.class);

    public AnalystDispatchService(List<AnalystAgent> agents) {
        for (AnalystAgent agent : agents) {
            this.agents.put(agent.kind(), agent);
        }
    }

    /** Kinds that have a registered analyst. */
    public Set<AnalystKind> availableKinds() {
        return agents.isEmpty() ? Set.of() : Set.copyOf(agents.keySet());
    }

    /**
     * @return one report per enabled kind, ordered by {@link AnalystKind} declaration order
     */
    public Mono<List<AnalystReport>> dispatchAll(String symbol, LocalDate tradeDate,
                                                 Set<AnalystKind> enabled, Set<String> enabledTools) {
        log.info("Dispatching {} analysts in parallel for symbol={} tools={}",
            enabled.size(), symbol, enabledTools.size());
        return Flux.fromIterable(enabled)
            .flatMap(kind -> runOne(kind, symbol, tradeDate, enabledTools))
            .collectSortedList(Comparator.comparing(AnalystReport::kind));
    }

    private Mono<AnalystReport> runOne(AnalystKind kind, String symbol, LocalDate tradeDate,
                                       Set<String> enabledTools) {
        AnalystAgent agent = agents.get(kind);
        if (agent == null) {
            log.warn("No analyst registered for kind={}", kind);
            return Mono.just(AnalystReport.unavailable(kind, "no analyst registered"));
        }
        return Mono.defer(() -> agent.run(symbol, tradeDate, enabledTools))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(report -> log.info("Analyst={} complete. degraded={} toolCalls={}",
                agent.agentName(), report.degraded(), report.toolCalls()))
            .onErrorResume(e -> {
                log.error("Analyst={} failed for symbol={}", agent.agentName(), symbol, e);
                return Mono.just(AnalystReport.unavailable(kind, describe(e)));
            });
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
