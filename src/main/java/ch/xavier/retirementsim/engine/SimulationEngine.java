package ch.xavier.retirementsim.engine;

import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.engine.message.EngineMessage;
import ch.xavier.retirementsim.engine.message.ErrorMessage;
import ch.xavier.retirementsim.engine.message.ProgressMessage;
import ch.xavier.retirementsim.engine.message.ResultMessage;
import ch.xavier.retirementsim.engine.request.EngineRequest;
import ch.xavier.retirementsim.engine.request.GuardrailsRequest;
import ch.xavier.retirementsim.engine.request.LegacyRequest;
import ch.xavier.retirementsim.engine.request.OptimizeRequest;
import ch.xavier.retirementsim.engine.request.RothOptimizerRequest;
import ch.xavier.retirementsim.engine.request.RunRequest;
import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import ch.xavier.retirementsim.legacy.GenerationalWealthSimulator;
import ch.xavier.retirementsim.optimization.GoalSeekOptimizer;
import ch.xavier.retirementsim.optimization.GuardrailsEstimator;
import ch.xavier.retirementsim.optimization.RothConversionOptimizer;
import ch.xavier.retirementsim.simulation.CancellationToken;
import ch.xavier.retirementsim.simulation.MonteCarloService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for hosts. Each request yields a cold stream: zero or more {@code progress} messages followed by
 * exactly one result or {@code error} message. Work runs on Reactor schedulers, never on the subscriber's
 * thread, and disposing the subscription cancels it.
 */
@Service
@Slf4j
public class SimulationEngine {

    private final MonteCarloService monteCarloService;
    private final GoalSeekOptimizer goalSeekOptimizer;
    private final GuardrailsEstimator guardrailsEstimator;
    private final RothConversionOptimizer rothConversionOptimizer;
    private final GenerationalWealthSimulator generationalWealthSimulator;
    private final EngineProperties properties;
    private final ObjectMapper objectMapper;

    public SimulationEngine(MonteCarloService monteCarloService,
                            GoalSeekOptimizer goalSeekOptimizer,
                            GuardrailsEstimator guardrailsEstimator,
                            RothConversionOptimizer rothConversionOptimizer,
                            GenerationalWealthSimulator generationalWealthSimulator,
                            EngineProperties properties,
                            ObjectMapper objectMapper) {
        this.monteCarloService = monteCarloService;
        this.goalSeekOptimizer = goalSeekOptimizer;
        this.guardrailsEstimator = guardrailsEstimator;
        this.rothConversionOptimizer = rothConversionOptimizer;
        this.generationalWealthSimulator = generationalWealthSimulator;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Flux<EngineMessage> submit(EngineRequest request) {
        return Flux.create(sink -> {
            CancellationToken cancellationToken = new CancellationToken();

            Disposable work = dispatch(request, sink, cancellationToken)
                    .subscribe(
                            result -> {
                                sink.next(result);
                                sink.complete();
                            },
                            error -> {
                                if (!cancellationToken.isCancelled()) {
                                    log.error("Request {} failed: {}", requestType(request), error.getMessage(), error);
                                }
                                sink.next(ErrorMessage.from(error));
                                sink.complete();
                            });

            sink.onDispose(() -> {
                cancellationToken.cancel();
                work.dispose();
            });
        });
    }

    /**
     * JSON facade over {@link #submit(EngineRequest)}. A request that cannot be parsed yields a single
     * {@code error} message.
     */
    public Flux<String> submitJson(String json) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, EngineRequest.class))
                .flatMapMany(this::submit)
                .onErrorResume(error -> {
                    log.error("Rejected unreadable request: {}", error.getMessage());
                    return Flux.just(ErrorMessage.from(error));
                })
                .map(this::toJson);
    }

    private Mono<? extends EngineMessage> dispatch(EngineRequest request, FluxSink<EngineMessage> sink,
                                                   CancellationToken cancellationToken) {
        if (request instanceof RunRequest run) {
            int pathCount = run.getPathCount() != null ? run.getPathCount() : properties.getDefaultPathCount();
            log.info("Running {} paths with base seed {}", pathCount, run.getBaseSeed());
            return requireParams(run.getParams())
                    .then(monteCarloService.runBatch(run.getParams(), run.getBaseSeed(), pathCount,
                            (completed, total) -> sink.next(new ProgressMessage(completed, total)),
                            cancellationToken))
                    .map(ResultMessage::complete);
        } else if (request instanceof OptimizeRequest optimize) {
            return requireParams(optimize.getParams())
                    .then(goalSeekOptimizer.optimize(optimize.getParams(), optimize.getBaseSeed(), cancellationToken))
                    .map(ResultMessage::optimizeComplete);
        } else if (request instanceof GuardrailsRequest guardrails) {
            return Mono.fromCallable(() -> guardrailsEstimator.estimate(guardrails.getAllRuns(),
                            guardrails.getSpendingReduction()))
                    .subscribeOn(Schedulers.parallel())
                    .map(ResultMessage::guardrailsComplete);
        } else if (request instanceof RothOptimizerRequest roth) {
            return requireParams(roth.getParams())
                    .then(Mono.fromCallable(() -> rothConversionOptimizer.optimize(roth.getParams())))
                    .subscribeOn(Schedulers.parallel())
                    .map(ResultMessage::rothOptimizerComplete);
        } else if (request instanceof LegacyRequest legacy) {
            return requireParams(legacy.getParams())
                    .then(Mono.fromCallable(() -> generationalWealthSimulator.simulate(legacy.getParams())))
                    .subscribeOn(Schedulers.parallel())
                    .map(ResultMessage::legacyComplete);
        }

        log.error("Unsupported request: {}", request);
        return Mono.error(new InvalidSimulationParametersException("Unsupported request: " + requestType(request)));
    }

    private static Mono<Void> requireParams(Object params) {
        return params == null
                ? Mono.error(new InvalidSimulationParametersException("Request is missing its params"))
                : Mono.empty();
    }

    private String toJson(EngineMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialise {} message", message.getType(), e);
            throw new IllegalStateException("Could not serialise " + message.getType() + " message", e);
        }
    }

    private static String requestType(EngineRequest request) {
        return request != null ? request.getClass().getSimpleName() : "null";
    }
}
