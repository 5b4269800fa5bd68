package ch.xavier.retirementsim.engine;

import ch.xavier.retirementsim.TestFixtures;
import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.engine.message.EngineMessage;
import ch.xavier.retirementsim.engine.message.ErrorMessage;
import ch.xavier.retirementsim.engine.message.ProgressMessage;
import ch.xavier.retirementsim.engine.message.ResultMessage;
import ch.xavier.retirementsim.engine.request.GuardrailsRequest;
import ch.xavier.retirementsim.engine.request.LegacyRequest;
import ch.xavier.retirementsim.engine.request.RunRequest;
import ch.xavier.retirementsim.legacy.GenerationalWealthSimulator;
import ch.xavier.retirementsim.optimization.GoalSeekOptimizer;
import ch.xavier.retirementsim.optimization.GuardrailsEstimator;
import ch.xavier.retirementsim.optimization.RothConversionOptimizer;
import ch.xavier.retirementsim.optimization.model.GuardrailsResult;
import ch.xavier.retirementsim.returns.ReturnMode;
import ch.xavier.retirementsim.simulation.MonteCarloService;
import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.PathSummary;
import ch.xavier.retirementsim.simulation.model.SimulationParams;
import ch.xavier.retirementsim.tax.RmdCalculator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimulationEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimulationEngine engine;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setProgressInterval(10);
        properties.getOptimizer().setTestRuns(10);
        MonteCarloService monteCarloService = TestFixtures.monteCarloService(properties);

        engine = new SimulationEngine(monteCarloService,
                new GoalSeekOptimizer(monteCarloService, properties),
                new GuardrailsEstimator(),
                new RothConversionOptimizer(TestFixtures.taxCalculator(), new RmdCalculator(TestFixtures.TABLES), properties),
                new GenerationalWealthSimulator(TestFixtures.TABLES),
                properties,
                objectMapper);
    }

    private static SimulationParams household() {
        return SimulationParams.builder()
                .age1(55)
                .retirementAge(60)
                .taxableBalance(500_000)
                .pretaxBalance(500_000)
                .returnMode(ReturnMode.BOOTSTRAP)
                .build();
    }

    @Test
    @DisplayName("A run streams progress and ends with exactly one complete message")
    void submit_run_progressThenComplete() {
        List<EngineMessage> messages = engine.submit(RunRequest.builder()
                        .params(household())
                        .baseSeed(12345)
                        .pathCount(25)
                        .build())
                .collectList()
                .block(Duration.ofSeconds(30));

        assertEquals(4, messages.size());
        assertThat(messages.subList(0, 3))
                .allMatch(message -> message instanceof ProgressMessage)
                .extracting(message -> ((ProgressMessage) message).getCompleted())
                .containsExactly(10, 20, 25);

        EngineMessage last = messages.get(3);
        assertEquals("complete", last.getType());
        BatchResult result = (BatchResult) ((ResultMessage<?>) last).getResult();
        assertEquals(25, result.getPathCount());
    }

    @Test
    @DisplayName("Invalid parameters end the stream with a single error message")
    void submit_invalidParams_error() {
        RunRequest request = RunRequest.builder()
                .params(household().toBuilder().retirementAge(50).build())
                .pathCount(10)
                .build();

        StepVerifier.create(engine.submit(request))
                .assertNext(message -> {
                    ErrorMessage error = assertInstanceOf(ErrorMessage.class, message);
                    assertThat(error.getMessage()).contains("Retirement age (50)");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("A request without params is rejected")
    void submit_missingParams_error() {
        StepVerifier.create(engine.submit(LegacyRequest.builder().build()))
                .assertNext(message -> assertEquals("Request is missing its params",
                        ((ErrorMessage) message).getMessage()))
                .verifyComplete();
    }

    @Test
    @DisplayName("Guardrails are estimated from summaries the host sends back")
    void submit_guardrails() {
        GuardrailsRequest request = GuardrailsRequest.builder()
                .allRuns(List.of(
                        PathSummary.builder().survivalYears(30).build(),
                        PathSummary.builder().ruined(true).survivalYears(4).build()))
                .build();

        StepVerifier.create(engine.submit(request))
                .assertNext(message -> {
                    assertEquals("guardrails-complete", message.getType());
                    GuardrailsResult result = (GuardrailsResult) ((ResultMessage<?>) message).getResult();
                    assertEquals(0.5, result.getBaselineSuccessRate(), 1e-9);
                    assertEquals(0.875, result.getNewSuccessRate(), 1e-9);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Cancelling a run stops it without a terminal message")
    void submit_cancelled() {
        RunRequest request = RunRequest.builder().params(household()).pathCount(100_000).build();

        StepVerifier.create(engine.submit(request))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("JSON requests are answered with JSON messages, type first")
    void submitJson_legacy() throws Exception {
        String request = """
                {"type": "legacy", "params": {"eolNominal": 10000000, "yearsFrom2025": 0, "nominalRet": 7,
                 "inflPct": 2.5, "perBenReal": 10000, "startBens": 2, "totalFertilityRate": 2.0,
                 "marital": "married"}}
                """;

        List<String> replies = engine.submitJson(request).collectList().block(Duration.ofSeconds(10));

        assertEquals(1, replies.size());
        assertTrue(replies.get(0).startsWith("{\"type\":\"legacy-complete\""));
        JsonNode result = objectMapper.readTree(replies.get(0)).get("result");
        assertEquals(2, result.get("lastLivingCount").asDouble());
    }

    @Test
    @DisplayName("A JSON run accepts N for the path count")
    void submitJson_run() throws Exception {
        String request = """
                {"type": "run", "baseSeed": 7, "N": 5,
                 "params": {"age1": 50, "retirementAge": 55, "taxableBalance": 800000, "returnMode": "fixed"}}
                """;

        List<String> replies = engine.submitJson(request).collectList().block(Duration.ofSeconds(30));

        JsonNode last = objectMapper.readTree(replies.get(replies.size() - 1));
        assertEquals("complete", last.get("type").asText());
        assertEquals(5, last.get("result").get("pathCount").asInt());
        assertEquals(5, last.get("result").get("allRuns").size());
    }

    @Test
    @DisplayName("Explicit nulls for defaulted fields come back as a readable error")
    void submitJson_nullChildrenAges() throws Exception {
        String request = """
                {"type": "run", "N": 5,
                 "params": {"age1": 50, "retirementAge": 55, "taxableBalance": 800000, "childrenAges": null}}
                """;

        List<String> replies = engine.submitJson(request).collectList().block(Duration.ofSeconds(10));

        assertEquals(1, replies.size());
        JsonNode reply = objectMapper.readTree(replies.get(0));
        assertEquals("error", reply.get("type").asText());
        assertThat(reply.get("message").asText()).contains("childrenAges");
    }

    @Test
    @DisplayName("Unreadable and unknown requests yield a single error message")
    void submitJson_badRequests() throws Exception {
        List<String> malformed = engine.submitJson("{not json").collectList().block(Duration.ofSeconds(5));
        List<String> unknown = engine.submitJson("{\"type\": \"teleport\"}").collectList().block(Duration.ofSeconds(5));

        assertEquals(1, malformed.size());
        assertEquals("error", objectMapper.readTree(malformed.get(0)).get("type").asText());
        assertEquals(1, unknown.size());
        assertEquals("error", objectMapper.readTree(unknown.get(0)).get("type").asText());
    }
}
