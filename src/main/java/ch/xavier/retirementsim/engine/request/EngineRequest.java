package ch.xavier.retirementsim.engine.request;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A command sent by the host. The {@code type} property selects the concrete request.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RunRequest.class, name = "run"),
        @JsonSubTypes.Type(value = LegacyRequest.class, name = "legacy"),
        @JsonSubTypes.Type(value = GuardrailsRequest.class, name = "guardrails"),
        @JsonSubTypes.Type(value = RothOptimizerRequest.class, name = "roth-optimizer"),
        @JsonSubTypes.Type(value = OptimizeRequest.class, name = "optimize")
})
public interface EngineRequest {
}
