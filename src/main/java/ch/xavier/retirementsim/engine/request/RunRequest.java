package ch.xavier.retirementsim.engine.request;

import ch.xavier.retirementsim.simulation.model.SimulationParams;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Getter
@ToString
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunRequest implements EngineRequest {
    private final SimulationParams params;
    private final int baseSeed;

    // Falls back to the configured default path count
    @JsonProperty("N")
    private final Integer pathCount;
}
