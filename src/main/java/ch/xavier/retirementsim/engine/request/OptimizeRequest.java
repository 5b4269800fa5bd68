package ch.xavier.retirementsim.engine.request;

import ch.xavier.retirementsim.simulation.model.SimulationParams;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Getter
@ToString
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptimizeRequest implements EngineRequest {
    private final SimulationParams params;
    private final int baseSeed;
}
