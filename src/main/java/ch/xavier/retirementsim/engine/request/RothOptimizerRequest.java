package ch.xavier.retirementsim.engine.request;

import ch.xavier.retirementsim.optimization.model.RothOptimizerParams;
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
public class RothOptimizerRequest implements EngineRequest {
    private final RothOptimizerParams params;
}
