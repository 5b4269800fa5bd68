package ch.xavier.retirementsim.engine.request;

import ch.xavier.retirementsim.legacy.model.LegacyParams;
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
public class LegacyRequest implements EngineRequest {
    private final LegacyParams params;
}
