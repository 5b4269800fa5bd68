package ch.xavier.retirementsim.engine.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Anything the engine sends back to the host. Serialised with {@code type} first.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonPropertyOrder("type")
public abstract class EngineMessage {
    private final String type;

    @JsonIgnore
    public boolean isTerminal() {
        return !(this instanceof ProgressMessage);
    }
}
