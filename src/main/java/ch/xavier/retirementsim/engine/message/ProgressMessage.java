package ch.xavier.retirementsim.engine.message;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ProgressMessage extends EngineMessage {
    private final int completed;
    private final int total;

    public ProgressMessage(int completed, int total) {
        super("progress");
        this.completed = completed;
        this.total = total;
    }
}
