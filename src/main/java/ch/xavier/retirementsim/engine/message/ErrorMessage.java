package ch.xavier.retirementsim.engine.message;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ErrorMessage extends EngineMessage {
    private final String message;

    public ErrorMessage(String message) {
        super("error");
        this.message = message;
    }

    public static ErrorMessage from(Throwable error) {
        String message = error.getMessage();
        return new ErrorMessage(message != null ? message : error.getClass().getSimpleName());
    }
}
