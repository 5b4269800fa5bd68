package ch.xavier.retirementsim.exception;

public class InvalidSimulationParametersException extends RuntimeException {
    public InvalidSimulationParametersException(String message) {
        super(message);
    }
}
