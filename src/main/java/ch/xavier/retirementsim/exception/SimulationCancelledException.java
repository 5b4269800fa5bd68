package ch.xavier.retirementsim.exception;

public class SimulationCancelledException extends RuntimeException {
    public SimulationCancelledException(String message) {
        super(message);
    }
}
