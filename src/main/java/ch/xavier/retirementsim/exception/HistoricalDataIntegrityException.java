package ch.xavier.retirementsim.exception;

public class HistoricalDataIntegrityException extends RuntimeException {
    public HistoricalDataIntegrityException(String message) {
        super(message);
    }

    public HistoricalDataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
