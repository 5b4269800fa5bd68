package ch.xavier.retirementsim.returns;

import ch.xavier.retirementsim.exception.InvalidSimulationParametersException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ReturnGeneratorFactory {

    @Getter
    private final HistoricalReturnSeries history;

    public ReturnGeneratorFactory(HistoricalReturnSeries history) {
        if (history == null || history.poolSize() == 0) {
            throw new InvalidSimulationParametersException("Cannot build return generators over an empty return series");
        }
        this.history = history;
    }

    /**
     * @param nominalPct   fixed-mode return in percent
     * @param inflationPct used by the real series only
     * @param seed         bootstrap seed
     * @param startYear    first calendar year replayed in historical mode
     * @param glidePath    bond allocation by age, {@code null} for all equity
     * @param startAge     age at the first yielded year, for the glide path
     */
    public ReturnGenerator create(ReturnMode mode, ReturnSeries series, int horizon, double nominalPct,
                                  double inflationPct, int seed, Integer startYear,
                                  BondGlidePath glidePath, int startAge) {
        if (mode == null) {
            log.error("Missing return mode");
            throw new InvalidSimulationParametersException("A return mode is required");
        }
        ReturnSeries effectiveSeries = series == null ? ReturnSeries.NOMINAL : series;

        return switch (mode) {
            case FIXED -> new FixedReturnGenerator(horizon, nominalPct, glidePath, startAge);
            case BOOTSTRAP -> new BootstrapReturnGenerator(history, horizon, effectiveSeries, inflationPct, seed,
                    glidePath, startAge);
            case HISTORICAL -> {
                if (startYear == null) {
                    log.error("Historical return mode requested without a start year");
                    throw new InvalidSimulationParametersException("Historical return mode needs a start year");
                }
                yield new HistoricalReturnGenerator(history, horizon, effectiveSeries, inflationPct, startYear,
                        glidePath, startAge);
            }
        };
    }
}
