package ch.xavier.retirementsim.returns;

import ch.xavier.retirementsim.config.EngineProperties;
import ch.xavier.retirementsim.exception.HistoricalDataIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the annual equity return table shipped on the classpath.
 */
@Repository
@Slf4j
public class HistoricalReturnRepository {

    private final EngineProperties.Returns properties;

    public HistoricalReturnRepository(EngineProperties engineProperties) {
        this.properties = engineProperties.getReturns();
    }

    public Flux<AnnualReturn> findAll() {
        ClassPathResource resource = new ClassPathResource(properties.getResource());

        return Flux.using(
                        () -> new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)),
                        reader -> Flux.fromStream(reader.lines()),
                        reader -> {
                            try {
                                reader.close();
                            } catch (IOException e) {
                                throw new UncheckedIOException(e);
                            }
                        })
                .skip(1) // header
                .filter(line -> !line.isBlank())
                .map(AnnualReturn::from)
                .onErrorMap(IOException.class, e -> new HistoricalDataIntegrityException(
                        "Cannot read historical returns from " + properties.getResource(), e));
    }

    /**
     * Loads the table and checks it against the declared year range before building the sampling pool.
     */
    public Mono<HistoricalReturnSeries> loadSeries() {
        return findAll()
                .collectList()
                .map(returns -> HistoricalReturnSeries.of(returns,
                        properties.getStartYear(),
                        properties.getEndYear(),
                        properties.getCapPct(),
                        properties.isAugmentWithHalfValues()))
                .doOnNext(series -> log.info("Loaded {} annual returns ({}-{}), sampling pool of {} values",
                        series.getYearCount(), series.getStartYear(), series.getEndYear(), series.poolSize()));
    }
}
