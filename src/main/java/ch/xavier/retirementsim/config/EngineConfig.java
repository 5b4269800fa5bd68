package ch.xavier.retirementsim.config;

import ch.xavier.retirementsim.returns.HistoricalReturnRepository;
import ch.xavier.retirementsim.returns.HistoricalReturnSeries;
import ch.xavier.retirementsim.tax.TaxTables;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Immutable reference data shared by every request: the tax tables and the validated historical return series.
 * A broken return table fails the context at startup.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public TaxTables taxTables() {
        return TaxTables.federal2026();
    }

    @Bean
    public HistoricalReturnSeries historicalReturnSeries(HistoricalReturnRepository repository) {
        return repository.loadSeries().block();
    }
}
