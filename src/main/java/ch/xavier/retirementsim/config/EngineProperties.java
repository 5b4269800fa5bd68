package ch.xavier.retirementsim.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "retirement.engine")
public class EngineProperties {
    // Simulation horizon
    private int lifeExpectancy = 95;

    // Batch
    private int defaultPathCount = 2000;
    private double trimFraction = 0.025; // Per tail, before percentiles
    private int progressInterval = 50; // Completed paths between progress messages

    private Returns returns = new Returns();
    private Optimizer optimizer = new Optimizer();

    @Getter
    @Setter
    public static class Returns {
        private String resource = "historical/sp500-annual-returns.csv";
        private int startYear = 1928;
        private int endYear = 2024;
        private double capPct = 15.0; // Sampled returns clamped to +/- this
        private boolean augmentWithHalfValues = true;
    }

    @Getter
    @Setter
    public static class Optimizer {
        private double successThreshold = 0.95;
        private int testRuns = 400; // Reduced path count for each oracle batch
        private int maxIterations = 50;
        private double contributionTolerance = 100.0;
        private double expenditureTolerance = 1000.0;
        private double expenditureCeiling = 5_000_000.0;
        private double expenditureLiquidShare = 0.95;
    }
}
