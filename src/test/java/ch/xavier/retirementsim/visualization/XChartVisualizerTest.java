package ch.xavier.retirementsim.visualization;

import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.PercentileBands;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.knowm.xchart.XYChart;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XChartVisualizerTest {

    private final XChartVisualizer visualizer = new XChartVisualizer();

    private static BatchResult result() {
        return BatchResult.builder()
                .pathCount(3)
                .ages(new int[]{65, 66, 67})
                .realBalances(PercentileBands.builder()
                        .p10(new double[]{800_000, 700_000, 600_000})
                        .p25(new double[]{900_000, 850_000, 800_000})
                        .p50(new double[]{1_000_000, 1_000_000, 1_000_000})
                        .p75(new double[]{1_100_000, 1_150_000, 1_200_000})
                        .p90(new double[]{1_200_000, 1_300_000, 1_400_000})
                        .build())
                .build();
    }

    @Test
    @DisplayName("The band chart plots the median between the 10th and 90th percentiles")
    void createBalanceBandChart_threeSeries() {
        XYChart chart = visualizer.createBalanceBandChart(result(), "Real balance");

        assertEquals("Real balance", chart.getTitle());
        assertThat(chart.getSeriesMap()).containsOnlyKeys(
                XChartVisualizer.P10_SERIES, XChartVisualizer.P50_SERIES, XChartVisualizer.P90_SERIES);
        assertThat(chart.getSeriesMap().get(XChartVisualizer.P50_SERIES).getXData()).containsExactly(65.0, 66.0, 67.0);
    }

    @Test
    @DisplayName("Charts are written as PNG files, creating the directory")
    void save_writesPng(@TempDir Path tempDir) throws Exception {
        Path directory = tempDir.resolve("charts");

        Path written = visualizer.save(visualizer.createBalanceBandChart(result(), "Real balance"), directory, "bands");

        assertEquals(directory.resolve("bands.png"), written);
        assertTrue(Files.size(written) > 0);
    }
}
