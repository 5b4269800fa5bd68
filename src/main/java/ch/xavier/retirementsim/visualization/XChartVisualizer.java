package ch.xavier.retirementsim.visualization;

import ch.xavier.retirementsim.simulation.model.BatchResult;
import ch.xavier.retirementsim.simulation.model.PercentileBands;
import lombok.extern.slf4j.Slf4j;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.Styler;
import org.knowm.xchart.style.markers.SeriesMarkers;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

@Service
@Slf4j
public class XChartVisualizer {

    static final String P10_SERIES = "10th percentile";
    static final String P50_SERIES = "Median";
    static final String P90_SERIES = "90th percentile";

    /**
     * Real balance by age: the median path between the 10th and 90th percentile bands.
     */
    public XYChart createBalanceBandChart(BatchResult result, String title) {
        XYChart chart = new XYChartBuilder()
                .width(900)
                .height(500)
                .title(title)
                .xAxisTitle("Age")
                .yAxisTitle("Real balance ($)")
                .build();

        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNW);
        chart.getStyler().setDefaultSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Line);
        chart.getStyler().setYAxisDecimalPattern("#,###");

        double[] ages = Arrays.stream(result.getAges()).asDoubleStream().toArray();
        PercentileBands bands = result.getRealBalances();

        addBand(chart, P90_SERIES, ages, bands.getP90(), Color.GREEN);
        addBand(chart, P50_SERIES, ages, bands.getP50(), Color.BLUE);
        addBand(chart, P10_SERIES, ages, bands.getP10(), Color.RED);

        return chart;
    }

    private void addBand(XYChart chart, String name, double[] ages, double[] values, Color color) {
        XYSeries series = chart.addSeries(name, ages, values);
        series.setMarker(SeriesMarkers.NONE);
        series.setLineColor(color);
    }

    /**
     * Writes the chart as {@code <directory>/<name>.png}, creating the directory if needed.
     */
    public Path save(XYChart chart, Path directory, String name) {
        Path target = directory.resolve(name + ".png");
        try {
            Files.createDirectories(directory);
            BitmapEncoder.saveBitmap(chart, target.toString(), BitmapEncoder.BitmapFormat.PNG);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write chart " + target, e);
        }
        log.info("Saved chart to {}", target);
        return target;
    }
}
