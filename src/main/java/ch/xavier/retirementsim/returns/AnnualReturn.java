package ch.xavier.retirementsim.returns;

import ch.xavier.retirementsim.exception.HistoricalDataIntegrityException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class AnnualReturn {
    private int year;

    // Total return in percent, dividends reinvested
    private double totalReturnPct;

    public static AnnualReturn from(String csvLine) {
        String[] columns = csvLine.split(",");
        if (columns.length != 2) {
            throw new HistoricalDataIntegrityException("Malformed historical return row: '" + csvLine + "'");
        }

        try {
            return AnnualReturn.builder()
                    .year(Integer.parseInt(columns[0].trim()))
                    .totalReturnPct(Double.parseDouble(columns[1].trim()))
                    .build();
        } catch (NumberFormatException e) {
            throw new HistoricalDataIntegrityException("Unparsable historical return row: '" + csvLine + "'", e);
        }
    }
}
