package ch.xavier.retirementsim.tax;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class IrmaaTier {
    private final double magiThreshold;
    private final double monthlySurcharge;
}
