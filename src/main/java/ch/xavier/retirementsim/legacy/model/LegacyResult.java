package ch.xavier.retirementsim.legacy.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Builder
@Getter
@ToString
public class LegacyResult {
    // Years the fund lasted, positive infinity when it is judged to last forever
    private final double years;
    private final double fundLeftReal;
    private final double lastLivingCount;
    private final List<GenerationDataPoint> generationData;

    public boolean isPerpetual() {
        return Double.isInfinite(years);
    }
}
