package buildinghealth.ml;

import buildinghealth.domain.model.ScoreDirection;
import buildinghealth.domain.model.Threshold;

public class FixedThresholdPolicy implements ThresholdPolicy {

    public static final String NAME = "fixed";

    private final double value;

    public FixedThresholdPolicy(double value) {
        this.value = value;
    }

    @Override
    public Threshold derive(double[] trainingScores, ScoreDirection direction) {
        return new Threshold(value, direction, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }
}
