package org.janelia.hcppost.config;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Study specific filtering, motion and mask parameters.
 */
public class ProjectConfig {

    public static class Builder {
        private Study study;
        private int bandPassOrder;
        private double lowPassHz;
        private double highPassHz;
        private double frameDisplacementThreshold;
        private int expectedContiguousFrameCount;
        private int skipSeconds;
        private double brainRadiusInMm;
        private String motionFilename;
        private ThresholdRange whiteMatterLeft;
        private ThresholdRange whiteMatterRight;
        private ThresholdRange ventricleLeft;
        private ThresholdRange ventricleRight;

        public Builder study(Study study) {
            this.study = study;
            return this;
        }

        public Builder bandPassOrder(int bandPassOrder) {
            this.bandPassOrder = bandPassOrder;
            return this;
        }

        public Builder lowPassHz(double lowPassHz) {
            this.lowPassHz = lowPassHz;
            return this;
        }

        public Builder highPassHz(double highPassHz) {
            this.highPassHz = highPassHz;
            return this;
        }

        public Builder frameDisplacementThreshold(double frameDisplacementThreshold) {
            this.frameDisplacementThreshold = frameDisplacementThreshold;
            return this;
        }

        public Builder expectedContiguousFrameCount(int expectedContiguousFrameCount) {
            this.expectedContiguousFrameCount = expectedContiguousFrameCount;
            return this;
        }

        public Builder skipSeconds(int skipSeconds) {
            this.skipSeconds = skipSeconds;
            return this;
        }

        public Builder brainRadiusInMm(double brainRadiusInMm) {
            this.brainRadiusInMm = brainRadiusInMm;
            return this;
        }

        public Builder motionFilename(String motionFilename) {
            this.motionFilename = motionFilename;
            return this;
        }

        public Builder whiteMatterLeft(ThresholdRange whiteMatterLeft) {
            this.whiteMatterLeft = whiteMatterLeft;
            return this;
        }

        public Builder whiteMatterRight(ThresholdRange whiteMatterRight) {
            this.whiteMatterRight = whiteMatterRight;
            return this;
        }

        public Builder ventricleLeft(ThresholdRange ventricleLeft) {
            this.ventricleLeft = ventricleLeft;
            return this;
        }

        public Builder ventricleRight(ThresholdRange ventricleRight) {
            this.ventricleRight = ventricleRight;
            return this;
        }

        public ProjectConfig build() {
            return new ProjectConfig(this);
        }
    }

    private final Study study;
    private final int bandPassOrder;
    private final double lowPassHz;
    private final double highPassHz;
    private final double frameDisplacementThreshold;
    private final int expectedContiguousFrameCount;
    private final int skipSeconds;
    private final double brainRadiusInMm;
    private final String motionFilename;
    private final ThresholdRange whiteMatterLeft;
    private final ThresholdRange whiteMatterRight;
    private final ThresholdRange ventricleLeft;
    private final ThresholdRange ventricleRight;

    private ProjectConfig(Builder builder) {
        this.study = builder.study;
        this.bandPassOrder = builder.bandPassOrder;
        this.lowPassHz = builder.lowPassHz;
        this.highPassHz = builder.highPassHz;
        this.frameDisplacementThreshold = builder.frameDisplacementThreshold;
        this.expectedContiguousFrameCount = builder.expectedContiguousFrameCount;
        this.skipSeconds = builder.skipSeconds;
        this.brainRadiusInMm = builder.brainRadiusInMm;
        this.motionFilename = builder.motionFilename;
        this.whiteMatterLeft = builder.whiteMatterLeft;
        this.whiteMatterRight = builder.whiteMatterRight;
        this.ventricleLeft = builder.ventricleLeft;
        this.ventricleRight = builder.ventricleRight;
    }

    public Study getStudy() {
        return study;
    }

    public int getBandPassOrder() {
        return bandPassOrder;
    }

    public double getLowPassHz() {
        return lowPassHz;
    }

    public double getHighPassHz() {
        return highPassHz;
    }

    public double getFrameDisplacementThreshold() {
        return frameDisplacementThreshold;
    }

    public int getExpectedContiguousFrameCount() {
        return expectedContiguousFrameCount;
    }

    public int getSkipSeconds() {
        return skipSeconds;
    }

    public double getBrainRadiusInMm() {
        return brainRadiusInMm;
    }

    public String getMotionFilename() {
        return motionFilename;
    }

    public ThresholdRange getWhiteMatterLeft() {
        return whiteMatterLeft;
    }

    public ThresholdRange getWhiteMatterRight() {
        return whiteMatterRight;
    }

    public ThresholdRange getVentricleLeft() {
        return ventricleLeft;
    }

    public ThresholdRange getVentricleRight() {
        return ventricleRight;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("study", study)
                .append("bandPassOrder", bandPassOrder)
                .append("lowPassHz", lowPassHz)
                .append("highPassHz", highPassHz)
                .append("frameDisplacementThreshold", frameDisplacementThreshold)
                .append("motionFilename", motionFilename)
                .toString();
    }
}
