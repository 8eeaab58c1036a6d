package io.tabsense.config;

/**
 * Partial settings change; {@code null} fields keep their current value.
 */
public record SettingsUpdate(
        Boolean autoOptimization,
        Boolean predictiveBrowsing,
        Boolean learningMode,
        Double confidenceThreshold,
        Integer maxConcurrentTasks
) {
    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return autoOptimization == null
                && predictiveBrowsing == null
                && learningMode == null
                && confidenceThreshold == null
                && maxConcurrentTasks == null;
    }

    public static final class Builder {
        private Boolean autoOptimization;
        private Boolean predictiveBrowsing;
        private Boolean learningMode;
        private Double confidenceThreshold;
        private Integer maxConcurrentTasks;

        private Builder() {
        }

        public Builder autoOptimization(Boolean value) {
            this.autoOptimization = value;
            return this;
        }

        public Builder predictiveBrowsing(Boolean value) {
            this.predictiveBrowsing = value;
            return this;
        }

        public Builder learningMode(Boolean value) {
            this.learningMode = value;
            return this;
        }

        public Builder confidenceThreshold(Double value) {
            this.confidenceThreshold = value;
            return this;
        }

        public Builder maxConcurrentTasks(Integer value) {
            this.maxConcurrentTasks = value;
            return this;
        }

        public SettingsUpdate build() {
            return new SettingsUpdate(autoOptimization, predictiveBrowsing, learningMode, confidenceThreshold, maxConcurrentTasks);
        }
    }
}
