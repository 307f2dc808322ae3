package com.questrail.vcd.config;

import com.questrail.vcd.model.Timescale;
import com.questrail.vcd.observability.NullObservabilitySink;
import com.questrail.vcd.observability.VcdObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the dump parser.
 *
 * @param defaultTimescale  timescale assumed when the dump declares none
 * @param vectorExtension   padding policy for short vector values
 * @param maxLines          upper bound on input lines; 0 means unbounded
 * @param observabilitySink receiver for diagnostics and completion events
 */
public record VcdParserConfig(
    Timescale defaultTimescale,
    VectorExtension vectorExtension,
    int maxLines,
    VcdObservabilitySink observabilitySink
) {
    public VcdParserConfig {
        Objects.requireNonNull(defaultTimescale, "defaultTimescale");
        Objects.requireNonNull(vectorExtension, "vectorExtension");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (maxLines < 0) {
            throw new IllegalArgumentException("maxLines must be non-negative");
        }
    }

    public static VcdParserConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isLineLimited() {
        return maxLines > 0;
    }

    public static final class Builder {
        private Timescale defaultTimescale = Timescale.DEFAULT;
        private VectorExtension vectorExtension = VectorExtension.ZERO;
        private int maxLines = 0;
        private VcdObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withDefaultTimescale(Timescale defaultTimescale) {
            this.defaultTimescale = defaultTimescale;
            return this;
        }

        public Builder withVectorExtension(VectorExtension vectorExtension) {
            this.vectorExtension = vectorExtension;
            return this;
        }

        public Builder withMaxLines(int maxLines) {
            this.maxLines = maxLines;
            return this;
        }

        public Builder withObservabilitySink(VcdObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public VcdParserConfig build() {
            return new VcdParserConfig(defaultTimescale, vectorExtension, maxLines, observabilitySink);
        }
    }
}
