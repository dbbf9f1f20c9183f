package com.qualitylens.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Optional measurements attached to a {@link Violation}.
 *
 * <p>All numeric fields are nullable; only the ones relevant to the sub-check that
 * produced the violation are populated.
 *
 * @param complexity cyclomatic complexity (unit or combined)
 * @param methodCount number of units in the container
 * @param dependencyCount number of distinct dependencies or concerns
 * @param parameterCount number of parameters of a unit
 * @param lineCount lines of code
 * @param concerns distinct concern identifiers
 * @param containerCount number of containers in the file
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViolationMetrics(
    @JsonProperty("complexity") Integer complexity,
    @JsonProperty("methodCount") Integer methodCount,
    @JsonProperty("dependencies") Integer dependencyCount,
    @JsonProperty("parameters") Integer parameterCount,
    @JsonProperty("linesOfCode") Integer lineCount,
    @JsonProperty("importConcerns") List<String> concerns,
    @JsonProperty("classCount") Integer containerCount
) {
    public ViolationMetrics {
        concerns = concerns == null ? null : List.copyOf(concerns);
    }

    /**
     * Returns a builder with all fields unset.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing ViolationMetrics with only the relevant fields.
     */
    public static class Builder {
        private Integer complexity;
        private Integer methodCount;
        private Integer dependencyCount;
        private Integer parameterCount;
        private Integer lineCount;
        private List<String> concerns;
        private Integer containerCount;

        public Builder complexity(int value) {
            this.complexity = value;
            return this;
        }

        public Builder methodCount(int value) {
            this.methodCount = value;
            return this;
        }

        public Builder dependencyCount(int value) {
            this.dependencyCount = value;
            return this;
        }

        public Builder parameterCount(int value) {
            this.parameterCount = value;
            return this;
        }

        public Builder lineCount(int value) {
            this.lineCount = value;
            return this;
        }

        public Builder concerns(List<String> value) {
            this.concerns = value;
            return this;
        }

        public Builder containerCount(int value) {
            this.containerCount = value;
            return this;
        }

        public ViolationMetrics build() {
            return new ViolationMetrics(
                complexity,
                methodCount,
                dependencyCount,
                parameterCount,
                lineCount,
                concerns,
                containerCount
            );
        }
    }
}
