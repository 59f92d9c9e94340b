package com.example.rebus.infrastructure.results;

import com.example.rebus.domain.model.Sample;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a run's {@code results.json} as written by the experiment runner.
 * Older runs name the identifier {@code image_id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResultRecord(
        @JsonProperty("id") @JsonAlias("image_id") String id,
        @JsonProperty("ground_truth") String groundTruth,
        @JsonProperty("prediction") String prediction
) {

    public Sample toSample() {
        return new Sample(id, groundTruth, prediction);
    }
}
