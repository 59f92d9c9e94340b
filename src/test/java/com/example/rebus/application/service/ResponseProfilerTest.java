package com.example.rebus.application.service;

import com.example.rebus.domain.model.ResponseProfile;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for response format statistics.
 */
class ResponseProfilerTest {

    private final ResponseProfiler profiler = new ResponseProfiler();

    @Test
    void profileCountsEachFormat() {
        List<String> responses = Arrays.asList(
                "**bold** answer",
                "\"quoted\"",
                "{{{x y}}}",
                "The answer is x",
                "this idiom",
                "x".repeat(60),
                null
        );

        ResponseProfile profile = profiler.profile(responses);

        assertThat(profile.samples()).isEqualTo(6);
        assertThat(profile.withBoldText()).isEqualTo(1);
        assertThat(profile.withQuotes()).isEqualTo(1);
        assertThat(profile.withBracketMarker()).isEqualTo(1);
        assertThat(profile.withAnswerKeyword()).isEqualTo(1);
        assertThat(profile.withIdiomKeyword()).isEqualTo(1);
        assertThat(profile.withExplanation()).isEqualTo(1);
        assertThat(profile.averageLength()).isEqualTo(19.5);
    }

    @Test
    void profileOfNothingIsEmpty() {
        assertThat(profiler.profile(null)).isEqualTo(ResponseProfile.empty());
        assertThat(profiler.profile(List.of())).isEqualTo(ResponseProfile.empty());
    }
}
