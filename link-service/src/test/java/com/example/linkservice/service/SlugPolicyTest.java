package com.example.linkservice.service;

import com.example.linkservice.exception.InvalidSlugException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlugPolicyTest {

    private final SlugPolicy slugPolicy = new SlugPolicy();

    @Test
    void generatedSlugUsesUnambiguousAlphabet() {
        String slug = slugPolicy.generate();

        assertThat(slug).hasSize(SlugPolicy.GENERATED_LENGTH);
        assertThat(slug.chars()).allMatch(c -> SlugPolicy.ALPHABET.indexOf(c) >= 0);
    }

    @Test
    void generateUniqueRetriesOnCollision() {
        AtomicInteger calls = new AtomicInteger();

        String slug = slugPolicy.generateUnique(candidate -> calls.incrementAndGet() == 1);

        assertThat(slug).isNotBlank();
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void generateUniqueGivesUpAfterMaxAttempts() {
        assertThatThrownBy(() -> slugPolicy.generateUnique(candidate -> true))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("3 attempts");
    }

    @Test
    void normalizeTrimsAndLowercases() {
        assertThat(slugPolicy.normalize("  My-Link_1 ")).isEqualTo("my-link_1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"dashboard", "API", "has space", "ünïcode", " "})
    void normalizeRejectsReservedOrMalformed(String slug) {
        assertThatThrownBy(() -> slugPolicy.normalize(slug))
                .isInstanceOf(InvalidSlugException.class);
    }

    @Test
    void rejectsTooLong() {
        assertThat(slugPolicy.isValid("a".repeat(51))).isFalse();
        assertThat(slugPolicy.isValid("a".repeat(50))).isTrue();
    }
}
