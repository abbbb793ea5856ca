package com.microservices.learningservice.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SlugUtilTest {

    @Test
    void slugifiesTitles() {
        assertThat(SlugUtil.slugify("Intro to Python")).isEqualTo("intro-to-python");
        assertThat(SlugUtil.slugify("  Java: The Good Parts!  ")).isEqualTo("java-the-good-parts");
        assertThat(SlugUtil.slugify("Crème brûlée 101")).isEqualTo("creme-brulee-101");
        assertThat(SlugUtil.slugify("--a  -- b--")).isEqualTo("a-b");
    }

    @Test
    void appendsCounterOnCollision() {
        Set<String> taken = new HashSet<>();
        String first = SlugUtil.uniqueSlug("Intro to Python", 250, taken::contains);
        taken.add(first);
        String second = SlugUtil.uniqueSlug("Intro to Python", 250, taken::contains);
        taken.add(second);
        String third = SlugUtil.uniqueSlug("Intro to Python", 250, taken::contains);

        assertThat(first).isEqualTo("intro-to-python");
        assertThat(second).isEqualTo("intro-to-python-1");
        assertThat(third).isEqualTo("intro-to-python-2");
    }

    @Test
    void fallsBackWhenTitleHasNoSluggableCharacters() {
        assertThat(SlugUtil.uniqueSlug("日本語", 250, s -> false)).isEqualTo("course");
    }

    @Test
    void truncatesLongTitlesLeavingRoomForSuffix() {
        String slug = SlugUtil.uniqueSlug("a".repeat(300), 250, s -> false);
        assertThat(slug).hasSize(240);
    }
}
