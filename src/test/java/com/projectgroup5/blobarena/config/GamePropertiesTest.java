package com.projectgroup5.blobarena.config;

import com.projectgroup5.blobarena.GameFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GamePropertiesTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> new GameProperties().validate()).doesNotThrowAnyException();
        assertThatCode(() -> GameFixtures.properties().validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsNonPositiveWorld() {
        GameProperties props = new GameProperties();
        props.getWorld().setWidth(0);
        assertThatThrownBy(props::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("game.world");
    }

    @Test
    void validate_rejectsInvertedFoodBounds() {
        GameProperties props = new GameProperties();
        props.getFood().setMinCount(50);
        props.getFood().setMaxCount(10);
        assertThatThrownBy(props::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void validate_rejectsZeroTickRate() {
        GameProperties props = new GameProperties();
        props.getServer().setTickRate(0);
        assertThatThrownBy(props::validate).hasMessageContaining("tick-rate");
    }

    @Test
    void validate_rejectsBrokenSkillSettings() {
        GameProperties props = new GameProperties();
        props.getSkills().getPush().setCooldown(Duration.ofSeconds(-1));
        assertThatThrownBy(props::validate).isInstanceOf(IllegalStateException.class);
    }
}
