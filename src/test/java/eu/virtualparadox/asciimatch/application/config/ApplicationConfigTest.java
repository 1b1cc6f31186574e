package eu.virtualparadox.asciimatch.application.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationConfigTest {

    @Test
    void defaultsAreValid() {
        final ApplicationConfig props = new ApplicationConfig();
        props.validate();

        assertThat(props.getTieBreaker()).isEqualTo(0.1f);
        assertThat(props.getSubstitutions()).containsEntry("#", " ");
        assertThat(props.effectiveIndexThreads()).isPositive();
    }

    @Test
    void rejectsTieBreakerOutOfRange() {
        final ApplicationConfig props = new ApplicationConfig();
        props.setTieBreaker(1.5f);
        assertThatThrownBy(props::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidShingleWidth() {
        final ApplicationConfig props = new ApplicationConfig();
        props.setShingleWidth(0);
        assertThatThrownBy(props::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void explicitThreadCountWins() {
        final ApplicationConfig props = new ApplicationConfig();
        props.setIndexThreads(3);
        assertThat(props.effectiveIndexThreads()).isEqualTo(3);
    }

    @Test
    void slackResponseHostsDefaultToSlackAndMustNotBeEmpty() {
        final ApplicationConfig props = new ApplicationConfig();
        assertThat(props.getSlack().getResponseHosts()).containsExactly("hooks.slack.com");

        props.getSlack().setResponseHosts(List.of());
        assertThatThrownBy(props::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
