package com.jokebot.web.bot;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BotCommandTest {

    @Test
    void slashAndCaseAreNormalized() {
        BotCommand command = BotCommand.parse("  /FREQUENCY   15 ").orElseThrow();

        assertThat(command.getName()).isEqualTo("frequency");
        assertThat(command.getArgument()).isEqualTo("15");
        assertThat(command.isSlashed()).isTrue();
    }

    @Test
    void bareWordIsCommandCandidate() {
        BotCommand command = BotCommand.parse("Enable").orElseThrow();

        assertThat(command.getName()).isEqualTo("enable");
        assertThat(command.hasArgument()).isFalse();
        assertThat(command.isSlashed()).isFalse();
    }

    @Test
    void botMentionIsStripped() {
        assertThat(BotCommand.parse("/status@joke_bot").orElseThrow().getName()).isEqualTo("status");
    }

    @Test
    void blankOrLoneSlashIsIgnored() {
        assertThat(BotCommand.parse("   ")).isEmpty();
        assertThat(BotCommand.parse("/")).isEmpty();
        assertThat(BotCommand.parse(null)).isEmpty();
    }
}
