package com.project.image.comparison;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ApplicationTest {
    @Test
    void positionalArguments_selectCommandLineMode() {
        assertThat(Application.isCommandLineRun(new String[]{"a.png", "b.png", "--cad"})).isTrue();
        assertThat(Application.isCommandLineRun(new String[]{"--server.port=9090"})).isFalse();
        assertThat(Application.isCommandLineRun(new String[0])).isFalse();
    }
}
