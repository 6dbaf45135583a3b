package com.phillippitts.streamscribe.service.engine;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EngineLogLevelTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "error: failed to open model                | ERROR",
            "whisper_init_from_file: error: bad magic   | ERROR",
            "failed to read WAV file                    | ERROR",
            "Warning: model is multilingual             | WARN",
            "whisper_model_load: warning: unknown token | WARN",
            "whisper_model_load: loading model          | INFO",
            "main: processing in.wav (16000 samples)    | INFO"
    })
    void classifiesByPrefix(String line, EngineLogLevel expected) {
        assertThat(EngineLogLevel.classify(line)).isEqualTo(expected);
    }

    @Test
    void indentedLinesContinuePreviousEntry() {
        assertThat(EngineLogLevel.classify("    n_vocab = 51864")).isEqualTo(EngineLogLevel.CONT);
        assertThat(EngineLogLevel.classify("\tsecond line")).isEqualTo(EngineLogLevel.CONT);
    }

    @Test
    void indentedErrorIsStillError() {
        assertThat(EngineLogLevel.classify("   error: out of memory")).isEqualTo(EngineLogLevel.ERROR);
    }

    @Test
    void blankLinesAreNone() {
        assertThat(EngineLogLevel.classify(null)).isEqualTo(EngineLogLevel.NONE);
        assertThat(EngineLogLevel.classify("")).isEqualTo(EngineLogLevel.NONE);
        assertThat(EngineLogLevel.classify("   ")).isEqualTo(EngineLogLevel.NONE);
    }
}
