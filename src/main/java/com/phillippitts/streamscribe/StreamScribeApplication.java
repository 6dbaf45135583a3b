package com.phillippitts.streamscribe;

import com.phillippitts.streamscribe.config.pipeline.PipelineProperties;
import com.phillippitts.streamscribe.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        PipelineProperties.class
})
public class StreamScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamScribeApplication.class, args);
    }

}
