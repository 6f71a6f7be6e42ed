package com.phillippitts.recorderbridge;

import com.phillippitts.recorderbridge.config.properties.AudioCaptureProperties;
import com.phillippitts.recorderbridge.config.properties.RecorderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RecorderProperties.class,
        AudioCaptureProperties.class
})
public class RecorderBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecorderBridgeApplication.class, args);
    }

}
