package com.phillippitts.slidefollow;

import com.phillippitts.slidefollow.config.audio.AudioCaptureProperties;
import com.phillippitts.slidefollow.config.follow.FollowProperties;
import com.phillippitts.slidefollow.config.recognition.RecognitionProperties;
import com.phillippitts.slidefollow.config.sync.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        FollowProperties.class,
        RecognitionProperties.class,
        AudioCaptureProperties.class,
        SyncProperties.class
})
public class SlideFollowApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlideFollowApplication.class, args);
    }

}
