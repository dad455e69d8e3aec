package com.example.storyboard_matcher.config;

import com.example.storyboard_matcher.library.FileSceneIndexReader;
import com.example.storyboard_matcher.library.LocalMediaLibrary;
import com.example.storyboard_matcher.library.MediaLibrary;
import com.example.storyboard_matcher.library.SceneIndexReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LibraryProperties.class)
public class LibraryConfig {

    @Bean
    public MediaLibrary mediaLibrary(LibraryProperties props, ObjectMapper objectMapper) {
        return new LocalMediaLibrary(
                Path.of(props.getBaseDir()),
                props.getVideosPrefix(),
                props.getVoicelessPrefix(),
                props.getManifestName(),
                objectMapper);
    }

    @Bean
    public SceneIndexReader sceneIndexReader(LibraryProperties props, ObjectMapper objectMapper) {
        return new FileSceneIndexReader(Path.of(props.getBaseDir()), props.getSceneIndexName(), objectMapper);
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
