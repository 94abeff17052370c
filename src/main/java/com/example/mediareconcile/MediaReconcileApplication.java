package com.example.mediareconcile;

import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.common.config.AppMatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AppLibraryProperties.class,
        AppMatchProperties.class
})
public class MediaReconcileApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaReconcileApplication.class, args);
    }
}
