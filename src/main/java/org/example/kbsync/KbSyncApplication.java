package org.example.kbsync;

import org.example.kbsync.config.DotenvInitializer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KbSyncApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(KbSyncApplication.class);
        app.addInitializers(new DotenvInitializer());
        app.run(args);
    }
}
