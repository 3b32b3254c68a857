package com.analyzemyteam.timelinesync;

import com.analyzemyteam.timelinesync.config.properties.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(SyncProperties.class)
@EnableScheduling
public class TimelineSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimelineSyncApplication.class, args);
    }

}
