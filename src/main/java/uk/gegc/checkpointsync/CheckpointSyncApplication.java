package uk.gegc.checkpointsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CheckpointSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckpointSyncApplication.class, args);
    }
}
