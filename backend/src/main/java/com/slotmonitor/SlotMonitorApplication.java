package com.slotmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlotMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlotMonitorApplication.class, args);
    }
}
