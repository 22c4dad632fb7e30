package com.calibrationplatform.calibration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalibrationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalibrationServiceApplication.class, args);
    }
}
