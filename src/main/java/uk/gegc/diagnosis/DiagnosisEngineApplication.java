package uk.gegc.diagnosis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiagnosisEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiagnosisEngineApplication.class, args);
    }

}
