package uk.gegc.examimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExamImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamImportApplication.class, args);
    }
}
