package uk.gegc.formbatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormBatchApplication.class, args);
    }
}
