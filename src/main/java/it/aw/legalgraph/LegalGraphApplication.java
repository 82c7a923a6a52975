package it.aw.legalgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalGraphApplication.class, args);
    }
}
