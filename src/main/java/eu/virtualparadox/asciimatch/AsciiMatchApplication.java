package eu.virtualparadox.asciimatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AsciiMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AsciiMatchApplication.class, args);
    }
}
