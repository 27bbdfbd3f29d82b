package ch.so.arp.finrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinRagApplication.class, args);
    }
}
