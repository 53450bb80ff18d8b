package uk.gegc.boxbilling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BoxBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoxBillingApplication.class, args);
    }
}
