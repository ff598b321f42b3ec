package tech.andrefsramos.offer_tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OfferTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfferTrackerApplication.class, args);
    }
}
