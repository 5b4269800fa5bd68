package ch.xavier.retirementsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetirementSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetirementSimulatorApplication.class, args);
    }
}
