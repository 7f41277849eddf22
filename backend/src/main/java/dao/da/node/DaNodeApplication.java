package dao.da.node;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DaNodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DaNodeApplication.class, args);
    }
}
