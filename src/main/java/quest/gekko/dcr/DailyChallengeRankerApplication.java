package quest.gekko.dcr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DailyChallengeRankerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyChallengeRankerApplication.class, args);
    }

}
