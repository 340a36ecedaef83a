package fun.fengwk.bmh.cli.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication
public class MonitorCliApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonitorCliApplication.class, args);
    }

}
