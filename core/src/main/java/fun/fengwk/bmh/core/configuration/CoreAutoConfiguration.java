package fun.fengwk.bmh.core.configuration;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;

/**
 * Registers the core beans for any application that has this module on its classpath.
 *
 * @author fengwk
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ComponentScan(basePackages = "fun.fengwk.bmh.core")
public class CoreAutoConfiguration {

}
