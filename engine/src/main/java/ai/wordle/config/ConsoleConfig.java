package ai.wordle.config;

import java.util.Scanner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The one reader of standard input. The human player and the console feedback prompt both
 * read through it, so piped input is consumed line by line in the order it was typed.
 */
@Configuration
public class ConsoleConfig {

    @Bean(destroyMethod = "")
    public Scanner consoleScanner() {
        return new Scanner(System.in);
    }
}
