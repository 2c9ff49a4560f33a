package ai.wordle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the word list.
 *
 * The location is any Spring resource string, e.g. {@code classpath:words.txt} or
 * {@code file:/data/wordle.txt}. The file holds one word per line; order is kept.
 */
@Component
@ConfigurationProperties(prefix = "dictionary")
public class DictionaryProperties {
    private String location = "classpath:words.txt";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
