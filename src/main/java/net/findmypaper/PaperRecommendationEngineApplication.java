/**
 * Main application class for findmypaper
 *
 * Features:
 * - Non-web Spring Boot application driven by command-line options
 * - Recommendation runs are executed by the command runner
 */

package net.findmypaper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaperRecommendationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperRecommendationEngineApplication.class, args);
    }
}
