package com.premiergroup.revcontent_client;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RevcontentClientApplication {

    public static void main(String[] args) {
        loadDotenv();
        SpringApplication.run(RevcontentClientApplication.class, args);
    }

    /**
     * Exposes {@code .env} entries as system properties; real environment variables win.
     */
    static void loadDotenv() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
            if (System.getenv(entry.getKey()) == null && System.getProperty(entry.getKey()) == null) {
                System.setProperty(entry.getKey(), entry.getValue());
            }
        });
    }
}
