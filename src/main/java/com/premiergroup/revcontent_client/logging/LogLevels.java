package com.premiergroup.revcontent_client.logging;

import org.apache.logging.log4j.Level;

public final class LogLevels {

    /**
     * Completed steps. Sits between INFO (400) and WARN (300) so an INFO threshold lets it through.
     */
    public static final Level SUCCESS = Level.forName("SUCCESS", 350);

    private LogLevels() {
    }
}
