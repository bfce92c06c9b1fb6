package edu.brandeis.cosi103a.schedule.runner;

/**
 * Thrown when a run cannot start: bad flags, an unsupported league or a missing source file.
 */
public class ScheduleConfigurationException extends RuntimeException {
    public ScheduleConfigurationException(String message) {
        super(message);
    }

    public ScheduleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
