package me.toymail.jobsync.classify;

/**
 * A message looked relevant but a required field could not be extracted.
 */
public class ClassificationException extends Exception {
    public ClassificationException(String message) {
        super(message);
    }
}
