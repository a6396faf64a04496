package org.tanzu.vcenterperf;

/**
 * Base class for failures of a collection run.
 *
 * Each failure names the step of the run it came from ("connect", "inventory", ...)
 * and the process exit status it maps to when it ends the run.
 */
public class VCenterPerfException extends RuntimeException {

    /** Exit status for fatal failures without a more specific status */
    public static final int EXIT_FAILURE = 1;

    private final String step;
    private final int exitCode;

    public VCenterPerfException(String step, String message, Throwable cause) {
        this(step, message, cause, EXIT_FAILURE);
    }

    protected VCenterPerfException(String step, String message, Throwable cause, int exitCode) {
        super(message, cause);
        this.step = step;
        this.exitCode = exitCode;
    }

    /**
     * Gets the name of the run step that failed.
     * @return The step name
     */
    public String getStep() { return step; }

    /**
     * Gets the process exit status this failure maps to.
     * @return A non-zero exit status
     */
    public int getExitCode() { return exitCode; }
}
