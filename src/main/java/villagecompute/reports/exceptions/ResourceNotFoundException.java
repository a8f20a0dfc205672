package villagecompute.reports.exceptions;

/**
 * Thrown when a schedule, run or tenant row addressed by (org, id) does not exist.
 *
 * <p>
 * Writes raise it when the target row vanished between read and write; REST resources map it to 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException schedule(long orgId, long scheduleId) {
        return new ResourceNotFoundException("schedule " + scheduleId + " not found for org " + orgId);
    }

    public static ResourceNotFoundException run(long orgId, long runId) {
        return new ResourceNotFoundException("run " + runId + " not found for org " + orgId);
    }
}
