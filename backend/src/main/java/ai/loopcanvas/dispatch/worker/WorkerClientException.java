package ai.loopcanvas.dispatch.worker;

/**
 * A worker call did not reach the queue or the queue could not serve it
 */
public class WorkerClientException extends RuntimeException {

    public WorkerClientException(String message) {
        super(message);
    }

    public WorkerClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
