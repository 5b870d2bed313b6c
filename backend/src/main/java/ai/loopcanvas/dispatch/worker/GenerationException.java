package ai.loopcanvas.dispatch.worker;

/**
 * Generation failed for this attempt; the message is reported to the queue as the job error.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
