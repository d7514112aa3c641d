package mediagate.gpu.error;

/**
 * Base class for failures raised by the GPU resource manager.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
