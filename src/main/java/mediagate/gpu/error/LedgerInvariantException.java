package mediagate.gpu.error;

/**
 * An operation would corrupt the allocation ledger (double booking,
 * non-positive size, negative free VRAM). Indicates a programming error.
 */
public class LedgerInvariantException extends GatewayException {

    public LedgerInvariantException(String message) {
        super(message);
    }
}
