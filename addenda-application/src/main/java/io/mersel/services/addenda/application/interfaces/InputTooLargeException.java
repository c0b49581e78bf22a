package io.mersel.services.addenda.application.interfaces;

/**
 * El documento supera el tamaño máximo permitido; se lanza antes de intentar el parseo.
 */
public class InputTooLargeException extends AddendaProcessingException {

    private final long actualBytes;
    private final long maxBytes;

    public InputTooLargeException(long actualBytes, long maxBytes) {
        super("El documento XML excede el tamaño máximo permitido: "
                + actualBytes + " bytes (máximo " + maxBytes + " bytes)");
        this.actualBytes = actualBytes;
        this.maxBytes = maxBytes;
    }

    public long getActualBytes() {
        return actualBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
