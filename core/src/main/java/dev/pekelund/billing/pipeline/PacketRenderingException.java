package dev.pekelund.billing.pipeline;

public class PacketRenderingException extends RuntimeException {

    public PacketRenderingException(String message) {
        super(message);
    }

    public PacketRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
