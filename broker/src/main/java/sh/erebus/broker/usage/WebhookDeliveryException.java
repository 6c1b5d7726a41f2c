package sh.erebus.broker.usage;

import lombok.Getter;

@Getter
public class WebhookDeliveryException extends RuntimeException {
    private final int status;

    public WebhookDeliveryException(int status, String body) {
        super("Webhook answered " + status + (body.isEmpty() ? "" : ": " + body));
        this.status = status;
    }
}
