package mediabot.delivery;

public enum DeliveryOutcome {
    DELIVERED,
    DELIVERED_AS_DOCUMENT,
    FAILED
}
