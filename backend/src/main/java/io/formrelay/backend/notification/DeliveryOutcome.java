package io.formrelay.backend.notification;

/** Result of the single delivery attempt for a submission. {@code error} is null on success. */
public record DeliveryOutcome(boolean delivered, String error) {

  public static DeliveryOutcome success() {
    return new DeliveryOutcome(true, null);
  }

  public static DeliveryOutcome failure(String error) {
    return new DeliveryOutcome(false, error != null && !error.isBlank() ? error : "Unknown error");
  }
}
